package com.gillianbc.forensicloss.service;

import com.gillianbc.forensicloss.exception.InvalidConfigException;
import com.gillianbc.forensicloss.model.ActiveStatus;
import com.gillianbc.forensicloss.model.AssumptionChoice;
import com.gillianbc.forensicloss.model.Assumptions;
import com.gillianbc.forensicloss.model.AuditLog;
import com.gillianbc.forensicloss.model.Citation;
import com.gillianbc.forensicloss.model.CitedValue;
import com.gillianbc.forensicloss.model.Decimals;
import com.gillianbc.forensicloss.model.LifeExpectancyResult;
import com.gillianbc.forensicloss.model.Person;
import com.gillianbc.forensicloss.model.PipelineStage;
import com.gillianbc.forensicloss.model.WorkLifeMethod;
import com.gillianbc.forensicloss.model.WorkLifeResult;
import com.gillianbc.forensicloss.model.WorkLifeResult.Basis;
import com.gillianbc.forensicloss.tables.ReferenceTables;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Expected remaining years in the labour force, never more than remaining life years.
 * <p>
 * Rules, first match wins:
 * <ol>
 *     <li>inactive person: zero years, nothing looked up</li>
 *     <li>work-life override: the override, clamped to life expectancy</li>
 *     <li>retirement-age-hint method: hint minus current age (floored at zero), clamped</li>
 *     <li>table method: participation factor for (age bracket, sex, education) times life expectancy</li>
 * </ol>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkLifeExpectancyResolver {

    private final ReferenceTables tables;

    public WorkLifeResult resolve(LifeExpectancyResult lifeExpectancy, Person person, Assumptions assumptions,
                                  AuditLog audit) {
        Objects.requireNonNull(lifeExpectancy, "lifeExpectancy must not be null");
        Objects.requireNonNull(person, "person must not be null");
        Objects.requireNonNull(assumptions, "assumptions must not be null");
        Objects.requireNonNull(audit, "audit must not be null");

        BigDecimal lifeYears = lifeExpectancy.getRemainingYears();

        if (person.getActiveStatus() == ActiveStatus.INACTIVE) {
            log.debug("Person is inactive; work-life is zero");
            return new WorkLifeResult(BigDecimal.ZERO, lifeYears, Basis.INACTIVE, null, false, null);
        }

        AssumptionChoice choice = assumptions.workLifeYears();
        if (choice instanceof AssumptionChoice.UserOverride override) {
            Citation citation = Citation.userOverride("workLifeOverrideYears");
            audit.record(PipelineStage.WORK_LIFE, "Remaining work-life (years)", override.value(),
                    citation.sourceLabel(), citation.locator());
            return clamped(override.value(), lifeYears, Basis.OVERRIDE, null, citation);
        }

        if (assumptions.getWorkLifeMethod() == WorkLifeMethod.RETIREMENT_AGE_HINT) {
            BigDecimal hint = assumptions.getRetirementAgeHint();
            if (hint == null) {
                throw new InvalidConfigException(PipelineStage.WORK_LIFE, "assumptions.retirementAgeHint",
                        "is required when the work-life method is " + WorkLifeMethod.RETIREMENT_AGE_HINT.getCode());
            }
            Citation citation = Citation.caseInput("assumptions.retirementAgeHint");
            audit.record(PipelineStage.WORK_LIFE, "Retirement age hint", hint,
                    citation.sourceLabel(), citation.locator());
            BigDecimal years = hint.subtract(lifeExpectancy.getAge(), Decimals.MATH_CONTEXT).max(BigDecimal.ZERO);
            return clamped(years, lifeYears, Basis.RETIREMENT_AGE_HINT, null, citation);
        }

        int age = lifeExpectancy.getAge().setScale(0, RoundingMode.FLOOR).intValueExact();
        CitedValue factor = tables.workLife().lookup(age, person.getSex(), person.getEducationLevel());
        audit.record(PipelineStage.WORK_LIFE, "Participation factor at age " + age + " ("
                + person.getSex().getCode() + ", " + person.getEducationLevel().getCode() + ")", factor);
        BigDecimal years = factor.value().multiply(lifeYears, Decimals.MATH_CONTEXT);
        return clamped(years, lifeYears, Basis.TABLE, factor.value(), factor.citation());
    }

    private static WorkLifeResult clamped(BigDecimal years, BigDecimal lifeYears, Basis basis,
                                          BigDecimal participationFactor, Citation citation) {
        boolean clamp = years.compareTo(lifeYears) > 0;
        BigDecimal workLifeYears = clamp ? lifeYears : years;
        if (clamp) {
            log.info("Work-life of {} years exceeds remaining life of {} years; clamped", years, lifeYears);
        }
        log.debug("Work-life resolved from {}: {} years", basis, workLifeYears);
        return new WorkLifeResult(workLifeYears, lifeYears, basis, participationFactor, clamp, citation);
    }
}
