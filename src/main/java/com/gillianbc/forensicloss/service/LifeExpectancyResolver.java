package com.gillianbc.forensicloss.service;

import com.gillianbc.forensicloss.exception.InvalidAgeException;
import com.gillianbc.forensicloss.model.AssumptionChoice;
import com.gillianbc.forensicloss.model.AuditLog;
import com.gillianbc.forensicloss.model.Citation;
import com.gillianbc.forensicloss.model.CitedValue;
import com.gillianbc.forensicloss.model.Decimals;
import com.gillianbc.forensicloss.model.LifeExpectancyResult;
import com.gillianbc.forensicloss.model.LifeExpectancyResult.InterpolationRow;
import com.gillianbc.forensicloss.model.PipelineStage;
import com.gillianbc.forensicloss.model.Sex;
import com.gillianbc.forensicloss.tables.MortalityTable;
import com.gillianbc.forensicloss.tables.ReferenceTables;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * Remaining life expectancy at a (possibly fractional) age.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LifeExpectancyResolver {

    private static final MathContext MATH_CONTEXT = Decimals.MATH_CONTEXT;

    private final ReferenceTables tables;

    /**
     * Age in years between two dates, counting 365.25 days per year.
     *
     * @param dateOfBirth    date of birth
     * @param evaluationDate date of death or evaluation, not before the date of birth
     * @return fractional age in years
     */
    public static BigDecimal ageInYears(LocalDate dateOfBirth, LocalDate evaluationDate) {
        Objects.requireNonNull(dateOfBirth, "dateOfBirth must not be null");
        Objects.requireNonNull(evaluationDate, "evaluationDate must not be null");
        long days = ChronoUnit.DAYS.between(dateOfBirth, evaluationDate);
        return BigDecimal.valueOf(days).divide(Decimals.DAYS_PER_YEAR, MATH_CONTEXT);
    }

    /**
     * Resolves remaining life years.
     * <p>
     * With an override the value is used verbatim and cited as a user override. Otherwise the two
     * integer-age rows bracketing {@code age} are read and interpolated linearly on the fractional
     * part; each row read is cited. A whole-number age reads a single row.
     *
     * @throws InvalidAgeException if age is negative, or beyond the table's last age when the table is used
     */
    public LifeExpectancyResult resolve(BigDecimal age, Sex sex, AssumptionChoice choice, AuditLog audit) {
        Objects.requireNonNull(age, "age must not be null");
        Objects.requireNonNull(sex, "sex must not be null");
        Objects.requireNonNull(choice, "choice must not be null");
        Objects.requireNonNull(audit, "audit must not be null");

        if (age.signum() < 0) {
            throw new InvalidAgeException(age, "must be >= 0");
        }

        if (choice instanceof AssumptionChoice.UserOverride override) {
            Citation citation = Citation.userOverride("lifeExpectancyOverrideYears");
            audit.record(PipelineStage.LIFE_EXPECTANCY, "Remaining life expectancy (years)",
                    override.value(), citation.sourceLabel(), citation.locator());
            log.debug("Life expectancy overridden: {} years", override.value());
            return new LifeExpectancyResult(age, override.value(), true, citation, List.of());
        }

        MortalityTable mortality = tables.mortality();
        int maxAge = mortality.maxAge(sex);
        if (age.compareTo(BigDecimal.valueOf(maxAge)) > 0) {
            throw new InvalidAgeException(age, "exceeds the table maximum of " + maxAge);
        }

        int lowerAge = age.setScale(0, RoundingMode.FLOOR).intValueExact();
        BigDecimal fraction = age.subtract(BigDecimal.valueOf(lowerAge), MATH_CONTEXT);

        CitedValue lower = mortality.lookup(lowerAge, sex);
        audit.record(PipelineStage.LIFE_EXPECTANCY,
                "Expectation of life at age " + lowerAge + " (" + sex.getCode() + ")", lower);

        if (fraction.signum() == 0) {
            InterpolationRow row = new InterpolationRow(lowerAge, lower.value(), BigDecimal.ONE, lower.citation());
            return new LifeExpectancyResult(age, lower.value(), false, lower.citation(), List.of(row));
        }

        // fraction > 0 and age <= maxAge, so lowerAge + 1 <= maxAge
        CitedValue upper = mortality.lookup(lowerAge + 1, sex);
        audit.record(PipelineStage.LIFE_EXPECTANCY,
                "Expectation of life at age " + (lowerAge + 1) + " (" + sex.getCode() + ")", upper);

        BigDecimal lowerWeight = BigDecimal.ONE.subtract(fraction, MATH_CONTEXT);
        BigDecimal remaining = lower.value().multiply(lowerWeight, MATH_CONTEXT)
                .add(upper.value().multiply(fraction, MATH_CONTEXT), MATH_CONTEXT);
        if (remaining.signum() < 0) {
            remaining = BigDecimal.ZERO;
        }
        log.debug("Life expectancy at age {}: {} years (rows {} and {})", age, remaining, lowerAge, lowerAge + 1);

        return new LifeExpectancyResult(age, remaining, false, lower.citation(), List.of(
                new InterpolationRow(lowerAge, lower.value(), lowerWeight, lower.citation()),
                new InterpolationRow(lowerAge + 1, upper.value(), fraction, upper.citation())));
    }
}
