package com.gillianbc.forensicloss.service;

import com.gillianbc.forensicloss.config.ForensicLossProperties;
import com.gillianbc.forensicloss.model.Assumptions;
import com.gillianbc.forensicloss.model.AuditLog;
import com.gillianbc.forensicloss.model.CaseConfig;
import com.gillianbc.forensicloss.model.CaseResult;
import com.gillianbc.forensicloss.model.DiscountFactorSchedule;
import com.gillianbc.forensicloss.model.EarningsSchedule;
import com.gillianbc.forensicloss.model.GrowthSchedule;
import com.gillianbc.forensicloss.model.LifeExpectancyResult;
import com.gillianbc.forensicloss.model.Occupation;
import com.gillianbc.forensicloss.model.Person;
import com.gillianbc.forensicloss.model.PresentValueResult;
import com.gillianbc.forensicloss.model.WorkLifeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Runs the loss pipeline for one case: life expectancy, work-life, wage growth, earnings,
 * discounting and present value, in that order.
 * <p>
 * Holds no per-run state. Each call creates its own audit log, so concurrent calls do not
 * interfere; the reference tables behind the stages are read-only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForensicLossService {

    private final LifeExpectancyResolver lifeExpectancyResolver;
    private final WorkLifeExpectancyResolver workLifeExpectancyResolver;
    private final WageGrowthProjector wageGrowthProjector;
    private final EarningsProjector earningsProjector;
    private final DiscountingEngine discountingEngine;
    private final ForensicLossProperties properties;

    /**
     * @return the complete, immutable result
     * @throws com.gillianbc.forensicloss.exception.ForensicLossException if the input is invalid or a
     *                                                                    table has no row for a required key
     */
    public CaseResult run(CaseConfig config) {
        CaseConfigValidator.validate(config);

        Person person = config.getPerson();
        Occupation occupation = config.getOccupation();
        Assumptions assumptions = config.getAssumptions();
        int evaluationYear = person.getEvaluationDate().getYear();
        log.info("Running case {} (SOC {}, evaluation date {})", config.getCaseId(), occupation.getSocCode(),
                person.getEvaluationDate());

        AuditLog audit = new AuditLog();

        BigDecimal age = LifeExpectancyResolver.ageInYears(person.getDateOfBirth(), person.getEvaluationDate());
        LifeExpectancyResult lifeExpectancy =
                lifeExpectancyResolver.resolve(age, person.getSex(), assumptions.lifeExpectancy(), audit);

        WorkLifeResult workLife = workLifeExpectancyResolver.resolve(lifeExpectancy, person, assumptions, audit);

        int horizon = WageGrowthProjector.horizonFor(workLife.getWorkLifeYears());
        GrowthSchedule growth = wageGrowthProjector.project(evaluationYear, horizon, occupation.majorGroup(),
                assumptions.wageGrowthRate(), audit);

        EarningsSchedule earnings = earningsProjector.project(occupation, growth, workLife.getWorkLifeYears(),
                person.getEvaluationDate(), audit);

        DiscountFactorSchedule discountFactors = discountingEngine.discountFactors(earnings,
                assumptions.discountRate(), properties.getDiscountRateSeries(), evaluationYear, audit);
        PresentValueResult presentValue = discountingEngine.presentValue(earnings, discountFactors);

        CaseResult result = new CaseResult(config, age, lifeExpectancy, workLife, growth, earnings,
                discountFactors, presentValue, audit.freeze());
        log.info("Case {}: life expectancy {} years, work-life {} years, total economic loss {}",
                config.getCaseId(), lifeExpectancy.getRemainingYears(), workLife.getWorkLifeYears(),
                result.getTotalLoss());
        return result;
    }
}
