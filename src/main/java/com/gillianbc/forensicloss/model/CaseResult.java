package com.gillianbc.forensicloss.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;

/**
 * Everything a case run produced: each intermediate schedule, the frozen audit trail and
 * the total economic loss.
 */
@Getter
@EqualsAndHashCode
@ToString
public class CaseResult {

    @NonNull private final CaseConfig config;
    @NonNull private final BigDecimal ageAtEvaluation;
    @NonNull private final LifeExpectancyResult lifeExpectancy;
    @NonNull private final WorkLifeResult workLife;
    @NonNull private final GrowthSchedule growthSchedule;
    @NonNull private final EarningsSchedule earnings;
    @NonNull private final DiscountFactorSchedule discountFactors;
    @NonNull private final PresentValueResult presentValue;
    @NonNull private final List<AuditEntry> auditEntries;

    public CaseResult(@NonNull CaseConfig config,
                      @NonNull BigDecimal ageAtEvaluation,
                      @NonNull LifeExpectancyResult lifeExpectancy,
                      @NonNull WorkLifeResult workLife,
                      @NonNull GrowthSchedule growthSchedule,
                      @NonNull EarningsSchedule earnings,
                      @NonNull DiscountFactorSchedule discountFactors,
                      @NonNull PresentValueResult presentValue,
                      @NonNull List<AuditEntry> auditEntries) {
        if (earnings.size() != discountFactors.size()) {
            throw new IllegalArgumentException("each earnings year needs exactly one discount factor");
        }
        this.config = config;
        this.ageAtEvaluation = ageAtEvaluation;
        this.lifeExpectancy = lifeExpectancy;
        this.workLife = workLife;
        this.growthSchedule = growthSchedule;
        this.earnings = earnings;
        this.discountFactors = discountFactors;
        this.presentValue = presentValue;
        this.auditEntries = List.copyOf(auditEntries);
    }

    public BigDecimal getTotalLoss() {
        return presentValue.getTotalLoss();
    }

    /**
     * @return the evaluation year and the years before it, rebuilt at the average growth rate
     */
    public WageHistory wageHistory() {
        return WageHistory.reconstruct(config.getOccupation().getBaseSalary(), growthSchedule.getBaseYear(),
                growthSchedule.averageRate(), WageHistory.DEFAULT_YEARS);
    }

    public CaseSummary summary() {
        BigDecimal hundred = BigDecimal.valueOf(100);
        return new CaseSummary(
                config.getCaseId(),
                lifeExpectancy.getRemainingYears(),
                workLife.getWorkLifeYears(),
                growthSchedule.averageRate().multiply(hundred, Decimals.MATH_CONTEXT),
                discountFactors.getRate().multiply(hundred, Decimals.MATH_CONTEXT),
                getTotalLoss()
        );
    }
}
