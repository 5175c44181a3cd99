package com.gillianbc.forensicloss.service;

import com.gillianbc.forensicloss.exception.InvalidConfigException;
import com.gillianbc.forensicloss.model.AssumptionChoice;
import com.gillianbc.forensicloss.model.AuditLog;
import com.gillianbc.forensicloss.model.Citation;
import com.gillianbc.forensicloss.model.CitedValue;
import com.gillianbc.forensicloss.model.Decimals;
import com.gillianbc.forensicloss.model.DiscountFactorSchedule;
import com.gillianbc.forensicloss.model.DiscountFactorSchedule.DiscountFactor;
import com.gillianbc.forensicloss.model.EarningsSchedule;
import com.gillianbc.forensicloss.model.EarningsSchedule.EarningsYear;
import com.gillianbc.forensicloss.model.PipelineStage;
import com.gillianbc.forensicloss.model.PresentValueResult;
import com.gillianbc.forensicloss.model.PresentValueResult.PresentValueYear;
import com.gillianbc.forensicloss.tables.ReferenceTables;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Discounts projected earnings to the evaluation date.
 * <p>
 * factor(t) = 1 / (1 + rate)^(t + YEAR_OFFSET). With an offset of zero the first projection
 * year is taken at its undiscounted value.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiscountingEngine {

    static final int YEAR_OFFSET = 0;
    private static final MathContext MATH_CONTEXT = Decimals.MATH_CONTEXT;

    private final ReferenceTables tables;

    /**
     * Resolves the discount rate once and computes one factor per earnings year, aligned by year index.
     *
     * @param series         discount-rate series consulted when there is no override
     * @param evaluationYear year whose series rate applies
     */
    public DiscountFactorSchedule discountFactors(EarningsSchedule earnings, AssumptionChoice choice, String series,
                                                  int evaluationYear, AuditLog audit) {
        Objects.requireNonNull(earnings, "earnings must not be null");
        Objects.requireNonNull(choice, "choice must not be null");
        Objects.requireNonNull(audit, "audit must not be null");

        BigDecimal rate;
        boolean overridden;
        if (choice instanceof AssumptionChoice.UserOverride override) {
            Citation citation = Citation.userOverride("discountRateOverride");
            audit.record(PipelineStage.DISCOUNTING, "Discount rate", override.value(),
                    citation.sourceLabel(), citation.locator());
            rate = override.value();
            overridden = true;
        } else {
            Objects.requireNonNull(series, "series must not be null");
            CitedValue cited = tables.discountRates().lookup(series, evaluationYear);
            audit.record(PipelineStage.DISCOUNTING, "Discount rate (" + series + ", " + evaluationYear + ")", cited);
            rate = cited.value();
            overridden = false;
        }

        BigDecimal onePlusRate = BigDecimal.ONE.add(rate, MATH_CONTEXT);
        if (onePlusRate.signum() <= 0) {
            throw new InvalidConfigException(PipelineStage.DISCOUNTING, "discount rate", "must be greater than -1");
        }

        List<DiscountFactor> factors = new ArrayList<>(earnings.size());
        for (EarningsYear year : earnings.getYears()) {
            BigDecimal denominator = onePlusRate.pow(year.yearIndex() + YEAR_OFFSET, MATH_CONTEXT);
            factors.add(new DiscountFactor(year.yearIndex(), BigDecimal.ONE.divide(denominator, MATH_CONTEXT)));
        }
        log.debug("Discount rate {} applied to {} years", rate, factors.size());
        return new DiscountFactorSchedule(rate, overridden, factors);
    }

    /**
     * Multiplies each nominal value by its factor and accumulates the running total.
     */
    public PresentValueResult presentValue(EarningsSchedule earnings, DiscountFactorSchedule factors) {
        Objects.requireNonNull(earnings, "earnings must not be null");
        Objects.requireNonNull(factors, "factors must not be null");
        if (earnings.size() != factors.size()) {
            throw new IllegalArgumentException("earnings and discount factors must have the same length");
        }

        List<PresentValueYear> years = new ArrayList<>(earnings.size());
        BigDecimal cumulative = BigDecimal.ZERO;
        for (int i = 0; i < earnings.size(); i++) {
            EarningsYear year = earnings.getYears().get(i);
            BigDecimal factor = factors.factorAt(i);
            BigDecimal presentValue = year.nominalEarnings().multiply(factor, MATH_CONTEXT);
            cumulative = cumulative.add(presentValue, MATH_CONTEXT);
            years.add(new PresentValueYear(year.yearIndex(), year.nominalEarnings(), factor, presentValue, cumulative));
        }
        return new PresentValueResult(years, cumulative);
    }
}
