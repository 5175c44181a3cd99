package com.gillianbc.forensicloss.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Mean wages for the years up to the evaluation year, rebuilt backwards from the base
 * salary at a constant growth rate. Shown in the report as context for the growth
 * assumption; it takes no part in the loss calculation.
 */
@Getter
@EqualsAndHashCode
@ToString
public class WageHistory {

    public static final int DEFAULT_YEARS = 7;

    private final BigDecimal growthRate;
    private final List<WageYear> years;

    private WageHistory(BigDecimal growthRate, List<WageYear> years) {
        this.growthRate = growthRate;
        this.years = List.copyOf(years);
    }

    /**
     * @param baseSalary     mean wage in the evaluation year
     * @param evaluationYear last year of the series
     * @param growthRate     constant year over year growth, greater than -1
     * @param count          number of years, at least 1
     * @return the series, oldest year first
     */
    public static WageHistory reconstruct(BigDecimal baseSalary, int evaluationYear, BigDecimal growthRate, int count) {
        Objects.requireNonNull(baseSalary, "baseSalary must not be null");
        Objects.requireNonNull(growthRate, "growthRate must not be null");
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1, was " + count);
        }
        BigDecimal onePlusRate = BigDecimal.ONE.add(growthRate, Decimals.MATH_CONTEXT);
        if (onePlusRate.signum() <= 0) {
            throw new IllegalArgumentException("growth rate must be greater than -1, was " + growthRate);
        }

        List<WageYear> years = new ArrayList<>(count);
        BigDecimal previous = null;
        for (int k = count - 1; k >= 0; k--) {
            BigDecimal wage = baseSalary.divide(onePlusRate.pow(k, Decimals.MATH_CONTEXT), Decimals.MATH_CONTEXT);
            BigDecimal yoy = previous == null || previous.signum() == 0
                    ? null
                    : wage.subtract(previous, Decimals.MATH_CONTEXT).divide(previous, Decimals.MATH_CONTEXT);
            years.add(new WageYear(evaluationYear - k, wage, yoy));
            previous = wage;
        }
        return new WageHistory(growthRate, years);
    }

    /**
     * @return arithmetic mean of the year over year rates, zero for a single year
     */
    public BigDecimal averageGrowth() {
        List<BigDecimal> rates = years.stream().map(WageYear::yoyGrowth).filter(Objects::nonNull).toList();
        if (rates.isEmpty()) {
            return BigDecimal.ZERO;
        }
        return Decimals.sum(rates).divide(BigDecimal.valueOf(rates.size()), Decimals.MATH_CONTEXT);
    }

    /**
     * @param yoyGrowth growth over the previous year, null for the oldest year
     */
    public record WageYear(int year, BigDecimal meanWage, BigDecimal yoyGrowth) {
    }
}
