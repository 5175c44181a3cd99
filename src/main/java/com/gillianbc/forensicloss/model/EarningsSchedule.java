package com.gillianbc.forensicloss.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Nominal earnings for each year of remaining work-life. Every year but the last covers a
 * full year; the last may be a prorated fraction.
 */
@Getter
@EqualsAndHashCode
@ToString
public class EarningsSchedule {

    private final BigDecimal baseSalary;
    private final List<EarningsYear> years;

    public EarningsSchedule(BigDecimal baseSalary, List<EarningsYear> years) {
        this.baseSalary = Objects.requireNonNull(baseSalary, "baseSalary must not be null");
        this.years = List.copyOf(Objects.requireNonNull(years, "years must not be null"));
    }

    public boolean isEmpty() {
        return years.isEmpty();
    }

    public int size() {
        return years.size();
    }

    public BigDecimal totalYearFraction() {
        return Decimals.sum(years.stream().map(EarningsYear::yearFraction).toList());
    }

    /**
     * @return undiscounted sum of nominal earnings
     */
    public BigDecimal totalNominalEarnings() {
        return Decimals.sum(years.stream().map(EarningsYear::nominalEarnings).toList());
    }

    /**
     * @param fullYearEarnings what a complete year would pay
     * @param nominalEarnings  fullYearEarnings scaled by yearFraction
     */
    public record EarningsYear(int yearIndex,
                               int calendarYear,
                               BigDecimal yearFraction,
                               BigDecimal fullYearEarnings,
                               BigDecimal nominalEarnings) {

        public EarningsYear {
            Objects.requireNonNull(yearFraction, "yearFraction must not be null");
            Objects.requireNonNull(fullYearEarnings, "fullYearEarnings must not be null");
            Objects.requireNonNull(nominalEarnings, "nominalEarnings must not be null");
            if (yearFraction.signum() <= 0 || yearFraction.compareTo(BigDecimal.ONE) > 0) {
                throw new IllegalArgumentException("yearFraction must be in (0, 1]");
            }
        }
    }
}
