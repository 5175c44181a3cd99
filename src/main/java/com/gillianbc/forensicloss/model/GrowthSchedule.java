package com.gillianbc.forensicloss.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Wage growth rate for each year of the projection horizon. The rate at index i
 * takes earnings from year i to year i + 1.
 */
@Getter
@EqualsAndHashCode
@ToString
public class GrowthSchedule {

    private final int baseYear;
    private final boolean overridden;
    private final List<GrowthYear> years;

    public GrowthSchedule(int baseYear, boolean overridden, List<GrowthYear> years) {
        this.baseYear = baseYear;
        this.overridden = overridden;
        this.years = List.copyOf(Objects.requireNonNull(years, "years must not be null"));
        for (int i = 0; i < this.years.size(); i++) {
            GrowthYear year = this.years.get(i);
            if (year.yearIndex() != i) {
                throw new IllegalArgumentException("growth years must be indexed 0.." + (this.years.size() - 1));
            }
            if (!overridden && year.rate().signum() < 0) {
                throw new IllegalArgumentException("table growth rate for " + year.calendarYear() + " must be >= 0");
            }
        }
    }

    public static GrowthSchedule empty(int baseYear, boolean overridden) {
        return new GrowthSchedule(baseYear, overridden, List.of());
    }

    public int horizon() {
        return years.size();
    }

    public boolean isEmpty() {
        return years.isEmpty();
    }

    public BigDecimal rateAt(int yearIndex) {
        return years.get(yearIndex).rate();
    }

    /**
     * @return arithmetic mean of the rates, zero for an empty schedule
     */
    public BigDecimal averageRate() {
        if (years.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal total = Decimals.sum(years.stream().map(GrowthYear::rate).toList());
        return total.divide(BigDecimal.valueOf(years.size()), Decimals.MATH_CONTEXT);
    }

    /**
     * @param carriedForward true when the calendar year lies beyond the table and reuses its last rate
     */
    public record GrowthYear(int yearIndex, int calendarYear, BigDecimal rate, boolean carriedForward) {

        public GrowthYear {
            Objects.requireNonNull(rate, "rate must not be null");
        }
    }
}
