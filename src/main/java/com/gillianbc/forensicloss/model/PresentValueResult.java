package com.gillianbc.forensicloss.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Discounted earnings per year and their running total. The last cumulative value is the
 * total economic loss.
 */
@Getter
@EqualsAndHashCode
@ToString
public class PresentValueResult {

    private final List<PresentValueYear> years;
    private final BigDecimal totalLoss;

    public PresentValueResult(List<PresentValueYear> years, BigDecimal totalLoss) {
        this.years = List.copyOf(Objects.requireNonNull(years, "years must not be null"));
        this.totalLoss = Objects.requireNonNull(totalLoss, "totalLoss must not be null");
    }

    public record PresentValueYear(int yearIndex,
                                   BigDecimal nominalEarnings,
                                   BigDecimal discountFactor,
                                   BigDecimal presentValue,
                                   BigDecimal cumulativePresentValue) {
    }
}
