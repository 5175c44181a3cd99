package com.gillianbc.forensicloss.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Remaining life years at the evaluation age, with the table rows (and their interpolation
 * weights) that produced it. An overridden result carries no rows.
 */
@Getter
@EqualsAndHashCode
@ToString
public class LifeExpectancyResult {

    private final BigDecimal age;
    private final BigDecimal remainingYears;
    private final boolean overridden;
    private final Citation citation;
    private final List<InterpolationRow> rows;

    public LifeExpectancyResult(BigDecimal age,
                                BigDecimal remainingYears,
                                boolean overridden,
                                Citation citation,
                                List<InterpolationRow> rows) {
        this.age = Objects.requireNonNull(age, "age must not be null");
        this.remainingYears = Objects.requireNonNull(remainingYears, "remainingYears must not be null");
        if (remainingYears.signum() < 0) {
            throw new IllegalArgumentException("remainingYears must be >= 0");
        }
        this.overridden = overridden;
        this.citation = Objects.requireNonNull(citation, "citation must not be null");
        this.rows = List.copyOf(Objects.requireNonNull(rows, "rows must not be null"));
    }

    /**
     * A mortality table row used in the interpolation.
     *
     * @param age            integer age of the row
     * @param remainingYears expectation of life at that age
     * @param weight         interpolation weight applied to the row
     * @param citation       where the row came from
     */
    public record InterpolationRow(int age, BigDecimal remainingYears, BigDecimal weight, Citation citation) {
    }
}
