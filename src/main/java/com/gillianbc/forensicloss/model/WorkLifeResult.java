package com.gillianbc.forensicloss.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Expected remaining years in the labour force.
 */
@Getter
@EqualsAndHashCode
@ToString
public class WorkLifeResult {

    public enum Basis {
        INACTIVE,
        OVERRIDE,
        RETIREMENT_AGE_HINT,
        TABLE
    }

    private final BigDecimal workLifeYears;
    private final BigDecimal lifeExpectancyYears;
    private final Basis basis;
    /** Participation factor for the TABLE basis, otherwise null. */
    private final BigDecimal participationFactor;
    /** True when the unclamped value exceeded remaining life years. */
    private final boolean clamped;
    /** Null for the INACTIVE basis, where nothing is looked up. */
    private final Citation citation;

    public WorkLifeResult(BigDecimal workLifeYears,
                          BigDecimal lifeExpectancyYears,
                          Basis basis,
                          BigDecimal participationFactor,
                          boolean clamped,
                          Citation citation) {
        this.workLifeYears = Objects.requireNonNull(workLifeYears, "workLifeYears must not be null");
        this.lifeExpectancyYears = Objects.requireNonNull(lifeExpectancyYears, "lifeExpectancyYears must not be null");
        this.basis = Objects.requireNonNull(basis, "basis must not be null");
        if (workLifeYears.signum() < 0) {
            throw new IllegalArgumentException("workLifeYears must be >= 0");
        }
        if (workLifeYears.compareTo(lifeExpectancyYears) > 0) {
            throw new IllegalArgumentException("workLifeYears must not exceed lifeExpectancyYears");
        }
        this.participationFactor = participationFactor;
        this.clamped = clamped;
        this.citation = citation;
    }
}
