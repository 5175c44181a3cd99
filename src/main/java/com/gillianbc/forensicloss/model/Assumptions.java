package com.gillianbc.forensicloss.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Optional case assumptions. Any value left null is resolved from the reference tables.
 * Rates are fractions (0.037 = 3.7%).
 */
@Getter
@Builder
@Jacksonized
@EqualsAndHashCode
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class Assumptions {

    @JsonAlias("retirement_age_hint")
    private final BigDecimal retirementAgeHint;
    @JsonAlias("life_expectancy_override_years")
    private final BigDecimal lifeExpectancyOverrideYears;
    @JsonAlias("worklife_method")
    @Builder.Default
    private final WorkLifeMethod workLifeMethod = WorkLifeMethod.TABLE;
    @JsonAlias({"worklife_table_override", "worklife_override_years"})
    private final BigDecimal workLifeOverrideYears;
    @JsonAlias("discount_rate_override")
    private final BigDecimal discountRateOverride;
    @JsonAlias({"annual_growth_rate_override", "wage_growth_rate_override"})
    private final BigDecimal wageGrowthRateOverride;

    public static Assumptions none() {
        return Assumptions.builder().build();
    }

    public AssumptionChoice lifeExpectancy() {
        return AssumptionChoice.of(lifeExpectancyOverrideYears);
    }

    public AssumptionChoice workLifeYears() {
        return AssumptionChoice.of(workLifeOverrideYears);
    }

    public AssumptionChoice discountRate() {
        return AssumptionChoice.of(discountRateOverride);
    }

    public AssumptionChoice wageGrowthRate() {
        return AssumptionChoice.of(wageGrowthRateOverride);
    }
}
