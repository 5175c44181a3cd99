package com.gillianbc.forensicloss.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;

/**
 * Headline figures of a case run, as written to summary.json.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CaseSummary(String caseId,
                          BigDecimal lifeExpectancyYears,
                          BigDecimal worklifeRemainingYears,
                          BigDecimal avgWageGrowthPct,
                          BigDecimal discountRatePct,
                          BigDecimal totalEconomicLossUsd) {
}
