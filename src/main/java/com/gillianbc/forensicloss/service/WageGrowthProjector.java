package com.gillianbc.forensicloss.service;

import com.gillianbc.forensicloss.exception.TableLookupException;
import com.gillianbc.forensicloss.model.AssumptionChoice;
import com.gillianbc.forensicloss.model.AuditLog;
import com.gillianbc.forensicloss.model.Citation;
import com.gillianbc.forensicloss.model.CitedValue;
import com.gillianbc.forensicloss.model.GrowthSchedule;
import com.gillianbc.forensicloss.model.GrowthSchedule.GrowthYear;
import com.gillianbc.forensicloss.model.PipelineStage;
import com.gillianbc.forensicloss.tables.ReferenceTables;
import com.gillianbc.forensicloss.tables.WageGrowthTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the year-by-year wage growth schedule for the projection horizon.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WageGrowthProjector {

    private final ReferenceTables tables;

    /**
     * @return ceil(workLifeYears), the number of calendar years the earnings projection touches
     */
    public static int horizonFor(BigDecimal workLifeYears) {
        Objects.requireNonNull(workLifeYears, "workLifeYears must not be null");
        if (workLifeYears.signum() < 0) {
            throw new IllegalArgumentException("workLifeYears must be >= 0");
        }
        return workLifeYears.setScale(0, RoundingMode.CEILING).intValueExact();
    }

    /**
     * Projects growth rates for calendar years {@code baseYear .. baseYear + horizon - 1}.
     * <p>
     * A zero horizon returns an empty schedule straight away; that is a valid case with no loss.
     * An override produces a constant schedule with one citation. Otherwise each year is read from
     * the wage growth table for {@code category}; years after the table's last year reuse that
     * year's rate, cited once for the whole carried-forward range. A base year before the table's
     * first year is a {@link TableLookupException}.
     *
     * @param baseYear calendar year of the evaluation date (year index 0)
     * @param horizon  number of years, see {@link #horizonFor(BigDecimal)}
     * @param category occupation category (SOC major group)
     */
    public GrowthSchedule project(int baseYear, int horizon, String category, AssumptionChoice choice, AuditLog audit) {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(choice, "choice must not be null");
        Objects.requireNonNull(audit, "audit must not be null");
        if (horizon < 0) {
            throw new IllegalArgumentException("horizon must be >= 0");
        }

        boolean overridden = choice instanceof AssumptionChoice.UserOverride;
        if (horizon == 0) {
            log.debug("Zero horizon; empty growth schedule");
            return GrowthSchedule.empty(baseYear, overridden);
        }

        List<GrowthYear> years = new ArrayList<>(horizon);
        if (choice instanceof AssumptionChoice.UserOverride override) {
            Citation citation = Citation.userOverride("wageGrowthRateOverride");
            audit.record(PipelineStage.WAGE_GROWTH, "Annual wage growth rate, all years", override.value(),
                    citation.sourceLabel(), citation.locator());
            for (int i = 0; i < horizon; i++) {
                years.add(new GrowthYear(i, baseYear + i, override.value(), false));
            }
            return new GrowthSchedule(baseYear, true, years);
        }

        WageGrowthTable wageGrowth = tables.wageGrowth();
        int firstYear = wageGrowth.firstYear(category);
        if (baseYear < firstYear) {
            throw new TableLookupException(PipelineStage.WAGE_GROWTH, wageGrowth.getTableName(),
                    "year " + baseYear + ", category " + category + " (table starts at " + firstYear + ")");
        }
        int latestYear = wageGrowth.latestYear(category);
        int lastYear = baseYear + horizon - 1;
        boolean carriedForwardCited = false;
        for (int i = 0; i < horizon; i++) {
            int year = baseYear + i;
            if (year <= latestYear) {
                CitedValue rate = wageGrowth.lookup(year, category);
                audit.record(PipelineStage.WAGE_GROWTH, "Wage growth rate for " + year, rate);
                years.add(new GrowthYear(i, year, rate.value(), false));
            } else {
                CitedValue last = wageGrowth.lookup(latestYear, category);
                // one citation covers the whole carried-forward range
                if (!carriedForwardCited) {
                    String range = year == lastYear ? String.valueOf(year) : year + ".." + lastYear;
                    audit.record(PipelineStage.WAGE_GROWTH,
                            "Wage growth rate for " + range + " (carried forward from " + latestYear + ")",
                            last.value(), last.citation().sourceLabel(),
                            last.citation().locator() + " [carried forward]");
                    carriedForwardCited = true;
                }
                years.add(new GrowthYear(i, year, last.value(), true));
            }
        }
        log.debug("Growth schedule {}..{} for category {}", baseYear, baseYear + horizon - 1, category);
        return new GrowthSchedule(baseYear, false, years);
    }
}
