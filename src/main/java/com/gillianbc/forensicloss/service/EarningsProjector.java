package com.gillianbc.forensicloss.service;

import com.gillianbc.forensicloss.model.AuditLog;
import com.gillianbc.forensicloss.model.Citation;
import com.gillianbc.forensicloss.model.Decimals;
import com.gillianbc.forensicloss.model.EarningsSchedule;
import com.gillianbc.forensicloss.model.EarningsSchedule.EarningsYear;
import com.gillianbc.forensicloss.model.GrowthSchedule;
import com.gillianbc.forensicloss.model.Occupation;
import com.gillianbc.forensicloss.model.PipelineStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Projects nominal earnings for each year of remaining work-life.
 */
@Slf4j
@Component
public class EarningsProjector {

    private static final MathContext MATH_CONTEXT = Decimals.MATH_CONTEXT;

    /**
     * Year i (0-based) pays the base salary compounded by the growth rates of years 0..i-1.
     * Whole years carry a fraction of 1. When work-life has a fractional remainder above
     * {@link Decimals#YEAR_EPSILON} a final row pays that year's full value times the remainder.
     * <p>
     * Values are not rounded.
     *
     * @param occupation     supplies the base salary (cited once when any earnings are projected)
     * @param growth         growth schedule covering at least ceil(workLifeYears) years
     * @param workLifeYears  remaining work-life, possibly fractional
     * @param evaluationDate year index 0 is the calendar year of this date
     */
    public EarningsSchedule project(Occupation occupation, GrowthSchedule growth, BigDecimal workLifeYears,
                                    LocalDate evaluationDate, AuditLog audit) {
        Objects.requireNonNull(occupation, "occupation must not be null");
        Objects.requireNonNull(growth, "growth must not be null");
        Objects.requireNonNull(workLifeYears, "workLifeYears must not be null");
        Objects.requireNonNull(evaluationDate, "evaluationDate must not be null");
        Objects.requireNonNull(audit, "audit must not be null");

        BigDecimal baseSalary = Objects.requireNonNull(occupation.getBaseSalary(), "baseSalary must not be null");
        if (baseSalary.signum() <= 0) {
            throw new IllegalArgumentException("baseSalary must be > 0");
        }
        if (workLifeYears.signum() < 0) {
            throw new IllegalArgumentException("workLifeYears must be >= 0");
        }

        int fullYears = workLifeYears.setScale(0, RoundingMode.FLOOR).intValueExact();
        BigDecimal remainder = workLifeYears.subtract(BigDecimal.valueOf(fullYears), MATH_CONTEXT);
        boolean partialYear = remainder.compareTo(Decimals.YEAR_EPSILON) > 0;
        int rows = partialYear ? fullYears + 1 : fullYears;

        if (rows == 0) {
            log.debug("No work-life remaining; empty earnings schedule");
            return new EarningsSchedule(baseSalary, List.of());
        }
        // rows - 1 growth rates are applied; the schedule must also span the final year
        if (growth.horizon() < rows) {
            throw new IllegalArgumentException("growth schedule covers " + growth.horizon()
                    + " years but " + rows + " are projected");
        }

        Citation citation = Citation.caseInput("occupation.baseSalary (SOC " + occupation.getSocCode()
                + ", " + occupation.location() + ")");
        audit.record(PipelineStage.EARNINGS, "Base annual salary", baseSalary,
                citation.sourceLabel(), citation.locator());

        int baseYear = evaluationDate.getYear();
        List<EarningsYear> years = new ArrayList<>(rows);
        BigDecimal fullYearValue = baseSalary;
        for (int i = 0; i < rows; i++) {
            if (i > 0) {
                BigDecimal growthFactor = BigDecimal.ONE.add(growth.rateAt(i - 1), MATH_CONTEXT);
                fullYearValue = fullYearValue.multiply(growthFactor, MATH_CONTEXT);
            }
            if (i < fullYears) {
                years.add(new EarningsYear(i, baseYear + i, BigDecimal.ONE, fullYearValue, fullYearValue));
            } else {
                BigDecimal prorated = fullYearValue.multiply(remainder, MATH_CONTEXT);
                years.add(new EarningsYear(i, baseYear + i, remainder, fullYearValue, prorated));
            }
        }

        EarningsSchedule schedule = new EarningsSchedule(baseSalary, years);
        log.debug("Projected {} earnings years ({} full), nominal total {}", rows, fullYears,
                schedule.totalNominalEarnings());
        return schedule;
    }
}
