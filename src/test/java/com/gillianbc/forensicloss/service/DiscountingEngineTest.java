package com.gillianbc.forensicloss.service;

import com.gillianbc.forensicloss.exception.InvalidConfigException;
import com.gillianbc.forensicloss.exception.TableLookupException;
import com.gillianbc.forensicloss.model.AssumptionChoice;
import com.gillianbc.forensicloss.model.AuditLog;
import com.gillianbc.forensicloss.model.DiscountFactorSchedule;
import com.gillianbc.forensicloss.model.EarningsSchedule;
import com.gillianbc.forensicloss.model.EarningsSchedule.EarningsYear;
import com.gillianbc.forensicloss.model.PipelineStage;
import com.gillianbc.forensicloss.model.PresentValueResult;
import com.gillianbc.forensicloss.model.PresentValueResult.PresentValueYear;
import com.gillianbc.forensicloss.tables.FakeTables;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiscountingEngineTest {

    private static final String SERIES = "treasury-1y";

    private final DiscountingEngine engine = new DiscountingEngine(FakeTables.tables());

    private static EarningsSchedule earnings() {
        return new EarningsSchedule(new BigDecimal("1000"), List.of(
                new EarningsYear(0, 2025, BigDecimal.ONE, new BigDecimal("1000"), new BigDecimal("1000")),
                new EarningsYear(1, 2026, BigDecimal.ONE, new BigDecimal("1040"), new BigDecimal("1040")),
                new EarningsYear(2, 2027, new BigDecimal("0.5"), new BigDecimal("1081.6"), new BigDecimal("540.8"))));
    }

    @Test
    @DisplayName("Series rate for the evaluation year gives factor 1 at year 0, then strictly decreasing")
    void tableRate_factors() {
        AuditLog audit = new AuditLog();
        DiscountFactorSchedule factors = engine.discountFactors(earnings(), AssumptionChoice.of(null), SERIES, 2025, audit);

        assertEquals(0, new BigDecimal("0.04").compareTo(factors.getRate()));
        assertFalse(factors.isOverridden());
        assertEquals(3, factors.size());
        assertEquals(0, BigDecimal.ONE.compareTo(factors.factorAt(0)));
        for (int i = 1; i < factors.size(); i++) {
            assertTrue(factors.factorAt(i).compareTo(factors.factorAt(i - 1)) < 0);
        }
        assertEquals(new BigDecimal("0.961538"), factors.factorAt(1).setScale(6, RoundingMode.HALF_UP));

        assertEquals(1, audit.size());
        assertEquals(PipelineStage.DISCOUNTING, audit.entries().get(0).stage());
        assertTrue(audit.entries().get(0).sourceLocator().endsWith("1y 2025"));
    }

    @Test
    @DisplayName("Present value is nominal times factor with a running total")
    void presentValue_accumulates() {
        EarningsSchedule earnings = earnings();
        DiscountFactorSchedule factors = engine.discountFactors(earnings, AssumptionChoice.of(null), SERIES, 2025,
                new AuditLog());
        PresentValueResult result = engine.presentValue(earnings, factors);

        // 1040 / 1.04 = 1000 and 540.8 / 1.0816 = 500
        List<PresentValueYear> years = result.getYears();
        assertEquals(0, new BigDecimal("1000").compareTo(years.get(0).presentValue()));
        assertEquals(0, new BigDecimal("1000").compareTo(years.get(1).presentValue().setScale(20, RoundingMode.HALF_UP)));
        assertEquals(0, new BigDecimal("2000").compareTo(years.get(1).cumulativePresentValue().setScale(20, RoundingMode.HALF_UP)));
        assertEquals(0, new BigDecimal("2500").compareTo(result.getTotalLoss().setScale(20, RoundingMode.HALF_UP)));
        assertEquals(years.get(2).cumulativePresentValue(), result.getTotalLoss());
        assertTrue(result.getTotalLoss().compareTo(earnings.totalNominalEarnings()) < 0);
    }

    @Test
    @DisplayName("Zero rate override: every factor is 1 and total equals the undiscounted sum")
    void zeroRate_noDiscounting() {
        EarningsSchedule earnings = earnings();
        AuditLog audit = new AuditLog();
        DiscountFactorSchedule factors = engine.discountFactors(earnings, AssumptionChoice.of(BigDecimal.ZERO), SERIES,
                2025, audit);

        assertTrue(factors.isOverridden());
        factors.getFactors().forEach(f -> assertEquals(0, BigDecimal.ONE.compareTo(f.factor())));
        PresentValueResult result = engine.presentValue(earnings, factors);
        assertEquals(0, earnings.totalNominalEarnings().compareTo(result.getTotalLoss()));
        assertEquals("assumptions.discountRateOverride", audit.entries().get(0).sourceLocator());
    }

    @Test
    @DisplayName("Empty earnings still cite the rate and give a zero total")
    void emptyEarnings() {
        EarningsSchedule empty = new EarningsSchedule(new BigDecimal("1000"), List.of());
        AuditLog audit = new AuditLog();
        DiscountFactorSchedule factors = engine.discountFactors(empty, AssumptionChoice.of(null), SERIES, 2025, audit);

        assertEquals(0, factors.size());
        assertEquals(1, audit.size());
        assertEquals(0, BigDecimal.ZERO.compareTo(engine.presentValue(empty, factors).getTotalLoss()));
    }

    @Test
    @DisplayName("Unknown series or year fails the lookup; a rate of -1 is rejected")
    void invalidRates() {
        TableLookupException missingYear = assertThrows(TableLookupException.class,
                () -> engine.discountFactors(earnings(), AssumptionChoice.of(null), SERIES, 2030, new AuditLog()));
        assertEquals(PipelineStage.DISCOUNTING, missingYear.getStage());
        assertThrows(TableLookupException.class,
                () -> engine.discountFactors(earnings(), AssumptionChoice.of(null), "treasury-30y", 2025, new AuditLog()));
        assertThrows(InvalidConfigException.class,
                () -> engine.discountFactors(earnings(), AssumptionChoice.of(BigDecimal.ONE.negate()), SERIES, 2025,
                        new AuditLog()));
    }

    @Test
    @DisplayName("Earnings and factors of different lengths are rejected")
    void mismatchedLengths() {
        DiscountFactorSchedule factors = engine.discountFactors(earnings(), AssumptionChoice.of(null), SERIES, 2025,
                new AuditLog());
        EarningsSchedule shorter = new EarningsSchedule(new BigDecimal("1000"), earnings().getYears().subList(0, 2));
        assertThrows(IllegalArgumentException.class, () -> engine.presentValue(shorter, factors));
    }
}
