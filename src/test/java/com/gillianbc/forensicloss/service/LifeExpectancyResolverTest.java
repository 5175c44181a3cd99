package com.gillianbc.forensicloss.service;

import com.gillianbc.forensicloss.exception.InvalidAgeException;
import com.gillianbc.forensicloss.model.AssumptionChoice;
import com.gillianbc.forensicloss.model.AuditEntry;
import com.gillianbc.forensicloss.model.AuditLog;
import com.gillianbc.forensicloss.model.LifeExpectancyResult;
import com.gillianbc.forensicloss.model.PipelineStage;
import com.gillianbc.forensicloss.model.Sex;
import com.gillianbc.forensicloss.tables.FakeTables;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class LifeExpectancyResolverTest {

    private static final AssumptionChoice TABLE = AssumptionChoice.of(null);

    private final LifeExpectancyResolver resolver = new LifeExpectancyResolver(FakeTables.tables());

    @Test
    @DisplayName("Whole-number age reads and cites a single row")
    void wholeAge_singleRow() {
        AuditLog audit = new AuditLog();
        LifeExpectancyResult result = resolver.resolve(new BigDecimal("45"), Sex.FEMALE, TABLE, audit);

        assertEquals(0, new BigDecimal("56").compareTo(result.getRemainingYears()));
        assertFalse(result.isOverridden());
        assertEquals(1, result.getRows().size());
        assertEquals(1, audit.size());
        assertEquals(PipelineStage.LIFE_EXPECTANCY, audit.entries().get(0).stage());
    }

    @Test
    @DisplayName("Fractional age interpolates linearly between the bracketing rows (45.25 -> 55.75)")
    void fractionalAge_interpolates() {
        AuditLog audit = new AuditLog();
        LifeExpectancyResult result = resolver.resolve(new BigDecimal("45.25"), Sex.FEMALE, TABLE, audit);

        // 56 * 0.75 + 55 * 0.25
        assertEquals(0, new BigDecimal("55.75").compareTo(result.getRemainingYears()));
        assertEquals(2, result.getRows().size());
        assertEquals(45, result.getRows().get(0).age());
        assertEquals(0, new BigDecimal("0.75").compareTo(result.getRows().get(0).weight()));
        assertEquals(46, result.getRows().get(1).age());
        assertEquals(0, new BigDecimal("0.25").compareTo(result.getRows().get(1).weight()));

        assertEquals(2, audit.size());
        AuditEntry lower = audit.entries().get(0);
        AuditEntry upper = audit.entries().get(1);
        assertEquals("Fake life table", lower.sourceLabel());
        assertTrue(lower.sourceLocator().endsWith("age 45 female"));
        assertTrue(upper.sourceLocator().endsWith("age 46 female"));
    }

    @Test
    @DisplayName("Override is returned verbatim with a user override citation and no table rows")
    void override_skipsTable() {
        AuditLog audit = new AuditLog();
        LifeExpectancyResult result = resolver.resolve(new BigDecimal("45.5"), Sex.MALE,
                AssumptionChoice.of(new BigDecimal("12.5")), audit);

        assertEquals(new BigDecimal("12.5"), result.getRemainingYears());
        assertTrue(result.isOverridden());
        assertTrue(result.getRows().isEmpty());
        assertEquals(1, audit.size());
        assertEquals(AssumptionChoice.OVERRIDE_SOURCE, audit.entries().get(0).sourceLabel());
        assertEquals("assumptions.lifeExpectancyOverrideYears", audit.entries().get(0).sourceLocator());
    }

    @Test
    @DisplayName("The last table age resolves; anything beyond it is an invalid age")
    void maximumAge() {
        LifeExpectancyResult atMax = resolver.resolve(new BigDecimal("100"), Sex.FEMALE, TABLE, new AuditLog());
        assertEquals(0, BigDecimal.ONE.compareTo(atMax.getRemainingYears()));

        assertThrows(InvalidAgeException.class,
                () -> resolver.resolve(new BigDecimal("100.01"), Sex.FEMALE, TABLE, new AuditLog()));
    }

    @Test
    @DisplayName("An override is honoured past the table's last age")
    void override_beyondTableAge() {
        AuditLog audit = new AuditLog();
        LifeExpectancyResult result = resolver.resolve(new BigDecimal("103.5"), Sex.MALE,
                AssumptionChoice.of(new BigDecimal("1.5")), audit);

        assertEquals(new BigDecimal("1.5"), result.getRemainingYears());
        assertTrue(result.isOverridden());
        assertEquals(1, audit.size());
    }

    @Test
    @DisplayName("Negative age is an invalid age, even with an override")
    void negativeAge() {
        AuditLog audit = new AuditLog();
        InvalidAgeException e = assertThrows(InvalidAgeException.class,
                () -> resolver.resolve(new BigDecimal("-0.5"), Sex.FEMALE, AssumptionChoice.of(BigDecimal.TEN), audit));
        assertEquals(PipelineStage.LIFE_EXPECTANCY, e.getStage());
        assertEquals(0, audit.size());
    }

    @Test
    @DisplayName("Life expectancy is non-increasing in age over the bundled tables")
    void monotonicOverBundledTables() {
        LifeExpectancyResolver bundled = new LifeExpectancyResolver(FakeTables.bundled());
        for (Sex sex : Sex.values()) {
            BigDecimal previous = null;
            for (int tenths = 0; tenths <= 1000; tenths += 3) {
                BigDecimal age = BigDecimal.valueOf(tenths, 1);
                BigDecimal years = bundled.resolve(age, sex, TABLE, new AuditLog()).getRemainingYears();
                if (previous != null) {
                    assertTrue(years.compareTo(previous) <= 0, "age " + age + " " + sex);
                }
                previous = years;
            }
        }
    }

    @Test
    @DisplayName("Age is the day count divided by 365.25")
    void ageInYears() {
        assertEquals(0, new BigDecimal("44").compareTo(
                LifeExpectancyResolver.ageInYears(LocalDate.of(1981, 1, 1), LocalDate.of(2025, 1, 1))));
        assertEquals(0, BigDecimal.ZERO.compareTo(
                LifeExpectancyResolver.ageInYears(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 1))));
        BigDecimal age = LifeExpectancyResolver.ageInYears(LocalDate.of(1980, 1, 1), LocalDate.of(2025, 1, 1));
        log.info("Age for 1980-01-01 -> 2025-01-01: {}", age);
        assertTrue(age.compareTo(new BigDecimal("45")) > 0 && age.compareTo(new BigDecimal("45.01")) < 0);
    }
}
