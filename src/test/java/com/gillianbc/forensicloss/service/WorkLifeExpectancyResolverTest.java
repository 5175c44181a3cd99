package com.gillianbc.forensicloss.service;

import com.gillianbc.forensicloss.TestCases;
import com.gillianbc.forensicloss.exception.InvalidConfigException;
import com.gillianbc.forensicloss.model.ActiveStatus;
import com.gillianbc.forensicloss.model.AssumptionChoice;
import com.gillianbc.forensicloss.model.Assumptions;
import com.gillianbc.forensicloss.model.AuditLog;
import com.gillianbc.forensicloss.model.EducationLevel;
import com.gillianbc.forensicloss.model.LifeExpectancyResult;
import com.gillianbc.forensicloss.model.Person;
import com.gillianbc.forensicloss.model.PipelineStage;
import com.gillianbc.forensicloss.model.Sex;
import com.gillianbc.forensicloss.model.WorkLifeMethod;
import com.gillianbc.forensicloss.model.WorkLifeResult;
import com.gillianbc.forensicloss.tables.FakeTables;
import com.gillianbc.forensicloss.tables.ReferenceTables;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkLifeExpectancyResolverTest {

    private static final BigDecimal AGE_44 = new BigDecimal("44");

    private final ReferenceTables tables = FakeTables.tables();
    private final LifeExpectancyResolver lifeExpectancyResolver = new LifeExpectancyResolver(tables);
    private final WorkLifeExpectancyResolver resolver = new WorkLifeExpectancyResolver(tables);

    // Fake female life expectancy at 44 is 57 years
    private LifeExpectancyResult lifeExpectancyAt44() {
        return lifeExpectancyResolver.resolve(AGE_44, Sex.FEMALE, AssumptionChoice.of(null), new AuditLog());
    }

    @Test
    @DisplayName("Inactive person has zero work-life and nothing is cited")
    void inactive_isZero() {
        AuditLog audit = new AuditLog();
        Person person = TestCases.personAged44().activeStatus(ActiveStatus.INACTIVE).build();
        Assumptions assumptions = Assumptions.builder().workLifeOverrideYears(BigDecimal.TEN).build();

        WorkLifeResult result = resolver.resolve(lifeExpectancyAt44(), person, assumptions, audit);

        assertEquals(0, BigDecimal.ZERO.compareTo(result.getWorkLifeYears()));
        assertEquals(WorkLifeResult.Basis.INACTIVE, result.getBasis());
        assertNull(result.getCitation());
        assertEquals(0, audit.size());
    }

    @Test
    @DisplayName("Table method multiplies the participation factor by remaining life years (0.5 x 57)")
    void table_appliesParticipationFactor() {
        AuditLog audit = new AuditLog();
        WorkLifeResult result = resolver.resolve(lifeExpectancyAt44(), TestCases.personAged44().build(),
                Assumptions.none(), audit);

        assertEquals(0, new BigDecimal("28.5").compareTo(result.getWorkLifeYears()));
        assertEquals(0, new BigDecimal("0.5").compareTo(result.getParticipationFactor()));
        assertEquals(WorkLifeResult.Basis.TABLE, result.getBasis());
        assertFalse(result.isClamped());
        assertEquals(1, audit.size());
        assertEquals(PipelineStage.WORK_LIFE, audit.entries().get(0).stage());
        assertTrue(audit.entries().get(0).sourceLocator().contains("0-64 female BA"));
    }

    @Test
    @DisplayName("Work-life override is used directly")
    void override_usedDirectly() {
        AuditLog audit = new AuditLog();
        Assumptions assumptions = Assumptions.builder().workLifeOverrideYears(new BigDecimal("12.25")).build();

        WorkLifeResult result = resolver.resolve(lifeExpectancyAt44(), TestCases.personAged44().build(), assumptions, audit);

        assertEquals(new BigDecimal("12.25"), result.getWorkLifeYears());
        assertEquals(WorkLifeResult.Basis.OVERRIDE, result.getBasis());
        assertEquals("assumptions.workLifeOverrideYears", audit.entries().get(0).sourceLocator());
    }

    @Test
    @DisplayName("Work-life override longer than remaining life is clamped to life expectancy")
    void override_clampedToLifeExpectancy() {
        Assumptions assumptions = Assumptions.builder().workLifeOverrideYears(new BigDecimal("80")).build();

        WorkLifeResult result = resolver.resolve(lifeExpectancyAt44(), TestCases.personAged44().build(),
                assumptions, new AuditLog());

        assertEquals(0, new BigDecimal("57").compareTo(result.getWorkLifeYears()));
        assertTrue(result.isClamped());
    }

    @Test
    @DisplayName("Retirement-age-hint method uses hint minus age, floored at zero")
    void retirementAgeHint() {
        Assumptions to65 = Assumptions.builder()
                .workLifeMethod(WorkLifeMethod.RETIREMENT_AGE_HINT)
                .retirementAgeHint(new BigDecimal("65"))
                .build();
        AuditLog audit = new AuditLog();
        WorkLifeResult result = resolver.resolve(lifeExpectancyAt44(), TestCases.personAged44().build(), to65, audit);
        assertEquals(0, new BigDecimal("21").compareTo(result.getWorkLifeYears()));
        assertEquals(WorkLifeResult.Basis.RETIREMENT_AGE_HINT, result.getBasis());
        assertEquals("assumptions.retirementAgeHint", audit.entries().get(0).sourceLocator());

        Assumptions alreadyPast = Assumptions.builder()
                .workLifeMethod(WorkLifeMethod.RETIREMENT_AGE_HINT)
                .retirementAgeHint(new BigDecimal("40"))
                .build();
        WorkLifeResult zero = resolver.resolve(lifeExpectancyAt44(), TestCases.personAged44().build(), alreadyPast,
                new AuditLog());
        assertEquals(0, BigDecimal.ZERO.compareTo(zero.getWorkLifeYears()));
    }

    @Test
    @DisplayName("Retirement-age-hint method without a hint is a config error")
    void retirementAgeHint_missing() {
        Assumptions assumptions = Assumptions.builder().workLifeMethod(WorkLifeMethod.RETIREMENT_AGE_HINT).build();
        InvalidConfigException e = assertThrows(InvalidConfigException.class,
                () -> resolver.resolve(lifeExpectancyAt44(), TestCases.personAged44().build(), assumptions,
                        new AuditLog()));
        assertEquals(PipelineStage.WORK_LIFE, e.getStage());
        assertEquals("assumptions.retirementAgeHint", e.getField());
    }

    @Test
    @DisplayName("Work-life never exceeds life expectancy over the bundled tables")
    void neverExceedsLifeExpectancy() {
        ReferenceTables bundled = FakeTables.bundled();
        LifeExpectancyResolver bundledLife = new LifeExpectancyResolver(bundled);
        WorkLifeExpectancyResolver bundledWorkLife = new WorkLifeExpectancyResolver(bundled);
        for (Sex sex : Sex.values()) {
            for (EducationLevel education : EducationLevel.values()) {
                for (int age = 0; age <= 100; age += 5) {
                    LifeExpectancyResult life = bundledLife.resolve(BigDecimal.valueOf(age), sex,
                            AssumptionChoice.of(null), new AuditLog());
                    Person person = TestCases.person().sex(sex).educationLevel(education).build();
                    WorkLifeResult workLife = bundledWorkLife.resolve(life, person, Assumptions.none(), new AuditLog());
                    assertTrue(workLife.getWorkLifeYears().compareTo(life.getRemainingYears()) <= 0);
                    assertTrue(workLife.getWorkLifeYears().signum() >= 0);
                }
            }
        }
    }
}
