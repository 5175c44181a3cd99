package com.gillianbc.forensicloss.service;

import com.gillianbc.forensicloss.exception.InvalidConfigException;
import com.gillianbc.forensicloss.model.Assumptions;
import com.gillianbc.forensicloss.model.CaseConfig;
import com.gillianbc.forensicloss.model.Occupation;
import com.gillianbc.forensicloss.model.Person;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Rejects malformed case input before any computation starts.
 */
public final class CaseConfigValidator {

    private static final Pattern SOC_CODE = Pattern.compile("\\d{2}-\\d{4}");
    // Used as a directory name for the case outputs
    private static final Pattern CASE_ID = Pattern.compile("[A-Za-z0-9_.-]+");
    private static final BigDecimal MINUS_ONE = BigDecimal.ONE.negate();

    private CaseConfigValidator() {
    }

    public static void validate(CaseConfig config) {
        if (config == null) {
            throw new InvalidConfigException("config", "must not be null");
        }
        String caseId = config.getCaseId();
        if (caseId == null || caseId.isBlank()) {
            throw new InvalidConfigException("caseId", "must not be blank");
        }
        if (!CASE_ID.matcher(caseId).matches() || caseId.contains("..") || caseId.equals(".")) {
            throw new InvalidConfigException("caseId", "may only contain letters, digits, '_', '-' and single '.', was '"
                    + caseId + "'");
        }
        validatePerson(config.getPerson());
        validateOccupation(config.getOccupation());
        validateAssumptions(config.getAssumptions());
    }

    private static void validatePerson(Person person) {
        if (person == null) {
            throw new InvalidConfigException("person", "must not be null");
        }
        required(person.getDateOfBirth(), "person.dateOfBirth");
        required(person.getEvaluationDate(), "person.evaluationDate");
        required(person.getSex(), "person.sex");
        required(person.getEducationLevel(), "person.educationLevel");
        required(person.getActiveStatus(), "person.activeStatus");
        if (person.getDateOfBirth().isAfter(person.getEvaluationDate())) {
            throw new InvalidConfigException("person.dateOfBirth", "must not be after the evaluation date ("
                    + person.getEvaluationDate() + ")");
        }
    }

    private static void validateOccupation(Occupation occupation) {
        if (occupation == null) {
            throw new InvalidConfigException("occupation", "must not be null");
        }
        required(occupation.getSocCode(), "occupation.socCode");
        if (!SOC_CODE.matcher(occupation.getSocCode()).matches()) {
            throw new InvalidConfigException("occupation.socCode", "must look like NN-NNNN, was '"
                    + occupation.getSocCode() + "'");
        }
        required(occupation.getBaseSalary(), "occupation.baseSalary");
        if (occupation.getBaseSalary().signum() <= 0) {
            throw new InvalidConfigException("occupation.baseSalary", "must be > 0");
        }
    }

    private static void validateAssumptions(Assumptions assumptions) {
        if (assumptions == null) {
            throw new InvalidConfigException("assumptions", "must not be null");
        }
        required(assumptions.getWorkLifeMethod(), "assumptions.workLifeMethod");
        nonNegative(assumptions.getRetirementAgeHint(), "assumptions.retirementAgeHint");
        nonNegative(assumptions.getLifeExpectancyOverrideYears(), "assumptions.lifeExpectancyOverrideYears");
        nonNegative(assumptions.getWorkLifeOverrideYears(), "assumptions.workLifeOverrideYears");
        aboveMinusOne(assumptions.getDiscountRateOverride(), "assumptions.discountRateOverride");
        aboveMinusOne(assumptions.getWageGrowthRateOverride(), "assumptions.wageGrowthRateOverride");
    }

    private static void required(Object value, String field) {
        if (value == null) {
            throw new InvalidConfigException(field, "is required");
        }
    }

    private static void nonNegative(BigDecimal value, String field) {
        if (value != null && value.signum() < 0) {
            throw new InvalidConfigException(field, "must be >= 0");
        }
    }

    private static void aboveMinusOne(BigDecimal value, String field) {
        if (value != null && value.compareTo(MINUS_ONE) <= 0) {
            throw new InvalidConfigException(field, "must be greater than -1");
        }
    }
}
