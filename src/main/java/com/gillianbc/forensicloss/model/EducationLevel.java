package com.gillianbc.forensicloss.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Highest educational attainment, using the codes of the case intake form.
 */
public enum EducationLevel {
    HIGH_SCHOOL("HS"),
    SOME_COLLEGE("SomeCollege"),
    BACHELORS("BA"),
    MASTERS("MA"),
    DOCTORATE("PhD"),
    OTHER("Other");

    private final String code;

    EducationLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static EducationLevel fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("education level must not be null");
        }
        for (EducationLevel level : values()) {
            if (level.code.equalsIgnoreCase(code.trim())) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown education level: " + code);
    }
}
