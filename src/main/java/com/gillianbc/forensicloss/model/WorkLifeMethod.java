package com.gillianbc.forensicloss.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Selects how remaining work-life is derived when no direct year override is given.
 */
public enum WorkLifeMethod {
    /** Participation factor from the work-life table applied to remaining life years. */
    TABLE("table"),
    /** Years between the current age and the retirement age hint. */
    RETIREMENT_AGE_HINT("retirement-age-hint");

    private final String code;

    WorkLifeMethod(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static WorkLifeMethod fromCode(String code) {
        if (code == null) {
            return TABLE;
        }
        String normalised = code.trim().toLowerCase(Locale.ROOT);
        for (WorkLifeMethod method : values()) {
            if (method.code.equals(normalised)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown work-life method: " + code);
    }
}
