package com.gillianbc.forensicloss.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Whether the decedent was participating in the labour force at the evaluation date.
 * An inactive person (retired, not working) has no remaining work-life.
 */
public enum ActiveStatus {
    ACTIVE("active"),
    INACTIVE("inactive");

    private final String code;

    ActiveStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ActiveStatus fromCode(String code) {
        if (code == null) {
            return ACTIVE;
        }
        String normalised = code.trim().toLowerCase(Locale.ROOT);
        for (ActiveStatus status : values()) {
            if (status.code.equals(normalised)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown active status: " + code);
    }
}
