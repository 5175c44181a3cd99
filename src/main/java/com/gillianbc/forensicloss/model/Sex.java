package com.gillianbc.forensicloss.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Sex {
    MALE("male"),
    FEMALE("female");

    private final String code;

    Sex(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static Sex fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("sex must not be null");
        }
        String normalised = code.trim().toLowerCase(Locale.ROOT);
        for (Sex sex : values()) {
            if (sex.code.equals(normalised)) {
                return sex;
            }
        }
        throw new IllegalArgumentException("Unknown sex: " + code);
    }
}
