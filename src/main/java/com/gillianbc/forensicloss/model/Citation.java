package com.gillianbc.forensicloss.model;

import java.util.Objects;

/**
 * Where a value came from: the source document and the row or line within it.
 */
public record Citation(String sourceLabel, String locator) {

    public Citation {
        Objects.requireNonNull(sourceLabel, "sourceLabel must not be null");
        Objects.requireNonNull(locator, "locator must not be null");
    }

    public static Citation userOverride(String field) {
        return new Citation(AssumptionChoice.OVERRIDE_SOURCE, "assumptions." + field);
    }

    public static Citation caseInput(String field) {
        return new Citation("Case configuration", field);
    }
}
