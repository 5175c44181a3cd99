package com.gillianbc.forensicloss.tables;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a reference table: its lookup keys, its value and a human readable locator
 * (line or row identifier in the source document).
 */
public record TableRow(String locator, Map<String, String> keys, BigDecimal value) {

    public TableRow {
        Objects.requireNonNull(locator, "locator must not be null");
        Objects.requireNonNull(value, "value must not be null");
        keys = Map.copyOf(Objects.requireNonNull(keys, "keys must not be null"));
    }

    public String key(String name) {
        String key = keys.get(name);
        if (key == null) {
            throw new IllegalArgumentException("Row '" + locator + "' has no '" + name + "' key");
        }
        return key;
    }

    public int intKey(String name) {
        try {
            return Integer.parseInt(key(name).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Row '" + locator + "' has a non-numeric '" + name + "' key", e);
        }
    }
}
