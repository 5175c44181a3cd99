package com.gillianbc.forensicloss.model;

import java.math.BigDecimal;
import java.util.Objects;

public record CitedValue(BigDecimal value, Citation citation) {

    public CitedValue {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(citation, "citation must not be null");
    }
}
