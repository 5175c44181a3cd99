package com.gillianbc.forensicloss.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One cited value consumed by a pipeline stage.
 */
public record AuditEntry(PipelineStage stage,
                         String description,
                         BigDecimal value,
                         String sourceLabel,
                         String sourceLocator) {

    public AuditEntry {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(sourceLabel, "sourceLabel must not be null");
        Objects.requireNonNull(sourceLocator, "sourceLocator must not be null");
    }
}
