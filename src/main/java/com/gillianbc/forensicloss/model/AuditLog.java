package com.gillianbc.forensicloss.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of every assumption and table value consumed during one case run.
 * <p>
 * A log belongs to exactly one run. Stages append in the order they execute; nothing is
 * removed or reordered. {@link #freeze()} ends the run and returns the final sequence.
 * Not thread-safe: a run is sequential.
 */
public class AuditLog {

    private final List<AuditEntry> entries = new ArrayList<>();
    private boolean frozen;

    public void record(PipelineStage stage, String description, BigDecimal value,
                       String sourceLabel, String sourceLocator) {
        if (frozen) {
            throw new IllegalStateException("Audit log is frozen; the run has completed");
        }
        entries.add(new AuditEntry(stage, description, value, sourceLabel, sourceLocator));
    }

    public void record(PipelineStage stage, String description, CitedValue cited) {
        record(stage, description, cited.value(), cited.citation().sourceLabel(), cited.citation().locator());
    }

    /**
     * @return read-only live view of the entries recorded so far
     */
    public List<AuditEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Stops further appends and returns an immutable copy of the entries.
     */
    public List<AuditEntry> freeze() {
        frozen = true;
        return List.copyOf(entries);
    }
}
