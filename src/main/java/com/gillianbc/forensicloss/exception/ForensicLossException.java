package com.gillianbc.forensicloss.exception;

import com.gillianbc.forensicloss.model.PipelineStage;

/**
 * Base type for every failure raised by a case run. A run that throws one of these
 * produces no partial result.
 */
public abstract class ForensicLossException extends RuntimeException {

    private final PipelineStage stage;

    protected ForensicLossException(PipelineStage stage, String message) {
        super("[" + stage.getLabel() + "] " + message);
        this.stage = stage;
    }

    protected ForensicLossException(PipelineStage stage, String message, Throwable cause) {
        super("[" + stage.getLabel() + "] " + message, cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
