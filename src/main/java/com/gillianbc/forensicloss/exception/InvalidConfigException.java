package com.gillianbc.forensicloss.exception;

import com.gillianbc.forensicloss.model.PipelineStage;

/**
 * Malformed case input. Raised before any computation begins, except for
 * stage-specific requirements (e.g. a missing retirement age hint) which are
 * reported by the stage that needs them.
 */
public class InvalidConfigException extends ForensicLossException {

    private final String field;

    public InvalidConfigException(String field, String reason) {
        this(PipelineStage.CONFIGURATION, field, reason);
    }

    public InvalidConfigException(PipelineStage stage, String field, String reason) {
        super(stage, field + " " + reason);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
