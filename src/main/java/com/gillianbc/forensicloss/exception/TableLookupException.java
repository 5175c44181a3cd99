package com.gillianbc.forensicloss.exception;

import com.gillianbc.forensicloss.model.PipelineStage;

/**
 * A reference table has no row for the requested key. Fatal for the run.
 */
public class TableLookupException extends ForensicLossException {

    private final String tableName;
    private final String key;

    public TableLookupException(PipelineStage stage, String tableName, String key) {
        super(stage, "No row in table '" + tableName + "' for " + key);
        this.tableName = tableName;
        this.key = key;
    }

    public TableLookupException(PipelineStage stage, String tableName, String key, Throwable cause) {
        super(stage, "Unable to read table '" + tableName + "' (" + key + ")", cause);
        this.tableName = tableName;
        this.key = key;
    }

    public String getTableName() {
        return tableName;
    }

    public String getKey() {
        return key;
    }
}
