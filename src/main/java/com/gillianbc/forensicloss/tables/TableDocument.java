package com.gillianbc.forensicloss.tables;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.gillianbc.forensicloss.model.Citation;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Raw content of a reference table as delivered by a {@link ReferenceTableProvider}.
 */
@Getter
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class TableDocument {

    @NonNull private final String tableName;
    @NonNull private final String sourceLabel;
    @Singular private final List<TableRow> rows;

    public Citation cite(TableRow row) {
        return new Citation(sourceLabel, tableName + ": " + row.locator());
    }
}
