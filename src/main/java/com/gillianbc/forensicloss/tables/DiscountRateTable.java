package com.gillianbc.forensicloss.tables;

import com.gillianbc.forensicloss.exception.TableLookupException;
import com.gillianbc.forensicloss.model.CitedValue;
import com.gillianbc.forensicloss.model.PipelineStage;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Named discount-rate series (e.g. treasury-1y), one rate per calendar year.
 */
public class DiscountRateTable {

    private final String tableName;
    private final Map<String, Map<Integer, CitedValue>> rowsBySeries;

    DiscountRateTable(TableDocument document) {
        this.tableName = document.getTableName();
        Map<String, Map<Integer, CitedValue>> rows = new HashMap<>();
        for (TableRow row : document.getRows()) {
            String series = row.key("series");
            int year = row.intKey("year");
            CitedValue previous = rows.computeIfAbsent(series, s -> new HashMap<>())
                    .put(year, new CitedValue(row.value(), document.cite(row)));
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate discount rate row for " + series + " " + year);
            }
        }
        rows.replaceAll((series, byYear) -> Map.copyOf(byYear));
        this.rowsBySeries = Collections.unmodifiableMap(rows);
    }

    public CitedValue lookup(String series, int year) {
        Map<Integer, CitedValue> byYear = rowsBySeries.get(series);
        CitedValue value = byYear == null ? null : byYear.get(year);
        if (value == null) {
            throw new TableLookupException(PipelineStage.DISCOUNTING, tableName,
                    "series " + series + ", year " + year);
        }
        return value;
    }

    public String getTableName() {
        return tableName;
    }
}
