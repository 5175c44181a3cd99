package com.gillianbc.forensicloss.tables;

import com.gillianbc.forensicloss.exception.TableLookupException;
import com.gillianbc.forensicloss.model.CitedValue;
import com.gillianbc.forensicloss.model.PipelineStage;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Annual wage growth rates by calendar year and occupation category (SOC major group).
 */
public class WageGrowthTable {

    private final String tableName;
    private final Map<String, NavigableMap<Integer, CitedValue>> rowsByCategory;

    WageGrowthTable(TableDocument document) {
        this.tableName = document.getTableName();
        Map<String, NavigableMap<Integer, CitedValue>> rows = new HashMap<>();
        for (TableRow row : document.getRows()) {
            String category = row.key("category");
            int year = row.intKey("year");
            CitedValue previous = rows.computeIfAbsent(category, c -> new TreeMap<>())
                    .put(year, new CitedValue(row.value(), document.cite(row)));
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate wage growth row for " + year + " category " + category);
            }
        }
        rows.replaceAll((category, byYear) -> Collections.unmodifiableNavigableMap(byYear));
        this.rowsByCategory = Collections.unmodifiableMap(rows);
    }

    public CitedValue lookup(int year, String category) {
        CitedValue value = byYear(category).get(year);
        if (value == null) {
            throw new TableLookupException(PipelineStage.WAGE_GROWTH, tableName,
                    "year " + year + ", category " + category);
        }
        return value;
    }

    public int firstYear(String category) {
        return byYear(category).firstKey();
    }

    public int latestYear(String category) {
        return byYear(category).lastKey();
    }

    public String getTableName() {
        return tableName;
    }

    private NavigableMap<Integer, CitedValue> byYear(String category) {
        NavigableMap<Integer, CitedValue> byYear = rowsByCategory.get(category);
        if (byYear == null || byYear.isEmpty()) {
            throw new TableLookupException(PipelineStage.WAGE_GROWTH, tableName, "category " + category);
        }
        return byYear;
    }
}
