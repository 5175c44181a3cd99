package com.gillianbc.forensicloss.tables;

import com.gillianbc.forensicloss.exception.TableLookupException;
import com.gillianbc.forensicloss.model.CitedValue;
import com.gillianbc.forensicloss.model.PipelineStage;
import com.gillianbc.forensicloss.model.Sex;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Expectation of life (remaining years) at each integer age, by sex.
 */
public class MortalityTable {

    private final String tableName;
    private final Map<Sex, NavigableMap<Integer, CitedValue>> rowsBySex;

    MortalityTable(TableDocument document) {
        this.tableName = document.getTableName();
        Map<Sex, NavigableMap<Integer, CitedValue>> rows = new EnumMap<>(Sex.class);
        for (TableRow row : document.getRows()) {
            Sex sex = Sex.fromCode(row.key("sex"));
            int age = row.intKey("age");
            if (row.value().signum() < 0) {
                throw new IllegalArgumentException("Row '" + row.locator() + "' has negative life expectancy");
            }
            CitedValue previous = rows.computeIfAbsent(sex, s -> new TreeMap<>())
                    .put(age, new CitedValue(row.value(), document.cite(row)));
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate mortality row for age " + age + " " + sex.getCode());
            }
        }
        rows.replaceAll((sex, byAge) -> Collections.unmodifiableNavigableMap(byAge));
        this.rowsBySex = Collections.unmodifiableMap(rows);
    }

    public CitedValue lookup(int age, Sex sex) {
        NavigableMap<Integer, CitedValue> byAge = rowsBySex.get(sex);
        CitedValue value = byAge == null ? null : byAge.get(age);
        if (value == null) {
            throw new TableLookupException(PipelineStage.LIFE_EXPECTANCY, tableName,
                    "age " + age + ", sex " + sex.getCode());
        }
        return value;
    }

    public int maxAge(Sex sex) {
        NavigableMap<Integer, CitedValue> byAge = rowsBySex.get(sex);
        if (byAge == null || byAge.isEmpty()) {
            throw new TableLookupException(PipelineStage.LIFE_EXPECTANCY, tableName, "sex " + sex.getCode());
        }
        return byAge.lastKey();
    }

    public String getTableName() {
        return tableName;
    }
}
