package com.gillianbc.forensicloss.tables;

import com.gillianbc.forensicloss.exception.TableLookupException;
import com.gillianbc.forensicloss.model.CitedValue;
import com.gillianbc.forensicloss.model.EducationLevel;
import com.gillianbc.forensicloss.model.PipelineStage;
import com.gillianbc.forensicloss.model.Sex;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Labour force participation factors, the share of remaining life expected to be spent
 * working, keyed by age bracket (inclusive bounds), sex and education.
 */
public class WorkLifeTable {

    private final String tableName;
    private final List<Bracket> brackets;

    WorkLifeTable(TableDocument document) {
        this.tableName = document.getTableName();
        List<Bracket> rows = new ArrayList<>();
        for (TableRow row : document.getRows()) {
            Bracket bracket = new Bracket(
                    row.intKey("ageFrom"),
                    row.intKey("ageTo"),
                    Sex.fromCode(row.key("sex")),
                    EducationLevel.fromCode(row.key("education")),
                    new CitedValue(row.value(), document.cite(row)));
            if (bracket.ageFrom() > bracket.ageTo()) {
                throw new IllegalArgumentException("Row '" + row.locator() + "' has ageFrom > ageTo");
            }
            if (row.value().signum() < 0 || row.value().compareTo(BigDecimal.ONE) > 0) {
                throw new IllegalArgumentException("Row '" + row.locator() + "' factor must be within [0, 1]");
            }
            rows.add(bracket);
        }
        this.brackets = List.copyOf(rows);
    }

    public CitedValue lookup(int age, Sex sex, EducationLevel education) {
        return brackets.stream()
                .filter(b -> b.sex() == sex && b.education() == education)
                .filter(b -> age >= b.ageFrom() && age <= b.ageTo())
                .map(Bracket::factor)
                .findFirst()
                .orElseThrow(() -> new TableLookupException(PipelineStage.WORK_LIFE, tableName,
                        "age " + age + ", sex " + sex.getCode() + ", education " + education.getCode()));
    }

    public String getTableName() {
        return tableName;
    }

    private record Bracket(int ageFrom, int ageTo, Sex sex, EducationLevel education, CitedValue factor) {
    }
}
