package com.gillianbc.forensicloss.model;

/**
 * Stages of a case run, in execution order. The label matches the report
 * section that displays the stage's output.
 */
public enum PipelineStage {
    CONFIGURATION("dashboard"),
    REFERENCE_TABLES("reference_tables"),
    LIFE_EXPECTANCY("life_expectancy"),
    WORK_LIFE("worklife_lookup"),
    WAGE_GROWTH("wage_growth"),
    EARNINGS("projections"),
    DISCOUNTING("discount_factors");

    private final String label;

    PipelineStage(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
