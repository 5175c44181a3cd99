package com.gillianbc.forensicloss.tables;

public enum TableKind {
    MORTALITY("mortality"),
    WORK_LIFE("worklife"),
    WAGE_GROWTH("wage-growth"),
    DISCOUNT_RATES("discount-rates");

    private final String resourceName;

    TableKind(String resourceName) {
        this.resourceName = resourceName;
    }

    public String getResourceName() {
        return resourceName;
    }
}
