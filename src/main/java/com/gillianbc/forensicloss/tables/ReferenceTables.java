package com.gillianbc.forensicloss.tables;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * The full set of reference tables, loaded once and read-only afterwards. Safe to share
 * between concurrent case runs.
 */
@Slf4j
public final class ReferenceTables {

    private final MortalityTable mortality;
    private final WorkLifeTable workLife;
    private final WageGrowthTable wageGrowth;
    private final DiscountRateTable discountRates;

    private ReferenceTables(MortalityTable mortality,
                            WorkLifeTable workLife,
                            WageGrowthTable wageGrowth,
                            DiscountRateTable discountRates) {
        this.mortality = mortality;
        this.workLife = workLife;
        this.wageGrowth = wageGrowth;
        this.discountRates = discountRates;
    }

    public static ReferenceTables load(ReferenceTableProvider provider) {
        Objects.requireNonNull(provider, "provider must not be null");
        ReferenceTables tables = new ReferenceTables(
                new MortalityTable(provider.load(TableKind.MORTALITY)),
                new WorkLifeTable(provider.load(TableKind.WORK_LIFE)),
                new WageGrowthTable(provider.load(TableKind.WAGE_GROWTH)),
                new DiscountRateTable(provider.load(TableKind.DISCOUNT_RATES)));
        log.info("Reference tables loaded: {}, {}, {}, {}",
                tables.mortality.getTableName(), tables.workLife.getTableName(),
                tables.wageGrowth.getTableName(), tables.discountRates.getTableName());
        return tables;
    }

    public MortalityTable mortality() {
        return mortality;
    }

    public WorkLifeTable workLife() {
        return workLife;
    }

    public WageGrowthTable wageGrowth() {
        return wageGrowth;
    }

    public DiscountRateTable discountRates() {
        return discountRates;
    }
}
