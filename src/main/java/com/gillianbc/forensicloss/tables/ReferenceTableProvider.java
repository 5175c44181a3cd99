package com.gillianbc.forensicloss.tables;

/**
 * Source of reference table data. Implementations decide the storage format; callers
 * only ask for a table by kind.
 */
@FunctionalInterface
public interface ReferenceTableProvider {

    /**
     * @throws com.gillianbc.forensicloss.exception.TableLookupException if the table cannot be found or read
     */
    TableDocument load(TableKind kind);
}
