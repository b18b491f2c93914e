package com.di.bqindexer.source;

import java.util.Map;

/**
 * Supplies table schemas and row data to the indexer.
 *
 * <p>Rows are column → value maps. A {@code null} value means the column is
 * missing for that row; an empty string is a present value.
 */
public interface TableSource {

    /** Resolves a {@code project.dataset.table} name to its schema. */
    SourceTable describe(String tableName);

    /**
     * Returns the table rows. The iterable is consumed once; implementations
     * page through the data instead of materialising it.
     */
    Iterable<Map<String, Object>> readRows(SourceTable table);
}
