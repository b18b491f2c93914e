package com.di.bqindexer.indexer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary of one successfully indexed table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableIndexResult {

    private String        table;
    private IndexStrategy strategy;

    /** Rows read from the source. */
    private long          rows;

    /** Operations accepted by the store. */
    private long          operations;

    /** Rows without a participant or sample id. */
    private long          skippedRows;

    /** Whether a mapping update was applied before the writes. */
    private boolean       mappingApplied;

    /** Lookup documents written to the fields index. */
    private long          fieldDocuments;

    private long          durationMs;
}
