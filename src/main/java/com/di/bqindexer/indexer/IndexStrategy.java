package com.di.bqindexer.indexer;

/** How a table's rows are written. */
public enum IndexStrategy {
    /** Participant table: top-level partial documents. */
    PARTIAL_DOCUMENT,
    /** Sample table: scripted find-or-append merges into {@code samples}. */
    SAMPLE_MERGE
}
