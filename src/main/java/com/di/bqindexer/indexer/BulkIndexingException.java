package com.di.bqindexer.indexer;

import com.di.bqindexer.store.BulkItemFailure;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Some operations of a table were rejected by the document store. The table
 * counts as not indexed; every rejected participant id is listed.
 */
public class BulkIndexingException extends RuntimeException {

    private final String                table;
    private final List<BulkItemFailure> failures;

    public BulkIndexingException(String table, List<BulkItemFailure> failures) {
        super(message(table, failures));
        this.table    = table;
        this.failures = List.copyOf(failures);
    }

    public String getTable() {
        return table;
    }

    public List<BulkItemFailure> getFailures() {
        return failures;
    }

    private static String message(String table, List<BulkItemFailure> failures) {
        String listed = failures.stream()
                .map(BulkItemFailure::toString)
                .collect(Collectors.joining("\n  ", "\n  ", ""));
        return failures.size() + " operation(s) failed while indexing " + table + ":" + listed;
    }
}
