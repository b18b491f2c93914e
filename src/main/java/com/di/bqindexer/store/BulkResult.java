package com.di.bqindexer.store;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one {@link DocumentStore#bulk} call, accumulated over its batches.
 */
@Getter
@ToString
public class BulkResult {

    private long                        submitted;
    private long                        batches;
    private final List<BulkItemFailure> failures = new ArrayList<>();

    public void recordBatch(int size, List<BulkItemFailure> batchFailures) {
        submitted += size;
        batches++;
        failures.addAll(batchFailures);
    }

    public long getSucceeded() {
        return submitted - failures.size();
    }

    public List<BulkItemFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
