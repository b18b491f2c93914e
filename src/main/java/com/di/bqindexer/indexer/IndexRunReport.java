package com.di.bqindexer.indexer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one indexer run, returned by the runs API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexRunReport {

    public enum Status { RUNNING, SUCCEEDED, FAILED }

    private String                 runId;
    private String                 indexName;
    private Status                 status;
    @Builder.Default
    private List<TableIndexResult> tables = new ArrayList<>();
    /** {@code gs://bucket/blob}; null when the export was skipped. */
    private String                 exportLocation;
    private long                   exportedSamples;
    private Instant                startedAt;
    private Instant                finishedAt;
    /** Failure message when {@link #status} is FAILED. */
    private String                 message;
}
