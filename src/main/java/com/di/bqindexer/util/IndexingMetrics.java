package com.di.bqindexer.util;

import com.di.bqindexer.indexer.IndexStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Meters for table indexing and the sample export.
 */
@Component
public class IndexingMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter failedOperationCounter;
    private final Counter skippedRowCounter;
    private final Counter exportedSampleCounter;
    private final Counter runErrorCounter;

    public IndexingMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.failedOperationCounter = Counter.builder("bqindexer.operations.failed")
                .description("Bulk operations rejected by the document store")
                .register(meterRegistry);

        this.skippedRowCounter = Counter.builder("bqindexer.rows.skipped")
                .description("Rows without a participant or sample id")
                .register(meterRegistry);

        this.exportedSampleCounter = Counter.builder("bqindexer.export.samples")
                .description("Samples written by the export")
                .register(meterRegistry);

        this.runErrorCounter = Counter.builder("bqindexer.runs.failed")
                .description("Indexer runs that ended in an error")
                .register(meterRegistry);
    }

    public void recordTable(IndexStrategy strategy, long rows, long operations, long durationMs) {
        Counter.builder("bqindexer.rows.read")
                .description("Rows read from source tables")
                .tag("strategy", strategy.name())
                .register(meterRegistry)
                .increment(rows);
        Counter.builder("bqindexer.operations.indexed")
                .description("Operations accepted by the document store")
                .tag("strategy", strategy.name())
                .register(meterRegistry)
                .increment(operations);
        Timer.builder("bqindexer.table.duration")
                .description("Time taken to index one table")
                .tag("strategy", strategy.name())
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordFailedOperations(long count) {
        failedOperationCounter.increment(count);
    }

    public void recordSkippedRows(long count) {
        skippedRowCounter.increment(count);
    }

    public void recordExportedSamples(long count) {
        exportedSampleCounter.increment(count);
    }

    public void recordRunError() {
        runErrorCounter.increment();
    }
}
