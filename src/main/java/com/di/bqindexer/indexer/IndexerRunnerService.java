package com.di.bqindexer.indexer;

import com.di.bqindexer.config.DatasetConfig;
import com.di.bqindexer.config.DatasetConfigLoader;
import com.di.bqindexer.config.IndexerProperties;
import com.di.bqindexer.export.ExportResult;
import com.di.bqindexer.export.SampleExportWriter;
import com.di.bqindexer.source.SourceTable;
import com.di.bqindexer.source.TableSource;
import com.di.bqindexer.store.DocumentStore;
import com.di.bqindexer.util.IndexingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the whole job for the configured dataset:
 *
 * <pre>
 *  load dataset config
 *  wait for Elasticsearch
 *  recreate &lt;index&gt; and &lt;index&gt;_fields
 *  for each table, in configured order:
 *      describe → index rows → index field documents
 *  refresh both indices (+ optional settle delay)
 *  export samples             (deploy.json present)
 * </pre>
 *
 * One run at a time; a second call while a run is active gets
 * {@link IndexRunInProgressException}. Any failure aborts the run and is rethrown
 * after the report has been marked FAILED.
 */
@Service
@Slf4j
public class IndexerRunnerService {

    static final String RUN_ID_KEY = "runId";

    private final DatasetConfigLoader configLoader;
    private final TableSource         tableSource;
    private final TableIndexer        tableIndexer;
    private final DocumentStore       store;
    private final SampleExportWriter  exportWriter;
    private final IndexerProperties   properties;
    private final IndexingMetrics     metrics;

    private final AtomicBoolean       running = new AtomicBoolean();
    private volatile IndexRunReport   currentReport;
    private volatile IndexRunReport   lastReport;

    public IndexerRunnerService(DatasetConfigLoader configLoader,
                                TableSource tableSource,
                                TableIndexer tableIndexer,
                                DocumentStore store,
                                SampleExportWriter exportWriter,
                                IndexerProperties properties,
                                IndexingMetrics metrics) {
        this.configLoader = configLoader;
        this.tableSource  = tableSource;
        this.tableIndexer = tableIndexer;
        this.store        = store;
        this.exportWriter = exportWriter;
        this.properties   = properties;
        this.metrics      = metrics;
    }

    public IndexRunReport run() {
        IndexRunReport report = IndexRunReport.builder()
                .runId("run-" + UUID.randomUUID().toString().substring(0, 8))
                .status(IndexRunReport.Status.RUNNING)
                .startedAt(Instant.now())
                .build();

        if (!running.compareAndSet(false, true)) {
            IndexRunReport active = currentReport;
            throw new IndexRunInProgressException(active != null ? active.getRunId() : "unknown");
        }
        currentReport = report;
        MDC.put(RUN_ID_KEY, report.getRunId());
        try {
            execute(report);
            report.setStatus(IndexRunReport.Status.SUCCEEDED);
            log.info("[RUN] {} succeeded: {} tables into {}",
                     report.getRunId(), report.getTables().size(), report.getIndexName());
            return report;
        } catch (RuntimeException e) {
            report.setStatus(IndexRunReport.Status.FAILED);
            report.setMessage(e.getMessage());
            metrics.recordRunError();
            log.error("[RUN] {} failed: {}", report.getRunId(), e.getMessage(), e);
            throw e;
        } finally {
            report.setFinishedAt(Instant.now());
            lastReport    = report;
            currentReport = null;
            MDC.remove(RUN_ID_KEY);
            running.set(false);
        }
    }

    /** The last finished run, if any. */
    public Optional<IndexRunReport> getLastReport() {
        return Optional.ofNullable(lastReport);
    }

    public boolean isRunning() {
        return running.get();
    }

    private void execute(IndexRunReport report) {
        DatasetConfig config = configLoader.load(properties.getDatasetConfigDir());
        String index       = config.getIndexName();
        String fieldsIndex = config.getFieldsIndexName();
        String sampleIdColumn = config.hasSampleIdColumn() ? config.getSampleIdColumn() : null;
        report.setIndexName(index);

        store.waitUntilAvailable();
        store.recreateIndex(index);
        store.recreateIndex(fieldsIndex);

        for (String tableName : config.getTableNames()) {
            SourceTable table = tableSource.describe(tableName);
            TableIndexResult result = tableIndexer.indexTable(index, table,
                    config.getParticipantIdColumn(), sampleIdColumn, config.getSampleFileColumns());
            result.setFieldDocuments(tableIndexer.indexFields(fieldsIndex, table, sampleIdColumn));
            report.getTables().add(result);
        }

        store.refresh(index);
        store.refresh(fieldsIndex);
        settle(properties.getRefreshSettleDelay());

        if (config.getDeployProjectId() == null) {
            log.info("[RUN] sample export skipped: no deploy project configured");
            return;
        }
        // Written even without a sample column; downstream compose expects the object.
        ExportResult export = exportWriter.export(index, sampleIdColumn, config.getDeployProjectId());
        metrics.recordExportedSamples(export.samples());
        report.setExportLocation(export.location());
        report.setExportedSamples(export.samples());
    }

    private static void settle(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        log.info("[RUN] waiting {} ms after refresh", delay.toMillis());
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting after index refresh", e);
        }
    }
}
