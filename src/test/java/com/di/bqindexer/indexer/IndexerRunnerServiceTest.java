package com.di.bqindexer.indexer;

import com.di.bqindexer.config.DatasetConfigLoader;
import com.di.bqindexer.config.IndexerProperties;
import com.di.bqindexer.export.RecordingBlobStore;
import com.di.bqindexer.export.SampleExportWriter;
import com.di.bqindexer.source.SourceTable;
import com.di.bqindexer.store.InMemoryDocumentStore;
import com.di.bqindexer.util.IndexingMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static com.di.bqindexer.indexer.FakeTableSource.row;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for IndexerRunnerService: step ordering, export gating and the run guard.
 */
@DisplayName("IndexerRunnerService Tests")
class IndexerRunnerServiceTest {

    private static final String INDEX  = "my_dataset";
    private static final String FIELDS = "my_dataset_fields";

    @TempDir
    Path configDir;

    private final ObjectMapper mapper = new ObjectMapper();

    private InMemoryDocumentStore store;
    private RecordingBlobStore    blobStore;
    private SimpleMeterRegistry   registry;
    private IndexerProperties     properties;

    @BeforeEach
    void setUp() throws IOException {
        store      = new InMemoryDocumentStore();
        blobStore  = new RecordingBlobStore();
        registry   = new SimpleMeterRegistry();
        properties = new IndexerProperties();
        properties.setDatasetConfigDir(configDir.toString());

        Files.writeString(configDir.resolve("dataset.json"), """
                {"name": "My Dataset"}
                """);
        Files.writeString(configDir.resolve("bigquery.json"), """
                {
                  "participant_id_column": "pid",
                  "sample_id_column": "sid",
                  "table_names": ["proj.ds.weight", "proj.ds.center", "proj.ds.platform"]
                }
                """);
    }

    private FakeTableSource tables(FakeTableSource source) {
        return source
                .table("proj.ds.weight", List.of("pid", "weight"), List.of(row("pid", "P1", "weight", "70")))
                .table("proj.ds.center", List.of("pid", "sid", "center"), List.of(row("pid", "P1", "sid", "S1", "center", "A")))
                .table("proj.ds.platform", List.of("pid", "sid", "platform"), List.of(row("pid", "P1", "sid", "S1", "platform", "X")));
    }

    private IndexerRunnerService runner(FakeTableSource source) {
        IndexingMetrics metrics = new IndexingMetrics(registry);
        return new IndexerRunnerService(
                new DatasetConfigLoader(mapper),
                source,
                new TableIndexer(source, store, metrics),
                store,
                new SampleExportWriter(store, blobStore, properties, mapper),
                properties,
                metrics);
    }

    private void writeDeployConfig() throws IOException {
        Files.writeString(configDir.resolve("deploy.json"), """
                {"project_id": "deploy-proj"}
                """);
    }

    @Test
    @DisplayName("Should recreate indices, index tables in order, refresh, then export")
    void testRun_StepOrder() throws IOException {
        writeDeployConfig();

        IndexRunReport report = runner(tables(new FakeTableSource())).run();

        List<String> events = store.getEvents();
        assertEquals(List.of("available", "recreate:" + INDEX, "recreate:" + FIELDS), events.subList(0, 3));
        assertTrue(events.indexOf("write:" + INDEX + ":P1") < events.indexOf("mapping:" + INDEX));
        assertTrue(events.indexOf("refresh:" + INDEX) < events.indexOf("scan:" + INDEX));
        assertTrue(events.indexOf("refresh:" + FIELDS) < events.indexOf("scan:" + INDEX));
        assertEquals("scan:" + INDEX, events.get(events.size() - 1));

        assertEquals(IndexRunReport.Status.SUCCEEDED, report.getStatus());
        assertEquals(INDEX, report.getIndexName());
        assertEquals(List.of("proj.ds.weight", "proj.ds.center", "proj.ds.platform"),
                report.getTables().stream().map(TableIndexResult::getTable).toList());
        assertEquals(2, report.getTables().get(0).getFieldDocuments());
        assertEquals("mem://deploy-proj-export-samples/samples", report.getExportLocation());
        assertEquals(1, report.getExportedSamples());
        assertNotNull(report.getFinishedAt());
    }

    @Test
    @DisplayName("Should skip the export when no deploy config is present")
    void testRun_NoDeployConfig() {
        IndexRunReport report = runner(tables(new FakeTableSource())).run();

        assertNull(report.getExportLocation());
        assertTrue(blobStore.getObjects().isEmpty());
        assertFalse(store.getEvents().contains("scan:" + INDEX));
        assertTrue(store.getEvents().contains("refresh:" + INDEX));
    }

    @Test
    @DisplayName("Should still write an empty sample export when no sample column is configured")
    void testRun_NoSampleColumn() throws IOException {
        writeDeployConfig();
        Files.writeString(configDir.resolve("bigquery.json"), """
                {"participant_id_column": "pid", "table_names": ["proj.ds.weight"]}
                """);

        IndexRunReport report = runner(tables(new FakeTableSource())).run();

        assertEquals(IndexRunReport.Status.SUCCEEDED, report.getStatus());
        assertEquals("mem://deploy-proj-export-samples/samples", report.getExportLocation());
        assertEquals(0L, report.getExportedSamples());
        assertEquals("[", blobStore.content("deploy-proj-export-samples", "samples").strip());
        assertEquals("deploy-proj", blobStore.project("deploy-proj-export-samples", "samples"));
    }

    @Test
    @DisplayName("Should record a failed run and rethrow its error")
    void testRun_Failure() {
        IndexerRunnerService runner = runner(new FakeTableSource());

        assertThrows(RuntimeException.class, runner::run);

        IndexRunReport last = runner.getLastReport().orElseThrow();
        assertEquals(IndexRunReport.Status.FAILED, last.getStatus());
        assertTrue(last.getMessage().contains("proj.ds.weight"));
        assertFalse(runner.isRunning());
        assertNull(MDC.get("runId"));
        assertEquals(1.0, registry.get("bqindexer.runs.failed").counter().count());
    }

    @Test
    @DisplayName("Should reject a run started while another is active")
    void testRun_RejectsConcurrentRun() {
        AtomicReference<IndexerRunnerService> self   = new AtomicReference<>();
        AtomicReference<RuntimeException>     nested = new AtomicReference<>();
        FakeTableSource source = tables(new FakeTableSource() {
            @Override
            public SourceTable describe(String tableName) {
                if (nested.get() == null) {
                    try {
                        self.get().run();
                    } catch (RuntimeException e) {
                        nested.set(e);
                    }
                }
                return super.describe(tableName);
            }
        });
        self.set(runner(source));

        IndexRunReport report = self.get().run();

        assertInstanceOf(IndexRunInProgressException.class, nested.get());
        assertEquals(IndexRunReport.Status.SUCCEEDED, report.getStatus());
        assertEquals(report, self.get().getLastReport().orElseThrow());
    }

    @Test
    @DisplayName("Should have no last report before the first run")
    void testGetLastReport_Empty() {
        assertTrue(runner(new FakeTableSource()).getLastReport().isEmpty());
    }
}
