package com.di.bqindexer;

import com.di.bqindexer.config.DatasetConfigLoader;
import com.di.bqindexer.config.IndexerProperties;
import com.di.bqindexer.export.BlobStore;
import com.di.bqindexer.export.SampleExportWriter;
import com.di.bqindexer.indexer.IndexerRunnerService;
import com.di.bqindexer.indexer.TableIndexer;
import com.di.bqindexer.source.SchemaField;
import com.di.bqindexer.source.SourceTable;
import com.di.bqindexer.source.TableSource;
import com.di.bqindexer.store.InMemoryDocumentStore;
import com.di.bqindexer.util.IndexingMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Basic smoke test for BigQueryIndexerApplication. The Spring context needs
 * Google credentials, so this exercises the startup run without it.
 */
@DisplayName("BigQueryIndexerApplication Tests")
class BigQueryIndexerApplicationTests {

	@TempDir
	Path configDir;

	private IndexerRunnerService runner(String datasetConfigDir) {
		ObjectMapper mapper = new ObjectMapper();
		InMemoryDocumentStore store = new InMemoryDocumentStore();
		IndexingMetrics metrics = new IndexingMetrics(new SimpleMeterRegistry());
		TableSource source = new TableSource() {
			@Override
			public SourceTable describe(String tableName) {
				return new SourceTable(tableName, List.of(SchemaField.scalar("pid", "STRING")));
			}

			@Override
			public Iterable<Map<String, Object>> readRows(SourceTable table) {
				return List.of();
			}
		};
		BlobStore unused = (project, container, name, content, contentType) -> "mem://" + container + "/" + name;
		IndexerProperties properties = new IndexerProperties();
		properties.setDatasetConfigDir(datasetConfigDir);
		return new IndexerRunnerService(new DatasetConfigLoader(mapper), source,
				new TableIndexer(source, store, metrics), store,
				new SampleExportWriter(store, unused, properties, mapper), properties, metrics);
	}

	@Test
	@DisplayName("Should have main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = BigQueryIndexerApplication.class.getMethod("main", String[].class);
		assertTrue(java.lang.reflect.Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(java.lang.reflect.Modifier.isPublic(mainMethod.getModifiers()));
	}

	@Test
	@DisplayName("Should exit with status 1 when the startup run fails")
	void testRunOnce_Failure() {
		assertEquals(1, BigQueryIndexerApplication.runOnce(runner(null)));
	}

	@Test
	@DisplayName("Should exit with status 0 when the startup run succeeds")
	void testRunOnce_Success() throws IOException {
		Files.writeString(configDir.resolve("dataset.json"), "{\"name\": \"ds\"}");
		Files.writeString(configDir.resolve("bigquery.json"), "{\"participant_id_column\": \"pid\", \"table_names\": [\"p.d.t\"]}");

		assertEquals(0, BigQueryIndexerApplication.runOnce(runner(configDir.toString())));
	}
}
