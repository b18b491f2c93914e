package com.di.bqindexer.config;

import com.di.bqindexer.indexer.IndexerConfigurationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the dataset config directory:
 * <ul>
 *   <li>{@code dataset.json}: {@code name}, from which the index name is derived</li>
 *   <li>{@code bigquery.json}: {@code participant_id_column}, {@code table_names}
 *       (required), {@code sample_id_column}, {@code sample_file_columns}</li>
 *   <li>{@code deploy.json} (optional): {@code project_id} of the export bucket</li>
 * </ul>
 * Only the keys above are validated; anything else in the files is ignored.
 */
@Slf4j
@Component
public class DatasetConfigLoader {

    static final String DATASET_FILE  = "dataset.json";
    static final String BIGQUERY_FILE = "bigquery.json";
    static final String DEPLOY_FILE   = "deploy.json";

    private final ObjectMapper mapper;

    public DatasetConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public DatasetConfig load(String configDir) {
        if (configDir == null || configDir.isBlank()) {
            throw new IndexerConfigurationException(
                    "bqindexer.dataset-config-dir (DATASET_CONFIG_DIR) is required");
        }
        Path dir = Path.of(configDir);

        DatasetJson dataset = read(dir.resolve(DATASET_FILE), DatasetJson.class);
        require(dataset.getName(), "name", DATASET_FILE);

        BigQueryJson bigquery = read(dir.resolve(BIGQUERY_FILE), BigQueryJson.class);
        require(bigquery.getParticipantIdColumn(), "participant_id_column", BIGQUERY_FILE);
        if (bigquery.getTableNames() == null || bigquery.getTableNames().isEmpty()) {
            throw new IndexerConfigurationException(BIGQUERY_FILE + ": table_names must list at least one table");
        }

        String deployProjectId = null;
        Path deployPath = dir.resolve(DEPLOY_FILE);
        if (Files.exists(deployPath)) {
            DeployJson deploy = read(deployPath, DeployJson.class);
            require(deploy.getProjectId(), "project_id", DEPLOY_FILE);
            deployProjectId = deploy.getProjectId();
        }

        DatasetConfig config = DatasetConfig.builder()
                .indexName(indexName(dataset.getName()))
                .participantIdColumn(bigquery.getParticipantIdColumn())
                .sampleIdColumn(bigquery.getSampleIdColumn())
                .sampleFileColumns(bigquery.getSampleFileColumns() == null
                        ? Map.of() : bigquery.getSampleFileColumns())
                .tableNames(List.copyOf(bigquery.getTableNames()))
                .deployProjectId(deployProjectId)
                .build();
        log.info("[CONFIG] dataset '{}' → index {} ({} tables, export={})",
                 dataset.getName(), config.getIndexName(), config.getTableNames().size(),
                 deployProjectId != null);
        return config;
    }

    /** Elasticsearch index names must be lowercase and cannot contain spaces. */
    static String indexName(String datasetName) {
        return datasetName.trim().toLowerCase().replace(' ', '_');
    }

    private <T> T read(Path path, Class<T> type) {
        if (!Files.isRegularFile(path)) {
            throw new IndexerConfigurationException("Config file not found: " + path);
        }
        try {
            return mapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new IndexerConfigurationException("Cannot parse " + path + ": " + e.getMessage(), e);
        }
    }

    private static void require(String value, String key, String file) {
        if (value == null || value.isBlank()) {
            throw new IndexerConfigurationException(file + ": " + key + " is required");
        }
    }

    @Data
    static class DatasetJson {
        private String name;
    }

    @Data
    static class BigQueryJson {
        @JsonProperty("participant_id_column")
        private String participantIdColumn;
        @JsonProperty("sample_id_column")
        private String sampleIdColumn;
        @JsonProperty("sample_file_columns")
        private LinkedHashMap<String, String> sampleFileColumns;
        @JsonProperty("table_names")
        private List<String> tableNames;
    }

    @Data
    static class DeployJson {
        @JsonProperty("project_id")
        private String projectId;
    }
}
