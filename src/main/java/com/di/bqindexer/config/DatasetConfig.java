package com.di.bqindexer.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Everything the indexer needs to know about one dataset, assembled by
 * {@link DatasetConfigLoader} from the dataset config directory.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetConfig {

    /** Elasticsearch index holding the participant documents. */
    private String              indexName;

    /** Column holding the participant id. Present in every table. */
    private String              participantIdColumn;

    /** Column holding the sample id; tables carrying it are sample tables. Optional. */
    private String              sampleIdColumn;

    /** File type label → scoped column, used for the {@code _has_<type>} sample flags. */
    private Map<String, String> sampleFileColumns;

    /** Tables to index, in order, as {@code project.dataset.table}. */
    private List<String>        tableNames;

    /** Project hosting the sample export bucket; null = no export. */
    private String              deployProjectId;

    public String getFieldsIndexName() {
        return indexName + "_fields";
    }

    public boolean hasSampleIdColumn() {
        return sampleIdColumn != null && !sampleIdColumn.isBlank();
    }
}
