package com.di.bqindexer.source;

import com.di.bqindexer.indexer.IndexerConfigurationException;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.StreamSupport;

/**
 * {@link TableSource} backed by the BigQuery client.
 *
 * <p>Rows are read with a standard-SQL {@code SELECT *} billed to the client's
 * project. {@link TableResult#iterateAll()} fetches further pages on demand,
 * so only one page of rows is held at a time.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BigQueryTableSource implements TableSource {

    private final BigQuery bigQuery;

    @Override
    public SourceTable describe(String tableName) {
        TableId tableId = parseTableId(tableName);
        Table table;
        try {
            table = bigQuery.getTable(tableId);
        } catch (BigQueryException e) {
            throw new TableSourceException("Failed to read BigQuery table metadata for " + tableName, e);
        }
        if (table == null) {
            throw new TableSourceException("BigQuery table not found: " + tableName, null);
        }
        Schema tableSchema = table.getDefinition().getSchema();
        List<SchemaField> schema = BigQueryRowConverter.toSchemaFields(
                tableSchema == null ? null : tableSchema.getFields());
        log.debug("[SOURCE] {} has {} top-level columns", tableName, schema.size());
        return new SourceTable(standardName(tableId), schema);
    }

    @Override
    public Iterable<Map<String, Object>> readRows(SourceTable table) {
        String sql = String.format("SELECT * FROM `%s`", table.name());
        TableResult result;
        try {
            QueryJobConfiguration cfg = QueryJobConfiguration.newBuilder(sql)
                    .setUseLegacySql(false)
                    .build();
            result = bigQuery.query(cfg);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TableSourceException("BigQuery read interrupted for " + table.name(), e);
        } catch (BigQueryException e) {
            throw new TableSourceException("BigQuery read failed for " + table.name(), e);
        }
        log.info("[SOURCE] {} has {} rows", table.name(), result.getTotalRows());

        List<SchemaField> resultSchema = result.getSchema() != null
                ? BigQueryRowConverter.toSchemaFields(result.getSchema().getFields())
                : table.schema();
        return () -> StreamSupport.stream(result.iterateAll().spliterator(), false)
                .map(values -> BigQueryRowConverter.toRow(values, resultSchema))
                .iterator();
    }

    /**
     * Splits {@code project.dataset.table} from the right: project ids may
     * themselves contain {@code .} or {@code :} (e.g. {@code google.com:my-project}).
     * A name that does not fit is a configuration error in bigquery.json.
     */
    static TableId parseTableId(String tableName) {
        if (tableName == null) {
            throw new IndexerConfigurationException("Table name is required");
        }
        int tableDot   = tableName.lastIndexOf('.');
        int datasetDot = tableDot > 0 ? tableName.lastIndexOf('.', tableDot - 1) : -1;
        if (datasetDot <= 0) {
            throw new IndexerConfigurationException(
                    "Table name must be <project>.<dataset>.<table>: " + tableName);
        }
        return TableId.of(
                tableName.substring(0, datasetDot),
                tableName.substring(datasetDot + 1, tableDot),
                tableName.substring(tableDot + 1));
    }

    static String standardName(TableId tableId) {
        return String.join(".", tableId.getProject(), tableId.getDataset(), tableId.getTable());
    }
}
