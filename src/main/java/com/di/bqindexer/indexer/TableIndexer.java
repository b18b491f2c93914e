package com.di.bqindexer.indexer;

import com.di.bqindexer.document.FieldDocumentBuilder;
import com.di.bqindexer.document.IndexOperation;
import com.di.bqindexer.document.ParticipantDocumentBuilder;
import com.di.bqindexer.document.PartialDocumentUpdate;
import com.di.bqindexer.document.SampleMergeScriptBuilder;
import com.di.bqindexer.mapping.NestedMappingBuilder;
import com.di.bqindexer.source.SourceTable;
import com.di.bqindexer.source.TableSource;
import com.di.bqindexer.store.BulkResult;
import com.di.bqindexer.store.DocumentStore;
import com.di.bqindexer.util.IndexingMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Indexes one source table into the participant index.
 *
 * <pre>
 *  1. check the participant-id column exists        (else fatal config error)
 *  2. apply nested mappings                          (before any write)
 *  3. stream rows → operations                       (lazy, one pass)
 *       sample-id column present → SAMPLE_MERGE
 *       otherwise                → PARTIAL_DOCUMENT
 *  4. one bulk submission for the whole table
 *  5. any rejected item → BulkIndexingException
 * </pre>
 *
 * Holds no state between calls; the caller sequences tables.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TableIndexer {

    private final TableSource     tableSource;
    private final DocumentStore   store;
    private final IndexingMetrics metrics;

    /**
     * @param index               participant index
     * @param table               resolved source table
     * @param participantIdColumn column holding the participant id
     * @param sampleIdColumn      column holding the sample id; null when the dataset has no samples
     * @param sampleFileColumns   file type label → scoped column, for {@code _has_<type>} flags
     */
    public TableIndexResult indexTable(String index,
                                       SourceTable table,
                                       String participantIdColumn,
                                       String sampleIdColumn,
                                       Map<String, String> sampleFileColumns) {
        long start = System.currentTimeMillis();

        if (!table.hasColumn(participantIdColumn)) {
            throw new IndexerConfigurationException(String.format(
                    "Participant ID column %s not found in BigQuery table %s", participantIdColumn, table.name()));
        }

        Map<String, Object> mapping = NestedMappingBuilder.tableMapping(table, sampleIdColumn);
        if (!mapping.isEmpty()) {
            log.info("[INDEX] applying nested mappings of {} to {}", table.name(), index);
            store.putMapping(index, mapping);
        }

        IndexStrategy strategy = table.hasColumn(sampleIdColumn)
                ? IndexStrategy.SAMPLE_MERGE
                : IndexStrategy.PARTIAL_DOCUMENT;
        log.info("[INDEX] indexing {} into {} as {}", table.name(), index, strategy);

        Function<Map<String, Object>, Optional<? extends IndexOperation>> builder =
                strategy == IndexStrategy.SAMPLE_MERGE
                        ? new SampleMergeScriptBuilder(table.name(), participantIdColumn, sampleIdColumn, sampleFileColumns)::build
                        : new ParticipantDocumentBuilder(table.name(), participantIdColumn)::build;

        AtomicLong rows    = new AtomicLong();
        AtomicLong skipped = new AtomicLong();
        Iterator<IndexOperation> operations = StreamSupport.stream(tableSource.readRows(table).spliterator(), false)
                .peek(row -> rows.incrementAndGet())
                .map(builder)
                .<IndexOperation>flatMap(op -> {
                    if (op.isEmpty()) {
                        skipped.incrementAndGet();
                        return Stream.empty();
                    }
                    return Stream.of(op.get());
                })
                .iterator();

        BulkResult result = store.bulk(index, operations);
        if (skipped.get() > 0) {
            metrics.recordSkippedRows(skipped.get());
        }
        if (result.hasFailures()) {
            metrics.recordFailedOperations(result.getFailures().size());
            throw new BulkIndexingException(table.name(), result.getFailures());
        }

        long durationMs = System.currentTimeMillis() - start;
        metrics.recordTable(strategy, rows.get(), result.getSucceeded(), durationMs);
        log.info("[INDEX] {} done: rows={} operations={} skipped={} in {} ms",
                 table.name(), rows.get(), result.getSucceeded(), skipped.get(), durationMs);

        return TableIndexResult.builder()
                .table(table.name())
                .strategy(strategy)
                .rows(rows.get())
                .operations(result.getSucceeded())
                .skippedRows(skipped.get())
                .mappingApplied(!mapping.isEmpty())
                .durationMs(durationMs)
                .build();
    }

    /**
     * Writes one lookup document per leaf column of {@code table} into the
     * fields index and returns how many were written.
     */
    public long indexFields(String fieldsIndex, SourceTable table, String sampleIdColumn) {
        log.info("[INDEX] indexing fields of {} into {}", table.name(), fieldsIndex);
        List<PartialDocumentUpdate> docs = FieldDocumentBuilder.fieldDocuments(table, sampleIdColumn);
        BulkResult result = store.bulk(fieldsIndex, docs.iterator());
        if (result.hasFailures()) {
            metrics.recordFailedOperations(result.getFailures().size());
            throw new BulkIndexingException(table.name() + " (fields)", result.getFailures());
        }
        return result.getSucceeded();
    }
}
