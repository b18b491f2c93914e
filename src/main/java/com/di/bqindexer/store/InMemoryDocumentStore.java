package com.di.bqindexer.store;

import com.di.bqindexer.document.IndexOperation;
import com.di.bqindexer.document.PartialDocumentUpdate;
import com.di.bqindexer.document.SampleMergeUpdate;
import com.di.bqindexer.document.SampleMerger;
import com.di.bqindexer.mapping.NestedMappingBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * In-memory {@link DocumentStore} applying the same update semantics as the
 * Elasticsearch store: partial updates merge top-level fields, sample merges go
 * through {@link SampleMerger}. Not thread-safe.
 *
 * <p>Every call is appended to {@link #getEvents()} ({@code "mapping:<index>"},
 * {@code "write:<index>:<id>"}, ...) so callers can check call ordering.
 */
@Slf4j
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, Map<String, Map<String, Object>>> indices  = new HashMap<>();
    private final Map<String, List<Map<String, Object>>>        mappings = new HashMap<>();
    private final Map<String, String>                           rejected = new HashMap<>();
    private final List<String>                                  events   = new ArrayList<>();

    /** Makes every later write to {@code entityId} fail with {@code reason}. */
    public void reject(String entityId, String reason) {
        rejected.put(entityId, reason);
    }

    public List<String> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<Map<String, Object>> getMappings(String index) {
        return mappings.getOrDefault(index, List.of());
    }

    /** The stored document, or null. */
    public Map<String, Object> get(String index, String id) {
        return indices.getOrDefault(index, Map.of()).get(id);
    }

    public int count(String index) {
        return indices.getOrDefault(index, Map.of()).size();
    }

    @Override
    public void waitUntilAvailable() {
        events.add("available");
    }

    @Override
    public void recreateIndex(String index) {
        events.add("recreate:" + index);
        indices.put(index, new LinkedHashMap<>());
        mappings.remove(index);
    }

    @Override
    public void putMapping(String index, Map<String, Object> mapping) {
        events.add("mapping:" + index);
        mappings.computeIfAbsent(index, k -> new ArrayList<>()).add(mapping);
    }

    @Override
    public BulkResult bulk(String index, Iterator<? extends IndexOperation> operations) {
        BulkResult result = new BulkResult();
        Map<String, Map<String, Object>> docs = indices.computeIfAbsent(index, k -> new LinkedHashMap<>());
        int size = 0;
        List<BulkItemFailure> failures = new ArrayList<>();
        while (operations.hasNext()) {
            IndexOperation op = operations.next();
            size++;
            events.add("write:" + index + ":" + op.entityId());
            if (rejected.containsKey(op.entityId())) {
                failures.add(new BulkItemFailure(op.entityId(), 400, "rejected", rejected.get(op.entityId())));
                continue;
            }
            apply(docs.computeIfAbsent(op.entityId(), k -> new LinkedHashMap<>()), op);
        }
        result.recordBatch(size, failures);
        return result;
    }

    @SuppressWarnings("unchecked")
    private static void apply(Map<String, Object> doc, IndexOperation op) {
        if (op instanceof PartialDocumentUpdate update) {
            doc.putAll(update.document());
        } else if (op instanceof SampleMergeUpdate merge) {
            List<Map<String, Object>> samples = (List<Map<String, Object>>)
                    doc.computeIfAbsent(NestedMappingBuilder.SAMPLES_FIELD, k -> new ArrayList<>());
            SampleMerger.MergeAction action = SampleMerger.merge(samples, merge.sampleIdField(), merge.sample());
            log.debug("[MEM] {} sample {}: {}", merge.entityId(), merge.sampleId(), action);
        } else {
            throw new IllegalArgumentException("Unsupported index operation: " + op.getClass().getName());
        }
    }

    @Override
    public void refresh(String index) {
        events.add("refresh:" + index);
    }

    @Override
    public Stream<ScannedDocument> scan(String index) {
        events.add("scan:" + index);
        List<ScannedDocument> snapshot = new ArrayList<>();
        indices.getOrDefault(index, Map.of())
                .forEach((id, doc) -> snapshot.add(new ScannedDocument(id, new LinkedHashMap<>(doc))));
        return snapshot.stream();
    }
}
