package com.di.bqindexer.store;

import com.di.bqindexer.document.IndexOperation;

import java.util.Iterator;
import java.util.Map;
import java.util.stream.Stream;

/**
 * The document index the participant documents live in.
 *
 * <p>Passed to the indexer explicitly so that the ordering the indexer relies
 * on (mappings before writes, one table after another) can be checked against
 * an in-memory implementation.
 */
public interface DocumentStore {

    /** Blocks until the store answers requests, failing after the configured attempts. */
    void waitUntilAvailable();

    /** Deletes {@code index} if it exists and creates it empty. */
    void recreateIndex(String index);

    /**
     * Applies a mapping update ({@code {"properties": {...}}}). Conflicts with
     * already-indexed data surface as {@link DocumentStoreException}.
     */
    void putMapping(String index, Map<String, Object> mapping);

    /**
     * Applies every operation of {@code operations}, consuming the iterator
     * incrementally. Returns per-item failures instead of throwing on them.
     */
    BulkResult bulk(String index, Iterator<? extends IndexOperation> operations);

    /** Makes every write so far visible to searches and scans. */
    void refresh(String index);

    /**
     * Streams every document of {@code index}. Memory use is bounded by one page;
     * closing the stream releases server-side scan state.
     */
    Stream<ScannedDocument> scan(String index);
}
