package com.di.bqindexer.document;

import java.util.Map;

/**
 * Top-level partial update: every key in {@code document} overwrites the same
 * key of the stored document; keys not mentioned are left untouched.
 */
public record PartialDocumentUpdate(String entityId, Map<String, Object> document) implements IndexOperation {

    public PartialDocumentUpdate {
        document = Map.copyOf(document);
    }
}
