package com.di.bqindexer.store;

import java.util.Map;

/** One document returned by {@link DocumentStore#scan(String)}. */
public record ScannedDocument(String id, Map<String, Object> source) {
}
