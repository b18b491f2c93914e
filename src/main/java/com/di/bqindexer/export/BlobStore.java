package com.di.bqindexer.export;

/**
 * Object storage the export is written to.
 */
public interface BlobStore {

    /**
     * Writes {@code content} to {@code container/name}, replacing any existing
     * object. A missing container is created in {@code project}.
     *
     * @return the object's location, e.g. {@code gs://bucket/name}
     */
    String write(String project, String container, String name, byte[] content, String contentType);
}
