package com.di.bqindexer.export;

import java.util.Map;

/**
 * One sample entity of the export file.
 *
 * @param entityType always {@code sample}
 * @param name       sample id
 * @param attributes {@code participant} plus one entry per source column
 */
public record ExportSample(String entityType, String name, Map<String, Object> attributes) {

    public static final String ENTITY_TYPE = "sample";

    public static ExportSample of(String sampleId, Map<String, Object> attributes) {
        return new ExportSample(ENTITY_TYPE, sampleId, attributes);
    }
}
