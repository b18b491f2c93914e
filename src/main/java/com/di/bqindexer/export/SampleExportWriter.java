package com.di.bqindexer.export;

import com.di.bqindexer.config.IndexerProperties;
import com.di.bqindexer.mapping.NestedMappingBuilder;
import com.di.bqindexer.store.DocumentStore;
import com.di.bqindexer.store.ScannedDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Writes every indexed sample to {@code gs://<deploy project><suffix>/<blob name>}
 * so that a sample table export does not need to query the index.
 *
 * <p><strong>The written object is not valid JSON on its own.</strong> It is a
 * JSON array whose closing {@code ]} has been removed, so that it can be
 * concatenated server-side (GCS compose) with partial arrays of other entity
 * types and closed by whoever composes them.
 *
 * <p>Only columns whose scoped name has exactly four dot-separated segments
 * ({@code project.dataset.table.column}) are exported, under their column name.
 * The sample id and the internal {@code _has_*} flags have fewer segments and
 * are left out.
 */
@Service
@Slf4j
public class SampleExportWriter {

    static final String PARTICIPANT_ATTRIBUTE = "participant";
    static final String CONTENT_TYPE          = "application/json";

    private static final int SCOPED_FIELD_SEGMENTS = 4;

    private final DocumentStore               store;
    private final BlobStore                   blobStore;
    private final IndexerProperties.Export    settings;
    private final ObjectMapper                mapper;

    public SampleExportWriter(DocumentStore store, BlobStore blobStore,
                              IndexerProperties properties, ObjectMapper mapper) {
        this.store     = store;
        this.blobStore = blobStore;
        this.settings  = properties.getExport();
        this.mapper    = mapper;
    }

    /**
     * Exports the samples of {@code index}. With no sample id column the
     * object is still written, holding an empty array ({@code [}).
     */
    public ExportResult export(String index, String sampleIdColumn, String deployProjectId) {
        List<ExportSample> samples = new ArrayList<>();
        if (sampleIdColumn != null) {
            try (Stream<ScannedDocument> documents = store.scan(index)) {
                documents.forEach(doc -> samples.addAll(toExportSamples(doc, sampleIdColumn)));
            }
        }

        // Not "<project>-export": objects there expire after one day.
        String bucket   = deployProjectId + settings.getBucketSuffix();
        String location = blobStore.write(deployProjectId, bucket, settings.getBlobName(),
                                          payload(samples), CONTENT_TYPE);

        log.info("[EXPORT] wrote {} samples to {}", samples.size(), location);
        return new ExportResult(location, samples.size());
    }

    static List<ExportSample> toExportSamples(ScannedDocument doc, String sampleIdColumn) {
        if (sampleIdColumn == null) {
            return List.of();
        }
        Object rawSamples = doc.source().get(NestedMappingBuilder.SAMPLES_FIELD);
        if (!(rawSamples instanceof List<?> samples)) {
            return List.of();
        }
        List<ExportSample> out = new ArrayList<>();
        for (Object element : samples) {
            if (!(element instanceof Map<?, ?> sample)) continue;

            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put(PARTICIPANT_ATTRIBUTE, doc.id());
            for (Map.Entry<?, ?> field : sample.entrySet()) {
                String[] segments = String.valueOf(field.getKey()).split("\\.");
                if (segments.length != SCOPED_FIELD_SEGMENTS) continue;
                attributes.put(segments[SCOPED_FIELD_SEGMENTS - 1], field.getValue());
            }
            Object sampleId = sample.get(sampleIdColumn);
            out.add(ExportSample.of(sampleId == null ? null : String.valueOf(sampleId), attributes));
        }
        return out;
    }

    /** Indented JSON array without its final {@code ]}. */
    byte[] payload(List<ExportSample> samples) {
        String json;
        try {
            json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(samples).stripTrailing();
        } catch (JsonProcessingException e) {
            throw new ExportException("Failed to serialise " + samples.size() + " samples", e);
        }
        return json.substring(0, json.length() - 1).getBytes(StandardCharsets.UTF_8);
    }
}
