package com.di.bqindexer.document;

import java.util.Map;

/**
 * Find-or-append merge of one sample into a participant's {@code samples} array.
 *
 * @param entityId      participant document id
 * @param sampleIdField unscoped join-key column, e.g. {@code sample_id}
 * @param sample        fields to merge; always contains {@code sampleIdField}
 */
public record SampleMergeUpdate(String entityId, String sampleIdField, Map<String, Object> sample)
        implements IndexOperation {

    public SampleMergeUpdate {
        sample = Map.copyOf(sample);
    }

    public Object sampleId() {
        return sample.get(sampleIdField);
    }
}
