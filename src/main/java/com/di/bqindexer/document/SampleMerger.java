package com.di.bqindexer.document;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Find-by-key-then-merge over a participant's {@code samples} array.
 *
 * <p>This is the reference form of {@link SampleMergeScriptBuilder#MERGE_SAMPLE_SCRIPT}.
 * The script runs inside Elasticsearch and is not executed by the unit tests, so
 * the two are kept in sync by hand: a change to either must be made to both.
 * Both must behave the same:
 * <ol>
 *   <li>The first element whose join key equals the incoming sample's key is the
 *       merge target.</li>
 *   <li>Any further element with the same key is folded into the target (its
 *       fields overwrite the target's) and removed, so an array that already
 *       holds duplicates ends with one element per key.</li>
 *   <li>The incoming fields are then written over the target; fields the
 *       incoming sample does not mention survive.</li>
 *   <li>With no match the sample is appended.</li>
 * </ol>
 */
public final class SampleMerger {

    /** Which branch of the merge ran. */
    public enum MergeAction {
        /** An element with the same sample id existed and was updated in place. */
        UPDATE_EXISTING,
        /** No element had the sample id; a new element was appended. */
        APPEND_NEW
    }

    private SampleMerger() {}

    public static MergeAction merge(List<Map<String, Object>> samples, String keyField, Map<String, Object> sample) {
        Object key = sample.get(keyField);
        Map<String, Object> target = null;

        Iterator<Map<String, Object>> it = samples.iterator();
        while (it.hasNext()) {
            Map<String, Object> existing = it.next();
            if (!Objects.equals(key, existing.get(keyField))) {
                continue;
            }
            if (target == null) {
                target = existing;
            } else {
                target.putAll(existing);
                it.remove();
            }
        }

        if (target == null) {
            samples.add(new LinkedHashMap<>(sample));
            return MergeAction.APPEND_NEW;
        }
        target.putAll(sample);
        return MergeAction.UPDATE_EXISTING;
    }
}
