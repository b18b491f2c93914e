package com.di.bqindexer.mapping;

import com.di.bqindexer.source.SchemaField;
import com.di.bqindexer.source.SourceTable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the Elasticsearch mapping fragments a table needs before its rows
 * are indexed.
 *
 * <p>Arrays of objects are flattened by Elasticsearch unless declared
 * {@code nested}, which breaks queries that match several fields of the same
 * element. Every {@code REPEATED RECORD} column is therefore declared nested,
 * and every column with sub-fields gets a {@code properties} entry carrying its
 * children's declarations. Scalar columns need nothing; the default dynamic
 * mapping applies.
 *
 * <p>Mappings cannot be changed to {@code nested} once documents have been
 * indexed under the default object mapping, so these must be applied before the
 * table's first write.
 */
public final class NestedMappingBuilder {

    public static final String SAMPLES_FIELD = "samples";

    private static final String TYPE       = "type";
    private static final String NESTED     = "nested";
    private static final String PROPERTIES = "properties";

    private NestedMappingBuilder() {}

    /**
     * Returns the declarations for {@code fields}; top-level names are
     * qualified with {@code prefix} when it is non-null. Empty when no field
     * needs a declaration.
     */
    public static Map<String, Object> nestedMappings(List<SchemaField> fields, String prefix) {
        Map<String, Object> nested = new LinkedHashMap<>();
        for (SchemaField field : fields) {
            String name = prefix != null ? prefix + "." + field.name() : field.name();
            Map<String, Object> inner = nestedMappings(field.fields(), null);

            Map<String, Object> entry = null;
            if (field.isRepeated() && field.isRecord()) {
                entry = new LinkedHashMap<>();
                entry.put(TYPE, NESTED);
            }
            if (!inner.isEmpty()) {
                if (entry == null) entry = new LinkedHashMap<>();
                entry.put(PROPERTIES, inner);
            }
            if (entry != null) {
                nested.put(name, entry);
            }
        }
        return nested;
    }

    /**
     * Builds the full {@code _mapping} request body for a table, or an empty map
     * when the table needs no mapping update.
     *
     * <p>A table carrying the sample-ID column is a sample table: its rows end up
     * inside the participant's {@code samples} array, so {@code samples} itself is
     * declared nested and the table's own declarations go underneath it.
     */
    public static Map<String, Object> tableMapping(SourceTable table, String sampleIdColumn) {
        Map<String, Object> nested = nestedMappings(table.schema(), table.name());

        if (table.hasColumn(sampleIdColumn)) {
            Map<String, Object> samples = new LinkedHashMap<>();
            samples.put(TYPE, NESTED);
            if (!nested.isEmpty()) {
                samples.put(PROPERTIES, nested);
            }
            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put(SAMPLES_FIELD, samples);
            return Map.of(PROPERTIES, properties);
        }
        if (!nested.isEmpty()) {
            return Map.of(PROPERTIES, nested);
        }
        return Map.of();
    }
}
