package com.di.bqindexer.document;

import com.di.bqindexer.mapping.NestedMappingBuilder;
import com.di.bqindexer.source.SchemaField;
import com.di.bqindexer.source.SourceTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the lookup documents of the {@code <index>_fields} index: one per leaf
 * column, giving its display name and description.
 *
 * <p>RECORD columns contribute only their leaves, named by their dotted path
 * ({@code address.city}). Document ids are the column's path in the main index,
 * {@code <table>.<path>}, prefixed with {@code samples.} for sample tables so a
 * sample column never shares an id with a participant column of the same name.
 */
public final class FieldDocumentBuilder {

    private FieldDocumentBuilder() {}

    public static List<PartialDocumentUpdate> fieldDocuments(SourceTable table, String sampleIdColumn) {
        String idPrefix = table.hasColumn(sampleIdColumn)
                ? NestedMappingBuilder.SAMPLES_FIELD + "." + table.name()
                : table.name();
        List<PartialDocumentUpdate> out = new ArrayList<>();
        collect(idPrefix, null, table.schema(), out);
        return out;
    }

    private static void collect(String idPrefix, String namePrefix, List<SchemaField> fields,
                                List<PartialDocumentUpdate> out) {
        for (SchemaField field : fields) {
            String fieldId   = idPrefix + "." + field.name();
            String fieldName = namePrefix != null ? namePrefix + "." + field.name() : field.name();

            if (field.isRecord()) {
                collect(fieldId, fieldName, field.fields(), out);
                continue;
            }
            Map<String, Object> doc = new LinkedHashMap<>();
            doc.put("name", fieldName);
            if (field.description() != null && !field.description().isBlank()) {
                doc.put("description", field.description());
            }
            out.add(new PartialDocumentUpdate(fieldId, doc));
        }
    }
}
