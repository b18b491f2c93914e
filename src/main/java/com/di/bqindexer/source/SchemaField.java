package com.di.bqindexer.source;

import java.util.List;

/**
 * One node of a source table schema.
 *
 * @param name        column name (short, not qualified)
 * @param type        BigQuery type tag, e.g. {@code STRING}, {@code INTEGER}, {@code RECORD}
 * @param mode        {@code NULLABLE}, {@code REQUIRED} or {@code REPEATED}
 * @param description optional column description; may be null
 * @param fields      child fields of a {@code RECORD}; empty for scalars
 */
public record SchemaField(String name, String type, String mode, String description, List<SchemaField> fields) {

    public static final String RECORD   = "RECORD";
    public static final String REPEATED = "REPEATED";
    public static final String NULLABLE = "NULLABLE";

    public SchemaField {
        fields = fields == null ? List.of() : List.copyOf(fields);
        mode   = mode == null ? NULLABLE : mode;
    }

    public static SchemaField scalar(String name, String type) {
        return new SchemaField(name, type, NULLABLE, null, List.of());
    }

    public static SchemaField record(String name, String mode, List<SchemaField> fields) {
        return new SchemaField(name, RECORD, mode, null, fields);
    }

    public boolean isRecord() {
        return RECORD.equals(type);
    }

    public boolean isRepeated() {
        return REPEATED.equals(mode);
    }

    public boolean hasChildren() {
        return !fields.isEmpty();
    }
}
