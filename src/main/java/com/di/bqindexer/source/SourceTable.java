package com.di.bqindexer.source;

import java.util.List;

/**
 * A resolved source table: its standard-SQL name ({@code project.dataset.table})
 * and its ordered top-level schema.
 */
public record SourceTable(String name, List<SchemaField> schema) {

    public SourceTable {
        schema = schema == null ? List.of() : List.copyOf(schema);
    }

    public boolean hasColumn(String column) {
        if (column == null) return false;
        for (SchemaField field : schema) {
            if (field.name().equals(column)) return true;
        }
        return false;
    }
}
