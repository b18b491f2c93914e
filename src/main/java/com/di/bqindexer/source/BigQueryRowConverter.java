package com.di.bqindexer.source;

import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts BigQuery schemas and result rows into the indexer's own model.
 *
 * <p>Values are mapped to JSON-friendly Java types: INTEGER → Long,
 * FLOAT → Double, NUMERIC → BigDecimal, BOOLEAN → Boolean, TIMESTAMP → ISO-8601
 * string, RECORD → nested map, REPEATED → list. Everything else is kept as the
 * string BigQuery returns. SQL NULL becomes {@code null}.
 */
public final class BigQueryRowConverter {

    private BigQueryRowConverter() {}

    public static List<SchemaField> toSchemaFields(FieldList fields) {
        List<SchemaField> out = new ArrayList<>();
        if (fields == null) return out;
        for (Field field : fields) {
            out.add(new SchemaField(
                    field.getName(),
                    field.getType().name(),
                    field.getMode() == null ? SchemaField.NULLABLE : field.getMode().name(),
                    field.getDescription(),
                    toSchemaFields(field.getSubFields())));
        }
        return out;
    }

    /**
     * Converts one result row. Columns are matched to the schema by position,
     * the order BigQuery returns them in.
     */
    public static Map<String, Object> toRow(FieldValueList values, List<SchemaField> schema) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < schema.size(); i++) {
            SchemaField field = schema.get(i);
            row.put(field.name(), convert(values.get(i), field));
        }
        return row;
    }

    static Object convert(FieldValue value, SchemaField field) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (field.isRepeated()) {
            List<Object> items = new ArrayList<>();
            for (FieldValue item : value.getRepeatedValue()) {
                items.add(convertSingle(item, field));
            }
            return items;
        }
        return convertSingle(value, field);
    }

    private static Object convertSingle(FieldValue value, SchemaField field) {
        if (value == null || value.isNull()) {
            return null;
        }
        return switch (field.type()) {
            case "RECORD", "STRUCT"       -> toRow(value.getRecordValue(), field.fields());
            case "INTEGER", "INT64"       -> value.getLongValue();
            case "FLOAT", "FLOAT64"       -> value.getDoubleValue();
            case "NUMERIC", "BIGNUMERIC"  -> value.getNumericValue();
            case "BOOLEAN", "BOOL"        -> value.getBooleanValue();
            case "TIMESTAMP"              -> Instant.EPOCH.plus(value.getTimestampValue(), ChronoUnit.MICROS).toString();
            default                       -> value.getStringValue();
        };
    }
}
