package com.di.bqindexer.source;

import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.LegacySQLTypeName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for BigQueryRowConverter.
 */
@DisplayName("BigQueryRowConverter Tests")
class BigQueryRowConverterTest {

    private static FieldValue primitive(String value) {
        return FieldValue.of(FieldValue.Attribute.PRIMITIVE, value);
    }

    @Test
    @DisplayName("Should convert schema fields including modes, descriptions and sub-fields")
    void testToSchemaFields() {
        FieldList fields = FieldList.of(
                Field.newBuilder("pid", LegacySQLTypeName.STRING).setMode(Field.Mode.REQUIRED).build(),
                Field.newBuilder("visit", LegacySQLTypeName.RECORD, Field.of("date", LegacySQLTypeName.DATE))
                        .setMode(Field.Mode.REPEATED)
                        .setDescription("Clinic visits")
                        .build());

        List<SchemaField> schema = BigQueryRowConverter.toSchemaFields(fields);

        assertEquals(2, schema.size());
        assertEquals("REQUIRED", schema.get(0).mode());
        SchemaField visit = schema.get(1);
        assertTrue(visit.isRecord());
        assertTrue(visit.isRepeated());
        assertEquals("Clinic visits", visit.description());
        assertEquals("date", visit.fields().get(0).name());
    }

    @Test
    @DisplayName("Should map scalar types to JSON-friendly values")
    void testConvert_Scalars() {
        assertEquals(42L, BigQueryRowConverter.convert(primitive("42"), SchemaField.scalar("n", "INTEGER")));
        assertEquals(1.5d, BigQueryRowConverter.convert(primitive("1.5"), SchemaField.scalar("f", "FLOAT")));
        assertEquals(new BigDecimal("3.14"), BigQueryRowConverter.convert(primitive("3.14"), SchemaField.scalar("d", "NUMERIC")));
        assertEquals(Boolean.TRUE, BigQueryRowConverter.convert(primitive("true"), SchemaField.scalar("b", "BOOLEAN")));
        assertEquals("2020-01-01", BigQueryRowConverter.convert(primitive("2020-01-01"), SchemaField.scalar("d", "DATE")));
        assertEquals("1970-01-01T00:00:01Z",
                BigQueryRowConverter.convert(primitive("1.0"), SchemaField.scalar("ts", "TIMESTAMP")));
    }

    @Test
    @DisplayName("Should map SQL NULL to null")
    void testConvert_Null() {
        assertNull(BigQueryRowConverter.convert(primitive(null), SchemaField.scalar("n", "INTEGER")));
    }

    @Test
    @DisplayName("Should convert rows with repeated records")
    void testToRow_RepeatedRecord() {
        SchemaField visit = SchemaField.record("visit", SchemaField.REPEATED, List.of(SchemaField.scalar("n", "INTEGER")));
        List<SchemaField> schema = List.of(SchemaField.scalar("pid", "STRING"), visit);

        FieldValue visitRecord = FieldValue.of(FieldValue.Attribute.RECORD, FieldValueList.of(List.of(primitive("7"))));
        FieldValue visits = FieldValue.of(FieldValue.Attribute.REPEATED, FieldValueList.of(List.of(visitRecord)));
        FieldValueList values = FieldValueList.of(List.of(primitive("P1"), visits));

        Map<String, Object> row = BigQueryRowConverter.toRow(values, schema);

        assertEquals("P1", row.get("pid"));
        assertEquals(List.of(Map.of("n", 7L)), row.get("visit"));
    }
}
