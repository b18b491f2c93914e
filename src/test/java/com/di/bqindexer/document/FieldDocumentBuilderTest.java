package com.di.bqindexer.document;

import com.di.bqindexer.source.SchemaField;
import com.di.bqindexer.source.SourceTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for FieldDocumentBuilder.
 */
@DisplayName("FieldDocumentBuilder Tests")
class FieldDocumentBuilderTest {

    @Test
    @DisplayName("Should write one document per scalar column with optional description")
    void testFieldDocuments_Scalars() {
        SourceTable table = new SourceTable("proj.ds.weight", List.of(
                SchemaField.scalar("pid", "STRING"),
                new SchemaField("weight", "FLOAT", SchemaField.NULLABLE, "Weight in kg", List.of())));

        List<PartialDocumentUpdate> docs = FieldDocumentBuilder.fieldDocuments(table, "sid");

        assertEquals(2, docs.size());
        assertEquals("proj.ds.weight.pid", docs.get(0).entityId());
        assertEquals(Map.of("name", "pid"), docs.get(0).document());
        assertEquals("proj.ds.weight.weight", docs.get(1).entityId());
        assertEquals(Map.of("name", "weight", "description", "Weight in kg"), docs.get(1).document());
    }

    @Test
    @DisplayName("Should flatten records into their leaves with dotted names")
    void testFieldDocuments_Records() {
        SourceTable table = new SourceTable("proj.ds.t", List.of(
                SchemaField.record("address", SchemaField.NULLABLE, List.of(
                        SchemaField.scalar("city", "STRING"),
                        SchemaField.record("geo", SchemaField.NULLABLE, List.of(SchemaField.scalar("lat", "FLOAT")))))));

        List<PartialDocumentUpdate> docs = FieldDocumentBuilder.fieldDocuments(table, null);

        assertEquals(2, docs.size());
        assertEquals("proj.ds.t.address.city", docs.get(0).entityId());
        assertEquals("address.city", docs.get(0).document().get("name"));
        assertEquals("proj.ds.t.address.geo.lat", docs.get(1).entityId());
        assertEquals("address.geo.lat", docs.get(1).document().get("name"));
    }

    @Test
    @DisplayName("Should prefix ids with samples for sample tables")
    void testFieldDocuments_SampleTable() {
        SourceTable table = new SourceTable("proj.ds.center", List.of(
                SchemaField.scalar("sid", "STRING"),
                SchemaField.scalar("center", "STRING")));

        List<PartialDocumentUpdate> docs = FieldDocumentBuilder.fieldDocuments(table, "sid");

        assertEquals("samples.proj.ds.center.sid", docs.get(0).entityId());
        assertEquals("samples.proj.ds.center.center", docs.get(1).entityId());
        assertEquals("center", docs.get(1).document().get("name"));
    }
}
