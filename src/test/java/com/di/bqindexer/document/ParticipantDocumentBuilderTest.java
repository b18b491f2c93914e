package com.di.bqindexer.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ParticipantDocumentBuilder.
 */
@DisplayName("ParticipantDocumentBuilder Tests")
class ParticipantDocumentBuilderTest {

    private final ParticipantDocumentBuilder builder = new ParticipantDocumentBuilder("proj.ds.weight", "pid");

    private static Map<String, Object> row(Object... kv) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            row.put((String) kv[i], kv[i + 1]);
        }
        return row;
    }

    @Test
    @DisplayName("Should scope every column except the participant id by table name")
    void testBuild_ScopesColumns() {
        PartialDocumentUpdate update = builder.build(row("pid", "P1", "weight", 70.5)).orElseThrow();
        assertEquals("P1", update.entityId());
        assertEquals(Map.of("proj.ds.weight.weight", 70.5), update.document());
    }

    @Test
    @DisplayName("Should drop null values instead of sending them")
    void testBuild_DropsNulls() {
        PartialDocumentUpdate update = builder.build(row("pid", "P1", "weight", null, "unit", "kg")).orElseThrow();
        assertEquals(Map.of("proj.ds.weight.unit", "kg"), update.document());
        assertFalse(update.document().containsKey("proj.ds.weight.weight"));
    }

    @Test
    @DisplayName("Should keep empty strings and zero as present values")
    void testBuild_KeepsFalsyNonNullValues() {
        PartialDocumentUpdate update = builder.build(row("pid", "P1", "note", "", "weight", 0L)).orElseThrow();
        assertEquals("", update.document().get("proj.ds.weight.note"));
        assertEquals(0L, update.document().get("proj.ds.weight.weight"));
    }

    @Test
    @DisplayName("Should render numeric participant ids as strings")
    void testBuild_NumericParticipantId() {
        assertEquals("42", builder.build(row("pid", 42L, "weight", 1.0)).orElseThrow().entityId());
    }

    @Test
    @DisplayName("Should skip rows without a participant id")
    void testBuild_NullParticipantId() {
        Optional<PartialDocumentUpdate> update = builder.build(row("pid", null, "weight", 70.5));
        assertTrue(update.isEmpty());
    }
}
