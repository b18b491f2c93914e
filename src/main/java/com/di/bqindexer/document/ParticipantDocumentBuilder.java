package com.di.bqindexer.document;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns rows of a participant table into partial-update documents.
 *
 * <p>Each column is renamed to {@code <table>.<column>}. Different tables can
 * therefore be applied to the same participant in any order without touching
 * each other's fields, and re-indexing a table rewrites exactly the fields it
 * wrote before.
 */
@Slf4j
public class ParticipantDocumentBuilder {

    private final String tableName;
    private final String participantIdColumn;

    public ParticipantDocumentBuilder(String tableName, String participantIdColumn) {
        this.tableName           = tableName;
        this.participantIdColumn = participantIdColumn;
    }

    /**
     * Builds the update for one row; empty when the row has no participant id.
     */
    public Optional<PartialDocumentUpdate> build(Map<String, Object> row) {
        Map<String, Object> values = RowValues.dropNulls(row);
        String participantId = RowValues.idOf(values.remove(participantIdColumn));
        if (participantId == null) {
            log.warn("[INDEX] {}: skipping row without {}", tableName, participantIdColumn);
            return Optional.empty();
        }

        Map<String, Object> document = new LinkedHashMap<>();
        values.forEach((column, value) -> document.put(tableName + "." + column, value));
        return Optional.of(new PartialDocumentUpdate(participantId, document));
    }
}
