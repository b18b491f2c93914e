package com.di.bqindexer.store;

/**
 * A rejected bulk item.
 *
 * @param entityId document id the item targeted
 * @param status   HTTP status of the item
 * @param type     error type reported by the store, e.g. {@code mapper_parsing_exception}
 * @param reason   human-readable reason
 */
public record BulkItemFailure(String entityId, int status, String type, String reason) {

    @Override
    public String toString() {
        return entityId + ": " + reason + " (" + type + ", status " + status + ")";
    }
}
