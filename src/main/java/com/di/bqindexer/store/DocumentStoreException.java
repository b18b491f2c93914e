package com.di.bqindexer.store;

/**
 * A request to the document store failed as a whole: transport error or a
 * non-success status (including mapping conflicts). Not retried.
 */
public class DocumentStoreException extends RuntimeException {

    private final int status;

    public DocumentStoreException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public DocumentStoreException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    /** HTTP status of the failed request, or -1 when no response was received. */
    public int getStatus() {
        return status;
    }
}
