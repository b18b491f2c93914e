package com.di.bqindexer.source;

/**
 * Raised when a source table cannot be described or read.
 */
public class TableSourceException extends RuntimeException {

    public TableSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
