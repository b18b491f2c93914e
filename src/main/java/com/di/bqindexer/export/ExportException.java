package com.di.bqindexer.export;

/**
 * The sample export could not be serialised or uploaded.
 */
public class ExportException extends RuntimeException {

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
