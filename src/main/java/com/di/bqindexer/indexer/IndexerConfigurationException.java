package com.di.bqindexer.indexer;

/**
 * The dataset configuration does not match the data: a required key is missing,
 * or a table lacks the participant-id column. Fatal for the whole run; retrying
 * without changing the configuration cannot succeed.
 */
public class IndexerConfigurationException extends RuntimeException {

    public IndexerConfigurationException(String message) {
        super(message);
    }

    public IndexerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
