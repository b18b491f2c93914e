package com.di.bqindexer.indexer;

/**
 * Thrown when a run is requested while another one has not finished.
 */
public class IndexRunInProgressException extends RuntimeException {

    public IndexRunInProgressException(String runId) {
        super("Indexer run " + runId + " is still in progress");
    }
}
