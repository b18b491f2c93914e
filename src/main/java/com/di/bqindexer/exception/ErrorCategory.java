package com.di.bqindexer.exception;

import com.di.bqindexer.export.ExportException;
import com.di.bqindexer.indexer.BulkIndexingException;
import com.di.bqindexer.indexer.IndexRunInProgressException;
import com.di.bqindexer.indexer.IndexerConfigurationException;
import com.di.bqindexer.source.TableSourceException;
import com.di.bqindexer.store.DocumentStoreException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Error categories for run failures, used in log lines and the HTTP error body.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) and a matcher in
 * {@link #MATCHERS}.
 */
public enum ErrorCategory {

    CONFIGURATION_ERROR("Configuration error", "Dataset configuration missing, invalid or not matching the tables"),
    RUN_CONFLICT("Run conflict", "Another indexer run is still in progress"),
    INDEXING_ERROR("Indexing error", "Bulk operations were rejected by the document store"),
    DOCUMENT_STORE_ERROR("Document store error", "Elasticsearch request failed or returned an error status"),
    SOURCE_ERROR("Source error", "BigQuery schema lookup or row read failed"),
    EXPORT_ERROR("Export error", "Writing the sample export to GCS failed"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof IndexerConfigurationException, CONFIGURATION_ERROR);
        MATCHERS.put(t -> t instanceof IndexRunInProgressException, RUN_CONFLICT);
        MATCHERS.put(t -> t instanceof BulkIndexingException, INDEXING_ERROR);
        MATCHERS.put(t -> t instanceof DocumentStoreException, DOCUMENT_STORE_ERROR);
        MATCHERS.put(t -> t instanceof TableSourceException, SOURCE_ERROR);
        MATCHERS.put(t -> t instanceof ExportException, EXPORT_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.SocketTimeoutException
                || t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.io.IOException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException;
    }

    @Override
    public String toString() {
        return name();
    }
}
