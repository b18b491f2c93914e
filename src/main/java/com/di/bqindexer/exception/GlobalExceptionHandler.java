package com.di.bqindexer.exception;

import com.di.bqindexer.config.MdcRequestFilter;
import com.di.bqindexer.export.ExportException;
import com.di.bqindexer.indexer.BulkIndexingException;
import com.di.bqindexer.indexer.IndexRunInProgressException;
import com.di.bqindexer.indexer.IndexerConfigurationException;
import com.di.bqindexer.source.TableSourceException;
import com.di.bqindexer.store.DocumentStoreException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps run failures to HTTP responses with a structured {@link ErrorResponse} body.
 *
 * <pre>
 *  IndexerConfigurationException                  → 400
 *  IndexRunInProgressException                    → 409
 *  BulkIndexing / DocumentStore / TableSource /
 *  Export exceptions                              → 502
 *  anything else                                  → 500
 * </pre>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IndexerConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfigurationException(IndexerConfigurationException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(IndexRunInProgressException.class)
    public ResponseEntity<ErrorResponse> handleRunInProgress(IndexRunInProgressException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(BulkIndexingException.class)
    public ResponseEntity<ErrorResponse> handleBulkIndexingException(BulkIndexingException e) {
        ResponseEntity<ErrorResponse> response = respond(HttpStatus.BAD_GATEWAY, e);
        response.getBody().addDetail("table", e.getTable());
        response.getBody().addDetail("failedOperations", e.getFailures().size());
        return response;
    }

    @ExceptionHandler(DocumentStoreException.class)
    public ResponseEntity<ErrorResponse> handleDocumentStoreException(DocumentStoreException e) {
        ResponseEntity<ErrorResponse> response = respond(HttpStatus.BAD_GATEWAY, e);
        response.getBody().addDetail("storeStatus", e.getStatus());
        return response;
    }

    @ExceptionHandler({TableSourceException.class, ExportException.class})
    public ResponseEntity<ErrorResponse> handleUpstreamException(RuntimeException e) {
        return respond(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, Throwable exception) {
        ErrorCategory category = ErrorCategory.categorize(exception);
        if (status.is5xxServerError()) {
            log.error("GlobalExceptionHandler caught exception: {} [{}]",
                    exception.getClass().getSimpleName(), category.getName(), exception);
        } else {
            log.warn("GlobalExceptionHandler: {} [{}]: {}",
                    exception.getClass().getSimpleName(), category.getName(), exception.getMessage());
        }
        return ResponseEntity.status(status).body(buildErrorResponse(category, exception, status));
    }

    static ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setPath(MDC.get(MdcRequestFilter.REQUEST_PATH) != null
                ? MDC.get(MdcRequestFilter.REQUEST_PATH) : "/unknown");
        if (MDC.get(MdcRequestFilter.REQUEST_ID) != null) {
            response.addDetail("requestId", MDC.get(MdcRequestFilter.REQUEST_ID));
        }
        response.addDetail("exceptionType", exception.getClass().getName());

        Throwable rootCause = rootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private static Throwable rootCause(Throwable exception) {
        Throwable current = exception;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Structured error response for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int    status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            details.put(key, value);
        }
    }
}
