package com.di.bqindexer.store;

import com.di.bqindexer.config.IndexerProperties;
import com.di.bqindexer.document.IndexOperation;
import com.di.bqindexer.document.PartialDocumentUpdate;
import com.di.bqindexer.document.SampleMergeScriptBuilder;
import com.di.bqindexer.document.SampleMergeUpdate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpEntity;
import org.apache.http.util.EntityUtils;
import org.elasticsearch.client.Request;
import org.elasticsearch.client.Response;
import org.elasticsearch.client.ResponseException;
import org.elasticsearch.client.RestClient;
import org.springframework.stereotype.Component;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link DocumentStore} talking to Elasticsearch through the low-level REST client.
 *
 * <p>Bulk writes are {@code update} actions: partial documents use
 * {@code doc_as_upsert}, sample merges run {@link SampleMergeScriptBuilder#MERGE_SAMPLE_SCRIPT}
 * as a scripted upsert so the first sample of a participant also creates the
 * participant. Operations are pulled from the caller's iterator one batch at a
 * time.
 */
@Component
@Slf4j
public class ElasticsearchDocumentStore implements DocumentStore {

    static final String SCROLL_ENDPOINT = "/_search/scroll";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final RestClient                       client;
    private final IndexerProperties.Elasticsearch  settings;
    private final ObjectMapper                     mapper;

    public ElasticsearchDocumentStore(RestClient client, IndexerProperties properties, ObjectMapper mapper) {
        this.client   = client;
        this.settings = properties.getElasticsearch();
        this.mapper   = mapper;
    }

    /* ------------------------------------------------------------------ */
    /* Index lifecycle                                                      */
    /* ------------------------------------------------------------------ */

    @Override
    public void waitUntilAvailable() {
        int attempts = settings.getConnectAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                client.performRequest(new Request("GET", "/"));
                log.info("[ES] cluster at {} is available", settings.getUrl());
                return;
            } catch (IOException e) {
                if (attempt >= attempts) {
                    throw new DocumentStoreException(
                            "Elasticsearch at " + settings.getUrl() + " not available after " + attempts + " attempts", e);
                }
                log.info("[ES] waiting for {} (attempt {}/{}): {}", settings.getUrl(), attempt, attempts, e.getMessage());
                sleep(settings.getConnectRetryDelay().toMillis());
            }
        }
    }

    @Override
    public void recreateIndex(String index) {
        Response exists = performRaw(new Request("HEAD", "/" + index));
        if (exists.getStatusLine().getStatusCode() == 200) {
            log.info("[ES] deleting existing index {}", index);
            perform(new Request("DELETE", "/" + index));
        }
        log.info("[ES] creating index {}", index);
        perform(new Request("PUT", "/" + index));
    }

    @Override
    public void putMapping(String index, Map<String, Object> mapping) {
        Request request = new Request("PUT", "/" + index + "/_mapping");
        request.setJsonEntity(toJson(mapping));
        perform(request);
    }

    @Override
    public void refresh(String index) {
        perform(new Request("POST", "/" + index + "/_refresh"));
    }

    /* ------------------------------------------------------------------ */
    /* Bulk                                                                 */
    /* ------------------------------------------------------------------ */

    @Override
    public BulkResult bulk(String index, Iterator<? extends IndexOperation> operations) {
        BulkResult result = new BulkResult();
        List<IndexOperation> batch = new ArrayList<>(settings.getBulkBatchSize());
        while (operations.hasNext()) {
            batch.add(operations.next());
            if (batch.size() >= settings.getBulkBatchSize()) {
                flush(index, batch, result);
            }
        }
        if (!batch.isEmpty()) {
            flush(index, batch, result);
        }
        log.info("[BULK] {}: {} operations in {} requests, {} failed",
                 index, result.getSubmitted(), result.getBatches(), result.getFailures().size());
        return result;
    }

    private void flush(String index, List<IndexOperation> batch, BulkResult result) {
        Request request = new Request("POST", "/" + index + "/_bulk");
        request.setJsonEntity(bulkBody(batch));
        JsonNode response = perform(request);
        List<BulkItemFailure> failures = parseBulkFailures(response);
        for (BulkItemFailure failure : failures) {
            log.error("[BULK] {} rejected {}", index, failure);
        }
        result.recordBatch(batch.size(), failures);
        batch.clear();
    }

    /** Newline-delimited {@code _bulk} body; every line, including the last, ends in {@code \n}. */
    String bulkBody(List<? extends IndexOperation> batch) {
        StringBuilder body = new StringBuilder();
        for (IndexOperation op : batch) {
            body.append(toJson(Map.of("update", Map.of("_id", op.entityId())))).append('\n');
            body.append(toJson(actionSource(op))).append('\n');
        }
        return body.toString();
    }

    static Map<String, Object> actionSource(IndexOperation op) {
        Map<String, Object> source = new LinkedHashMap<>();
        if (op instanceof PartialDocumentUpdate update) {
            source.put("doc", update.document());
            source.put("doc_as_upsert", true);
        } else if (op instanceof SampleMergeUpdate merge) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("key", merge.sampleIdField());
            params.put("sample", merge.sample());

            Map<String, Object> script = new LinkedHashMap<>();
            script.put("source", SampleMergeScriptBuilder.MERGE_SAMPLE_SCRIPT);
            script.put("lang", "painless");
            script.put("params", params);

            source.put("script", script);
            source.put("scripted_upsert", true);
            source.put("upsert", Map.of());
        } else {
            throw new IllegalArgumentException("Unsupported index operation: " + op.getClass().getName());
        }
        return source;
    }

    /**
     * Collects the failed items of a {@code _bulk} response. A response without
     * {@code items} is reported as a single failure rather than as success.
     */
    static List<BulkItemFailure> parseBulkFailures(JsonNode response) {
        List<BulkItemFailure> failures = new ArrayList<>();
        JsonNode items = response.path("items");
        if (items.isMissingNode() || items.size() == 0) {
            failures.add(new BulkItemFailure("<unknown>", -1, "missing_items",
                    "'items' missing from bulk response: " + response));
            return failures;
        }
        if (!response.path("errors").asBoolean(false)) {
            return failures;
        }
        for (JsonNode item : items) {
            // single-key object: {"update": {...}}
            JsonNode action = item.elements().hasNext() ? item.elements().next() : item;
            JsonNode error = action.path("error");
            if (error.isMissingNode() || error.isNull()) {
                continue;
            }
            String reason = error.isTextual() ? error.asText() : error.path("reason").asText();
            JsonNode causedBy = error.path("caused_by");
            if (!causedBy.isMissingNode()) {
                reason = reason + "; caused by: " + causedBy.path("reason").asText();
            }
            failures.add(new BulkItemFailure(
                    action.path("_id").asText(),
                    action.path("status").asInt(-1),
                    error.path("type").asText(),
                    reason));
        }
        return failures;
    }

    /* ------------------------------------------------------------------ */
    /* Scan                                                                 */
    /* ------------------------------------------------------------------ */

    @Override
    public Stream<ScannedDocument> scan(String index) {
        ScrollIterator scroll = new ScrollIterator(index);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(scroll, Spliterator.ORDERED), false)
                .onClose(scroll::close);
    }

    /**
     * Walks the scroll API page by page. The scroll context is cleared on close.
     */
    private final class ScrollIterator implements Iterator<ScannedDocument>, Closeable {

        private final String              index;
        private String                    scrollId;
        private Iterator<JsonNode>        page;
        private boolean                   exhausted;

        ScrollIterator(String index) {
            this.index = index;
        }

        @Override
        public boolean hasNext() {
            if (exhausted) return false;
            if (page == null) {
                Map<String, Object> query = new LinkedHashMap<>();
                query.put("size", settings.getScrollSize());
                query.put("query", Map.of("match_all", Map.of()));
                Request request = new Request("POST", "/" + index + "/_search");
                request.addParameter("scroll", settings.getScrollKeepalive());
                request.setJsonEntity(toJson(query));
                readPage(perform(request));
            } else if (!page.hasNext()) {
                Request request = new Request("POST", SCROLL_ENDPOINT);
                request.setJsonEntity(toJson(Map.of(
                        "scroll", settings.getScrollKeepalive(),
                        "scroll_id", scrollId)));
                readPage(perform(request));
            }
            if (!page.hasNext()) {
                exhausted = true;
            }
            return !exhausted;
        }

        @Override
        public ScannedDocument next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            JsonNode hit = page.next();
            Map<String, Object> source = mapper.convertValue(hit.path("_source"), MAP_TYPE);
            return new ScannedDocument(hit.path("_id").asText(), source);
        }

        private void readPage(JsonNode response) {
            scrollId = response.path("_scroll_id").asText(null);
            List<JsonNode> hits = new ArrayList<>();
            response.path("hits").path("hits").forEach(hits::add);
            page = hits.iterator();
        }

        @Override
        public void close() {
            if (scrollId == null) return;
            Request request = new Request("DELETE", SCROLL_ENDPOINT);
            request.setJsonEntity(toJson(Map.of("scroll_id", List.of(scrollId))));
            try {
                performRaw(request);
            } catch (DocumentStoreException e) {
                log.warn("[ES] failed to clear scroll for {}: {}", index, e.getMessage());
            }
            scrollId = null;
        }
    }

    /* ------------------------------------------------------------------ */
    /* Transport                                                            */
    /* ------------------------------------------------------------------ */

    private JsonNode perform(Request request) {
        Response response = performRaw(request);
        int status = response.getStatusLine().getStatusCode();
        if (status >= 300) {
            throw new DocumentStoreException(describe(request) + " returned status " + status, status, null);
        }
        HttpEntity entity = response.getEntity();
        if (entity == null) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(entity.getContent());
        } catch (IOException e) {
            throw new DocumentStoreException("Unreadable response from " + describe(request), status, e);
        }
    }

    private Response performRaw(Request request) {
        try {
            return client.performRequest(request);
        } catch (ResponseException e) {
            int status = e.getResponse().getStatusLine().getStatusCode();
            throw new DocumentStoreException(
                    describe(request) + " failed with status " + status + ": " + bodyOf(e.getResponse()), status, e);
        } catch (IOException e) {
            throw new DocumentStoreException(describe(request) + " failed: " + e.getMessage(), e);
        }
    }

    private static String bodyOf(Response response) {
        try {
            return response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity());
        } catch (IOException e) {
            return "<unreadable body: " + e.getMessage() + ">";
        }
    }

    private static String describe(Request request) {
        return request.getMethod() + " " + request.getEndpoint();
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON-serialisable", e);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DocumentStoreException("Interrupted while waiting for Elasticsearch", e);
        }
    }
}
