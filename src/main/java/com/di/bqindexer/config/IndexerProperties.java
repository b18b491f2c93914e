package com.di.bqindexer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Single binding for all indexer settings.
 *
 * <pre>
 * bqindexer:
 *   dataset-config-dir: ${DATASET_CONFIG_DIR:}
 *   billing-project-id: ${BILLING_PROJECT_ID:}
 *   run-on-startup: true
 *   refresh-settle-delay: 0s
 *   elasticsearch:
 *     url: ${ELASTICSEARCH_URL:http://localhost:9200}
 *     bulk-batch-size: 500
 *     scroll-keepalive: 5m
 *     scroll-size: 500
 *   export:
 *     bucket-suffix: -export-samples
 *     blob-name: samples
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "bqindexer")
public class IndexerProperties {

    /** Directory holding dataset.json, bigquery.json and the optional deploy.json. */
    private String datasetConfigDir;

    /**
     * GCP project billed for BigQuery reads; needs bigquery.jobs.create.
     * Required: the BigQuery client is not created without it.
     */
    private String billingProjectId;

    /**
     * When true the whole job runs once at startup and the process exits with
     * its outcome. When false the service waits for POST /api/indexer/runs.
     */
    private boolean runOnStartup = true;

    /**
     * Extra wait after the explicit index refresh and before the export scan.
     * Zero unless the target cluster is known to lag behind its refresh call.
     */
    private Duration refreshSettleDelay = Duration.ZERO;

    @Valid
    private Elasticsearch elasticsearch = new Elasticsearch();

    @Valid
    private Export export = new Export();

    @Data
    public static class Elasticsearch {

        /** Cluster url, must start with http:// or https://. */
        @NotBlank
        private String url = "http://localhost:9200";

        /** Operations per _bulk request. */
        @Min(1)
        private int bulkBatchSize = 500;

        /** Scroll context keepalive used by the export scan. */
        @NotBlank
        private String scrollKeepalive = "5m";

        /** Hits per scroll page. */
        @Min(1)
        private int scrollSize = 500;

        /** Attempts made while waiting for the cluster to answer at startup. */
        @Min(1)
        private int connectAttempts = 30;

        private Duration connectRetryDelay = Duration.ofSeconds(2);
    }

    @Data
    public static class Export {

        /** Bucket name is {@code <deploy project id><bucketSuffix>}. */
        private String bucketSuffix = "-export-samples";

        private String blobName = "samples";
    }
}
