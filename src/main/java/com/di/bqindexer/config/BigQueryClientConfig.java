package com.di.bqindexer.config;

import com.di.bqindexer.indexer.IndexerConfigurationException;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers a BigQuery client backed by Application Default Credentials.
 * Query jobs are billed to {@code bqindexer.billing-project-id}, which must be set.
 */
@Configuration
public class BigQueryClientConfig {

    @Bean
    @ConditionalOnMissingBean(BigQuery.class)
    public BigQuery bigQueryClient(IndexerProperties properties) {
        return BigQueryOptions.newBuilder()
                .setProjectId(requireBillingProject(properties))
                .build()
                .getService();
    }

    static String requireBillingProject(IndexerProperties properties) {
        String billingProject = properties.getBillingProjectId();
        if (billingProject == null || billingProject.isBlank()) {
            throw new IndexerConfigurationException(
                    "bqindexer.billing-project-id (BILLING_PROJECT_ID) is required: "
                            + "it is the project billed for BigQuery queries");
        }
        return billingProject.trim();
    }
}
