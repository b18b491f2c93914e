package com.di.bqindexer.config;

import org.apache.http.HttpHost;
import org.elasticsearch.client.RestClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the low-level Elasticsearch REST client for {@code bqindexer.elasticsearch.url}.
 */
@Configuration
public class ElasticsearchClientConfig {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(RestClient.class)
    public RestClient elasticsearchRestClient(IndexerProperties properties) {
        String url = properties.getElasticsearch().getUrl();
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            throw new IllegalStateException(
                    "bqindexer.elasticsearch.url must start with http:// or https://, got: " + url);
        }
        return RestClient.builder(HttpHost.create(url)).build();
    }
}
