package com.di.bqindexer.config;

import com.di.bqindexer.export.StorageClientFactory;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registers the Google Cloud Storage client factory used by the sample export.
 * Clients use Application Default Credentials and are cached per project.
 */
@Configuration
public class GcsStorageConfig {

    @Bean
    @ConditionalOnMissingBean(StorageClientFactory.class)
    public StorageClientFactory gcsStorageClients() {
        Map<String, Storage> clients = new ConcurrentHashMap<>();
        return projectId -> clients.computeIfAbsent(projectId, id ->
                StorageOptions.newBuilder()
                        .setProjectId(id)
                        .build()
                        .getService());
    }
}
