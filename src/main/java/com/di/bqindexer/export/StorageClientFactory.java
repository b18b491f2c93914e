package com.di.bqindexer.export;

import com.google.cloud.storage.Storage;

/**
 * Hands out a Cloud Storage client whose default project is {@code projectId}.
 * Buckets created through that client belong to that project.
 */
@FunctionalInterface
public interface StorageClientFactory {

    Storage forProject(String projectId);
}
