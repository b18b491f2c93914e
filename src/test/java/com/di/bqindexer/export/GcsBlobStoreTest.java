package com.di.bqindexer.export;

import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Bucket;
import com.google.cloud.storage.BucketInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Test cases for GcsBlobStore.
 */
@DisplayName("GcsBlobStore Tests")
class GcsBlobStoreTest {

    private static final String BUCKET = "deploy-proj-export-samples";
    private static final byte[] CONTENT = "[".getBytes(StandardCharsets.UTF_8);

    private Storage       storage;
    private List<String>  requestedProjects;
    private GcsBlobStore  blobStore;

    @BeforeEach
    void setUp() {
        storage           = mock(Storage.class);
        requestedProjects = new ArrayList<>();
        blobStore         = new GcsBlobStore(projectId -> {
            requestedProjects.add(projectId);
            return storage;
        });
    }

    @Test
    @DisplayName("Should create a missing bucket through a client bound to the deploy project")
    void testWrite_CreatesBucketInDeployProject() {
        when(storage.get(BUCKET)).thenReturn(null);

        String location = blobStore.write("deploy-proj", BUCKET, "samples", CONTENT, "application/json");

        assertEquals("gs://" + BUCKET + "/samples", location);
        assertEquals(List.of("deploy-proj"), requestedProjects);

        ArgumentCaptor<BucketInfo> bucket = ArgumentCaptor.forClass(BucketInfo.class);
        verify(storage).create(bucket.capture());
        assertEquals(BUCKET, bucket.getValue().getName());
    }

    @Test
    @DisplayName("Should write the object with its content type and not recreate an existing bucket")
    void testWrite_ExistingBucket() {
        when(storage.get(BUCKET)).thenReturn(mock(Bucket.class));

        blobStore.write("deploy-proj", BUCKET, "samples", CONTENT, "application/json");

        verify(storage, never()).create(any(BucketInfo.class));
        ArgumentCaptor<BlobInfo> blob = ArgumentCaptor.forClass(BlobInfo.class);
        verify(storage).create(blob.capture(), eq(CONTENT));
        assertEquals(BUCKET, blob.getValue().getBucket());
        assertEquals("samples", blob.getValue().getName());
        assertEquals("application/json", blob.getValue().getContentType());
    }

    @Test
    @DisplayName("Should wrap storage failures in ExportException")
    void testWrite_StorageFailure() {
        when(storage.get(BUCKET)).thenThrow(new StorageException(403, "forbidden"));

        ExportException ex = assertThrows(ExportException.class,
                () -> blobStore.write("deploy-proj", BUCKET, "samples", CONTENT, "application/json"));
        assertTrue(ex.getMessage().contains("gs://" + BUCKET + "/samples"));
    }
}
