package com.di.bqindexer.export;

import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Bucket;
import com.google.cloud.storage.BucketInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link BlobStore} on Google Cloud Storage. All calls go through a client
 * bound to the requested project, so a bucket created here is owned by it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GcsBlobStore implements BlobStore {

    private final StorageClientFactory clients;

    @Override
    public String write(String project, String bucketName, String objectName,
                        byte[] content, String contentType) {
        String gcsPath = "gs://" + bucketName + "/" + objectName;
        Storage storage = clients.forProject(project);
        try {
            Bucket bucket = storage.get(bucketName);
            if (bucket == null) {
                log.info("[EXPORT] creating bucket {} in project {}", bucketName, project);
                storage.create(BucketInfo.of(bucketName));
            }
            BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucketName, objectName))
                    .setContentType(contentType)
                    .build();
            storage.create(blobInfo, content);
            return gcsPath;
        } catch (StorageException e) {
            throw new ExportException("Failed to write " + gcsPath, e);
        }
    }
}
