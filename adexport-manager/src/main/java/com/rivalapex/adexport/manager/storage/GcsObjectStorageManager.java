package com.rivalapex.adexport.manager.storage;

import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import com.google.cloud.storage.StorageOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Google Cloud Storage 上传实现，凭证走 Application Default Credentials。
 */
@Slf4j
@Component
public class GcsObjectStorageManager implements ObjectStorageManager {

    public static final String PROVIDER = "gcs";

    private final String projectId;

    private volatile Storage storage;

    @Autowired
    public GcsObjectStorageManager(@Value("${adexport.storage.gcp-project-id:}") String projectId) {
        this.projectId = projectId;
    }

    GcsObjectStorageManager(Storage storage) {
        this.projectId = null;
        this.storage = storage;
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public String putObject(String bucket, String key, Path file) throws IOException {
        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucket, key)).build();
        try {
            storage().createFrom(blobInfo, file);
        } catch (StorageException e) {
            throw new IOException("GCS 上传失败: bucket=" + bucket + ", key=" + key + ", " + e.getMessage(), e);
        }
        log.info("GCS 上传完成: gs://{}/{}, size={}", bucket, key, Files.size(file));
        return "gs://" + bucket + "/" + key;
    }

    private Storage storage() {
        Storage current = storage;
        if (current == null) {
            synchronized (this) {
                current = storage;
                if (current == null) {
                    StorageOptions.Builder builder = StorageOptions.newBuilder();
                    if (projectId != null && !projectId.isEmpty()) {
                        builder.setProjectId(projectId);
                    }
                    current = builder.build().getService();
                    storage = current;
                }
            }
        }
        return current;
    }
}
