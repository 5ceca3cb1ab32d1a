package com.rivalapex.adexport.manager.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * AWS S3 上传实现。S3Client 在首次上传时按配置的 region 创建，凭证走 SDK 默认链。
 */
@Slf4j
@Component
public class S3ObjectStorageManager implements ObjectStorageManager, DisposableBean {

    public static final String PROVIDER = "s3";

    private final String region;

    private volatile S3Client s3Client;

    @Autowired
    public S3ObjectStorageManager(@Value("${adexport.storage.s3-region:us-east-1}") String region) {
        this.region = region;
    }

    S3ObjectStorageManager(S3Client s3Client) {
        this.region = null;
        this.s3Client = s3Client;
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public String putObject(String bucket, String key, Path file) throws IOException {
        long size = Files.size(file);
        PutObjectRequest request = PutObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .contentLength(size)
            .build();
        try {
            client().putObject(request, RequestBody.fromFile(file));
        } catch (SdkException e) {
            throw new IOException("S3 上传失败: bucket=" + bucket + ", key=" + key + ", " + e.getMessage(), e);
        }
        log.info("S3 上传完成: s3://{}/{}, size={}", bucket, key, size);
        return "s3://" + bucket + "/" + key;
    }

    private S3Client client() {
        S3Client client = s3Client;
        if (client == null) {
            synchronized (this) {
                client = s3Client;
                if (client == null) {
                    client = S3Client.builder().region(Region.of(region)).build();
                    s3Client = client;
                    log.info("初始化 S3Client: region={}", region);
                }
            }
        }
        return client;
    }

    @Override
    public void destroy() {
        if (s3Client != null) {
            s3Client.close();
        }
    }
}
