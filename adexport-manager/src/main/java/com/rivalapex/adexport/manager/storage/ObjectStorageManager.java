package com.rivalapex.adexport.manager.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 对象存储上传抽象，每个实现对应一个云厂商。
 */
public interface ObjectStorageManager {

    /**
     * 厂商标识，如 s3、gcs。
     */
    String provider();

    /**
     * 将本地文件流式上传到 bucket/key。
     *
     * @return 对象位置 URI，例如 s3://bucket/key
     */
    String putObject(String bucket, String key, Path file) throws IOException;
}
