package com.rivalapex.adexport.server.plugin.destination;

import com.rivalapex.adexport.manager.plugin.DestinationPlugin;
import com.rivalapex.adexport.manager.storage.ObjectStorageManager;
import com.rivalapex.adexport.server.constants.DestinationType;
import com.rivalapex.adexport.server.dto.ExportConfig;
import com.rivalapex.adexport.server.dto.ExportExecutionContext;
import com.rivalapex.adexport.server.exception.UploadException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 对象存储目的地（S3、GCS）。destination.path 即完整对象键，返回位置为 {@code s3://bucket/path}。
 * path 以 / 结尾时视为目录，对象键为目录加生成的文件名；未配置 path 时对象键为文件名。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ObjectStorageDestinationPlugin implements DestinationPlugin {

    private final List<ObjectStorageManager> storageManagers;

    @Override
    public boolean supports(Object context) {
        return context instanceof ExportExecutionContext
            && ((ExportExecutionContext) context).getDestinationType().kind() == DestinationType.Kind.OBJECT_STORAGE;
    }

    @Override
    public String upload(Object context) {
        ExportExecutionContext ctx = (ExportExecutionContext) context;
        String provider = ctx.getDestinationType().value();
        ExportConfig.Destination destination = ctx.getDestination();
        Path file = ctx.getGeneratedFile().getPath();
        String key = objectKey(destination.getPath(), file.getFileName().toString());

        ObjectStorageManager manager = storageManagers.stream()
            .filter(m -> provider.equals(m.provider()))
            .findFirst()
            .orElseThrow(() -> new UploadException("No object storage client for provider: " + provider));
        try {
            String location = manager.putObject(destination.getBucket(), key, file);
            log.info("导出文件已上传: jobId={}, location={}", ctx.getJobId(), location);
            return location;
        } catch (IOException e) {
            throw new UploadException("Upload to " + provider + " failed: bucket=" + destination.getBucket()
                + ", key=" + key, e);
        }
    }

    static String objectKey(String path, String fileName) {
        if (path == null) {
            return fileName;
        }
        String key = path.trim();
        while (key.startsWith("/")) {
            key = key.substring(1);
        }
        if (key.isEmpty()) {
            return fileName;
        }
        return key.endsWith("/") ? key + fileName : key;
    }
}
