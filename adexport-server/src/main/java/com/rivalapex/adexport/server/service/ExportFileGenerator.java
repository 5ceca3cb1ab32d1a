package com.rivalapex.adexport.server.service;

import com.rivalapex.adexport.manager.compression.CompressionManager;
import com.rivalapex.adexport.manager.filesystem.FileSystemManager;
import com.rivalapex.adexport.server.constants.Compression;
import com.rivalapex.adexport.server.dto.ExportExecutionContext;
import com.rivalapex.adexport.server.dto.GeneratedFile;
import com.rivalapex.adexport.server.encoder.EncodeOptions;
import com.rivalapex.adexport.server.encoder.FormatEncoder;
import com.rivalapex.adexport.server.encoder.FormatEncoderRegistry;
import com.rivalapex.adexport.server.exception.EncodingException;
import com.rivalapex.adexport.server.schema.ExportSchemas;
import com.rivalapex.adexport.server.source.ExportRow;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 导出文件生成：行流经编码器（可选 gzip）写入 .tmp，成功后重命名。
 *
 * 文件名为 {@code <dataType>_<publisherId>_<epochMillis>.<format>[.gz]}。行流由调用方关闭。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExportFileGenerator {

    private static final int BUFFER_SIZE = 64 * 1024;

    private final FormatEncoderRegistry encoderRegistry;
    private final CompressionManager compressionManager;
    private final FileSystemManager fileSystemManager;
    private final FileDeliveryService fileDeliveryService;

    public GeneratedFile generate(ExportExecutionContext context, Stream<ExportRow> rows) {
        FormatEncoder encoder = encoderRegistry.select(context.getFormat());
        if (encoder == null) {
            throw new EncodingException("Unsupported format: " + context.getFormat());
        }
        Path exportDir = Paths.get(context.getGlobalConfig().getExport().getExportDir());
        Path target = exportDir.resolve(fileNameOf(context, System.currentTimeMillis()));
        EncodeOptions options = new EncodeOptions(ExportSchemas.forDataType(context.getDataType()),
            context.isNewlineDelimitedJson());

        try {
            fileSystemManager.ensureDirectory(exportDir);
            Path tmpPath = fileDeliveryService.beginDelivery(target);
            long rowsWritten;
            try (OutputStream out = openOutput(tmpPath, context.getCompression())) {
                rowsWritten = encoder.encode(rows.iterator(), out, options);
            }
            Path path = fileDeliveryService.completeDelivery(target);
            long fileSize = fileSystemManager.size(path);
            log.info("导出文件生成完成: jobId={}, file={}, rows={}, size={}",
                context.getJobId(), path.getFileName(), rowsWritten, fileSize);
            return new GeneratedFile(path, rowsWritten, fileSize);
        } catch (IOException e) {
            fileDeliveryService.cancelDelivery(target);
            throw new EncodingException("Failed to write export file " + target.getFileName() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            fileDeliveryService.cancelDelivery(target);
            throw e;
        }
    }

    /**
     * 文件名带作业 ID，同一毫秒内启动的作业不会共用同一个目标文件和 .tmp 文件。
     */
    static String fileNameOf(ExportExecutionContext context, long epochMillis) {
        Compression compression = context.getCompression() != null ? context.getCompression() : Compression.NONE;
        return context.getDataType().value()
            + "_" + sanitize(context.getPublisherId())
            + "_" + epochMillis
            + "_" + sanitize(context.getJobId())
            + "." + context.getFormat().extension()
            + compression.suffix();
    }

    /**
     * 发布者 ID 作为文件名片段，非 [A-Za-z0-9_-] 的字符替换为下划线。
     */
    static String sanitize(String publisherId) {
        return publisherId.replaceAll("[^A-Za-z0-9_-]", "_");
    }

    private OutputStream openOutput(Path tmpPath, Compression compression) throws IOException {
        OutputStream raw = new BufferedOutputStream(Files.newOutputStream(tmpPath), BUFFER_SIZE);
        if (compression != Compression.GZIP) {
            return raw;
        }
        try {
            return compressionManager.gzipOutput(raw);
        } catch (IOException e) {
            raw.close();
            throw e;
        }
    }
}
