package com.rivalapex.adexport.server.service;

import com.rivalapex.adexport.manager.filesystem.FileSystemManager;
import com.rivalapex.adexport.manager.plugin.DestinationPlugin;
import com.rivalapex.adexport.server.dto.ExportExecutionContext;
import com.rivalapex.adexport.server.dto.ExportResult;
import com.rivalapex.adexport.server.dto.GeneratedFile;
import com.rivalapex.adexport.server.dto.GlobalConfig;
import com.rivalapex.adexport.server.exception.ExportException;
import com.rivalapex.adexport.server.exception.UploadException;
import com.rivalapex.adexport.server.source.ExportRow;
import com.rivalapex.adexport.server.source.RowSource;
import com.rivalapex.adexport.server.worker.core.DestinationPluginRegistry;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 导出流水线：磁盘检查 → 取数 → 生成文件 → 交付到目的地。
 *
 * 导出作业与数仓同步共用。远端交付后本地文件在 finally 中删除；
 * 开启 retain_failed_uploads 时上传失败的文件保留以便排查。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExportExecutor {

    private final RowSource rowSource;
    private final ExportFileGenerator fileGenerator;
    private final DestinationPluginRegistry destinationPluginRegistry;
    private final DiskSpaceChecker diskSpaceChecker;
    private final FileSystemManager fileSystemManager;

    public ExportResult execute(ExportExecutionContext context) {
        GlobalConfig globalConfig = context.getGlobalConfig();
        Path exportDir = Paths.get(globalConfig.getExport().getExportDir());
        if (!diskSpaceChecker.checkDiskSpace(exportDir, globalConfig.getDiskProtection())) {
            throw new ExportException("Insufficient disk space in export directory: " + exportDir);
        }

        DestinationPlugin plugin = destinationPluginRegistry.select(context);
        if (plugin == null) {
            throw new UploadException("No destination plugin for: " + context.getDestinationType().value());
        }

        GeneratedFile file;
        try (Stream<ExportRow> rows = rowSource.fetch(context.getDataType(), context.getPublisherId(),
            context.getStartDate(), context.getEndDate())) {
            file = fileGenerator.generate(context, rows);
        }
        context.setGeneratedFile(file);

        if (!plugin.isRemote()) {
            return new ExportResult(file.getRowsWritten(), file.getFileSize(), upload(plugin, context));
        }

        boolean uploaded = false;
        try {
            String location = upload(plugin, context);
            uploaded = true;
            return new ExportResult(file.getRowsWritten(), file.getFileSize(), location);
        } finally {
            if (uploaded || !Boolean.TRUE.equals(globalConfig.getExport().getRetainFailedUploads())) {
                if (fileSystemManager.deleteQuietly(file.getPath())) {
                    log.debug("已删除本地导出文件: {}", file.getPath());
                }
            } else {
                log.warn("上传失败，保留本地导出文件: {}", file.getPath());
            }
        }
    }

    private String upload(DestinationPlugin plugin, ExportExecutionContext context) {
        try {
            return plugin.upload(context);
        } catch (ExportException e) {
            throw e;
        } catch (Exception e) {
            throw new UploadException("Upload to " + context.getDestinationType().value()
                + " failed: " + e.getMessage(), e);
        }
    }
}
