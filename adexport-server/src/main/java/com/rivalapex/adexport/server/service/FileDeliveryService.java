package com.rivalapex.adexport.server.service;

import com.rivalapex.adexport.manager.filesystem.FileSystemManager;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 导出文件交付：先写入 .tmp 文件，完成后原子重命名为最终文件；失败时删除 .tmp，
 * 导出目录中不会留下半成品或只有表头的文件。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileDeliveryService {

    static final String TMP_SUFFIX = ".tmp";

    private final FileSystemManager fileSystemManager;

    /**
     * 开始交付，返回应写入的临时文件路径。上次失败残留的临时文件会被删除。
     */
    public Path beginDelivery(Path targetPath) throws IOException {
        Path tmpPath = tempPathOf(targetPath);
        Path parentDir = tmpPath.getParent();
        if (parentDir != null) {
            fileSystemManager.ensureDirectory(parentDir);
        }
        if (Files.exists(tmpPath)) {
            log.warn("临时文件已存在，删除: {}", tmpPath);
            Files.delete(tmpPath);
        }
        log.debug("开始文件交付: target={}, tmp={}", targetPath, tmpPath);
        return tmpPath;
    }

    /**
     * 完成交付，将临时文件原子重命名为最终文件。
     */
    public Path completeDelivery(Path targetPath) throws IOException {
        Path tmpPath = tempPathOf(targetPath);
        if (!Files.exists(tmpPath)) {
            throw new IOException("临时文件不存在: " + tmpPath);
        }
        if (Files.exists(targetPath)) {
            log.warn("目标文件已存在，将被覆盖: {}", targetPath);
        }
        Files.move(tmpPath, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        log.info("导出文件已生成: {}", targetPath);
        return targetPath;
    }

    /**
     * 取消交付，删除临时文件。
     */
    public void cancelDelivery(Path targetPath) {
        Path tmpPath = tempPathOf(targetPath);
        if (Files.exists(tmpPath) && fileSystemManager.deleteQuietly(tmpPath)) {
            log.info("已取消文件交付，删除临时文件: {}", tmpPath);
        }
    }

    /**
     * 清理目录中上次进程遗留的 .tmp 文件。
     *
     * @return 清理的文件数量
     */
    public int cleanupTempFiles(Path directory) {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        List<Path> tmpFiles;
        try {
            tmpFiles = fileSystemManager.scanFiles(directory, "*" + TMP_SUFFIX);
        } catch (IOException e) {
            log.error("扫描临时文件失败: {}", directory, e);
            return 0;
        }
        int count = 0;
        for (Path tmpFile : tmpFiles) {
            if (fileSystemManager.deleteQuietly(tmpFile)) {
                count++;
            }
        }
        if (count > 0) {
            log.info("清理了 {} 个临时文件: {}", count, directory);
        }
        return count;
    }

    static Path tempPathOf(Path targetPath) {
        return targetPath.resolveSibling(targetPath.getFileName().toString() + TMP_SUFFIX);
    }
}
