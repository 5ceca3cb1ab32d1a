package com.rivalapex.adexport.manager.filesystem;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 本地文件系统实现。
 */
@Slf4j
@Component
public class LocalFileSystemManager implements FileSystemManager {

    @Override
    public Path ensureDirectory(Path dir) throws IOException {
        if (Files.notExists(dir)) {
            Files.createDirectories(dir);
            log.info("创建目录: {}", dir);
        }
        return dir;
    }

    @Override
    public long size(Path file) throws IOException {
        return Files.size(file);
    }

    @Override
    public boolean deleteQuietly(Path file) {
        if (file == null) {
            return false;
        }
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) {
                log.debug("已删除文件: {}", file);
            }
            return deleted;
        } catch (IOException e) {
            log.warn("删除文件失败: {}", file, e);
            return false;
        }
    }

    @Override
    public List<Path> scanFiles(Path dir, String glob) throws IOException {
        if (Files.notExists(dir)) {
            return new ArrayList<>();
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + (glob == null ? "*" : glob));
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(p -> matcher.matches(p.getFileName()))
                .sorted()
                .collect(Collectors.toList());
        }
    }
}
