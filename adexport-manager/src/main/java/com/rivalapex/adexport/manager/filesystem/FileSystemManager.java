package com.rivalapex.adexport.manager.filesystem;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 文件系统操作抽象。
 */
public interface FileSystemManager {

    Path ensureDirectory(Path dir) throws IOException;

    long size(Path file) throws IOException;

    /**
     * 尽力删除文件，失败只记录日志。
     *
     * @return 文件是否被删除
     */
    boolean deleteQuietly(Path file);

    /**
     * 按 glob 模式（如 "*.csv.tmp"）扫描目录下的文件，不递归。
     */
    List<Path> scanFiles(Path dir, String glob) throws IOException;
}
