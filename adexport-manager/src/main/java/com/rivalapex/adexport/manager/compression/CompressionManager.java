package com.rivalapex.adexport.manager.compression;

import java.io.IOException;
import java.io.OutputStream;

/**
 * 导出文件压缩管理。
 */
public interface CompressionManager {

    /**
     * 以 gzip 包装输出流，写入的字节在落盘前被压缩。关闭返回的流会同时关闭底层流。
     */
    OutputStream gzipOutput(OutputStream out) throws IOException;
}
