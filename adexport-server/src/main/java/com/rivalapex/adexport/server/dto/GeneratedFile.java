package com.rivalapex.adexport.server.dto;

import java.nio.file.Path;
import lombok.Value;

/**
 * 生成完成的导出文件。
 */
@Value
public class GeneratedFile {

    Path path;

    long rowsWritten;

    /**
     * 落盘后的字节数（压缩后）。
     */
    long fileSize;
}
