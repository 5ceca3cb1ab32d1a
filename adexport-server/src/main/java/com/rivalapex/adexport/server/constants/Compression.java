package com.rivalapex.adexport.server.constants;

import com.rivalapex.adexport.server.exception.ExportValidationException;

/**
 * 导出文件压缩方式。snappy 只在 Parquet 内部编码中有意义，这里不接受。
 */
public enum Compression {

    NONE("none", ""),
    GZIP("gzip", ".gz");

    private final String value;

    private final String suffix;

    Compression(String value, String suffix) {
        this.value = value;
        this.suffix = suffix;
    }

    public String value() {
        return value;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * 未指定时为 NONE。
     */
    public static Compression fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            return NONE;
        }
        for (Compression compression : values()) {
            if (compression.value.equalsIgnoreCase(value.trim())) {
                return compression;
            }
        }
        throw new ExportValidationException("Unsupported compression: " + value);
    }
}
