package com.rivalapex.adexport.server.constants;

import com.rivalapex.adexport.server.exception.ExportValidationException;

/**
 * 导出文件格式。
 */
public enum ExportFormat {

    CSV("csv"),
    JSON("json"),
    PARQUET("parquet");

    private final String value;

    ExportFormat(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 文件扩展名，不含压缩后缀。
     */
    public String extension() {
        return value;
    }

    public static ExportFormat fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new ExportValidationException("format is required");
        }
        for (ExportFormat format : values()) {
            if (format.value.equalsIgnoreCase(value.trim())) {
                return format;
            }
        }
        throw new ExportValidationException("Unsupported format: " + value);
    }
}
