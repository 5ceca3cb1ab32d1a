package com.rivalapex.adexport.server.constants;

import com.rivalapex.adexport.server.exception.ExportValidationException;

/**
 * 导出数据类型，决定聚合查询与行结构。
 */
public enum DataType {

    IMPRESSIONS("impressions"),
    REVENUE("revenue"),
    FRAUD_EVENTS("fraud_events"),
    TELEMETRY("telemetry"),
    /**
     * 原始曝光明细，受最大行数限制。
     */
    ALL("all");

    private final String value;

    DataType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static DataType fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new ExportValidationException("dataType is required");
        }
        String normalized = value.trim().toLowerCase();
        // 兼容旧客户端的 fraud
        if ("fraud".equals(normalized)) {
            return FRAUD_EVENTS;
        }
        for (DataType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new ExportValidationException("Unsupported dataType: " + value);
    }
}
