package com.rivalapex.adexport.server.constants;

import com.rivalapex.adexport.server.exception.ExportValidationException;

/**
 * 导出目的地。每个目的地属于一种交付方式，由对应的 DestinationPlugin 处理。
 */
public enum DestinationType {

    LOCAL("local", Kind.LOCAL),
    S3("s3", Kind.OBJECT_STORAGE),
    GCS("gcs", Kind.OBJECT_STORAGE),
    BIGQUERY("bigquery", Kind.WAREHOUSE_LOAD);

    public enum Kind {
        LOCAL,
        OBJECT_STORAGE,
        WAREHOUSE_LOAD
    }

    private final String value;

    private final Kind kind;

    DestinationType(String value, Kind kind) {
        this.value = value;
        this.kind = kind;
    }

    public String value() {
        return value;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isRemote() {
        return kind != Kind.LOCAL;
    }

    /**
     * 未指定时为 LOCAL。
     */
    public static DestinationType fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            return LOCAL;
        }
        for (DestinationType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new ExportValidationException("Unsupported destination: " + value);
    }
}
