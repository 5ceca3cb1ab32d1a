package com.rivalapex.adexport.server.constants;

import com.rivalapex.adexport.server.exception.ExportValidationException;

/**
 * 数仓类型。
 */
public enum WarehouseType {

    BIGQUERY("bigquery"),
    REDSHIFT("redshift"),
    SNOWFLAKE("snowflake");

    private final String value;

    WarehouseType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static WarehouseType fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new ExportValidationException("warehouseType is required");
        }
        for (WarehouseType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new ExportValidationException("Unsupported warehouseType: " + value);
    }
}
