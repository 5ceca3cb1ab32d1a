package com.rivalapex.adexport.dao;

/**
 * 数仓同步配置状态，没有终态。
 */
public enum WarehouseSyncStatus {

    ACTIVE("active"),
    PAUSED("paused"),
    ERROR("error");

    private final String value;

    WarehouseSyncStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static WarehouseSyncStatus fromValue(String value) {
        for (WarehouseSyncStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("未知的同步状态: " + value);
    }
}
