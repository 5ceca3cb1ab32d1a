package com.rivalapex.adexport.dao;

import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 数仓同步配置实体，对应 warehouse_syncs。
 */
@Data
public class WarehouseSyncEntity {

    private String id;

    private String publisherId;

    /**
     * bigquery / redshift / snowflake
     */
    private String warehouseType;

    private String status;

    /**
     * 同步间隔（小时）。
     */
    private int syncInterval;

    private LocalDateTime lastSyncTime;

    private LocalDateTime nextSyncTime;

    private long rowsSynced;

    /**
     * 已成功同步的最后一个完整自然日（UTC），下一次窗口从其次日开始。
     */
    private LocalDate syncedThrough;

    /**
     * 最近一次失败原因，成功后清空。
     */
    private String lastError;

    /**
     * 数仓相关配置（JSON），如 dataset、table、staging_bucket。
     */
    private String config;

    /**
     * 执行锁，同一同步配置同一时刻只允许一个执行。
     */
    private boolean running;

    /**
     * 获取执行锁的时间。进程在执行中退出时锁不会被释放，超过租期后允许重新获取。
     */
    private LocalDateTime lockAcquiredAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
