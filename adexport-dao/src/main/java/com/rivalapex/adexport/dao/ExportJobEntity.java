package com.rivalapex.adexport.dao;

import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 导出作业表实体，对应 export_jobs。时间均为 UTC。
 */
@Data
public class ExportJobEntity {

    private String id;

    private String publisherId;

    /**
     * impressions / revenue / fraud_events / telemetry / all
     */
    private String dataType;

    private String format;

    private String compression;

    /**
     * local / s3 / gcs / bigquery
     */
    private String destination;

    private String status;

    private LocalDate startDate;

    private LocalDate endDate;

    private long rowsExported;

    private long fileSize;

    /**
     * 本地路径或远端 URI，仅成功后有值。
     */
    private String location;

    /**
     * 失败原因，仅 failed 时有值。
     */
    private String error;

    /**
     * 导出配置快照（JSON）。
     */
    private String config;

    private LocalDateTime createdAt;

    private LocalDateTime completedAt;
}
