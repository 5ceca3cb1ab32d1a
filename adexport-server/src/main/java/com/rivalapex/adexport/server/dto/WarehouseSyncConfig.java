package com.rivalapex.adexport.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * 数仓同步的目标参数，存储在 warehouse_syncs.config。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WarehouseSyncConfig {

    /**
     * 同步的数据类型，默认 impressions。
     */
    private String dataType;

    /**
     * BigQuery 目标 dataset / table。
     */
    private String dataset;

    private String table;

    /**
     * Redshift / Snowflake 的 S3 暂存位置，数仓侧由 COPY 读取。
     */
    private String stagingBucket;

    private String stagingPrefix;
}
