package com.rivalapex.adexport.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * 全局配置，对应 conf/global.yaml。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    public static final String DEFAULT_EXPORT_DIR = "/tmp/ad-exports";

    public static final int DEFAULT_STREAM_BATCH_SIZE = 5000;

    public static final long DEFAULT_MAX_RAW_ROWS = 1_000_000L;

    private ExportSettings export;

    private ConcurrencyConfig concurrency;

    @JsonProperty("disk_protection")
    private DiskProtectionConfig diskProtection;

    /**
     * 分析库只读连接池，不配置时复用主数据源。
     */
    private AnalyticsDatabaseConfig analytics;

    /**
     * 补齐缺省值，保证各项配置非空。
     */
    public GlobalConfig applyDefaults() {
        if (export == null) {
            export = new ExportSettings();
        }
        if (export.getExportDir() == null || export.getExportDir().trim().isEmpty()) {
            export.setExportDir(DEFAULT_EXPORT_DIR);
        }
        if (export.getStreamBatchSize() == null || export.getStreamBatchSize() <= 0) {
            export.setStreamBatchSize(DEFAULT_STREAM_BATCH_SIZE);
        }
        if (export.getMaxRawRows() == null || export.getMaxRawRows() <= 0) {
            export.setMaxRawRows(DEFAULT_MAX_RAW_ROWS);
        }
        if (export.getRetainFailedUploads() == null) {
            export.setRetainFailedUploads(false);
        }
        if (concurrency == null) {
            concurrency = new ConcurrencyConfig();
        }
        if (concurrency.getMaxExportJobs() == null || concurrency.getMaxExportJobs() <= 0) {
            concurrency.setMaxExportJobs(4);
        }
        if (concurrency.getQueueCapacity() == null || concurrency.getQueueCapacity() < 0) {
            concurrency.setQueueCapacity(100);
        }
        return this;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExportSettings {

        /**
         * 导出工作目录，启动时不存在则创建。
         */
        @JsonProperty("export_dir")
        private String exportDir;

        /**
         * 分析库游标每批拉取行数。
         */
        @JsonProperty("stream_batch_size")
        private Integer streamBatchSize;

        /**
         * all 类型原始明细的最大导出行数。
         */
        @JsonProperty("max_raw_rows")
        private Long maxRawRows;

        /**
         * 远端上传失败时是否保留本地文件以便排查。
         */
        @JsonProperty("retain_failed_uploads")
        private Boolean retainFailedUploads;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConcurrencyConfig {

        /**
         * 同时执行的导出作业上限。
         */
        @JsonProperty("max_export_jobs")
        private Integer maxExportJobs;

        /**
         * 等待队列长度，队列满时新作业直接失败。
         */
        @JsonProperty("queue_capacity")
        private Integer queueCapacity;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DiskProtectionConfig {

        /**
         * 是否启用磁盘水位保护
         */
        private Boolean enabled;

        /**
         * 最小可用空间（GB）
         */
        @JsonProperty("min_free_space_gb")
        private Double minFreeSpaceGb;

        /**
         * 最小可用空间百分比
         */
        @JsonProperty("min_free_space_percent")
        private Double minFreeSpacePercent;

        /**
         * 检查失败时是否拒绝执行
         */
        @JsonProperty("fail_on_check_error")
        private Boolean failOnCheckError;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AnalyticsDatabaseConfig {

        @JsonProperty("jdbc_url")
        private String jdbcUrl;

        private String username;

        private String password;

        @JsonProperty("max_pool_size")
        private Integer maxPoolSize;

        /**
         * 单条查询超时（秒）。
         */
        @JsonProperty("query_timeout_sec")
        private Integer queryTimeoutSec;
    }
}
