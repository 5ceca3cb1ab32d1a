package com.rivalapex.adexport.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * 导出请求配置：格式、压缩、目的地。同时作为作业 config 列的 JSON 快照。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportConfig {

    private String format;

    private String compression;

    private Destination destination;

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Destination {

        /**
         * local / s3 / gcs / bigquery
         */
        private String type;

        private String bucket;

        /**
         * 对象存储中的目录前缀，可为空。
         */
        private String path;

        private String dataset;

        private String table;
    }
}
