package com.rivalapex.adexport.server.dto;

import lombok.Value;

/**
 * 一次导出执行的结果。
 */
@Value
public class ExportResult {

    long rowsExported;

    long fileSize;

    /**
     * 本地路径、s3://、gs:// 或 bigquery://dataset.table。
     */
    String location;
}
