package com.rivalapex.adexport.web.dto;

import com.rivalapex.adexport.server.dto.ExportConfig;
import lombok.Data;

/**
 * 创建导出作业请求。日期为 ISO-8601 字符串，带时间部分时按 UTC 取日期。
 */
@Data
public class CreateExportJobRequest {

    private String dataType;

    private String startDate;

    private String endDate;

    private ExportConfig config;
}
