package com.rivalapex.adexport.server.dto;

import com.rivalapex.adexport.server.constants.Compression;
import com.rivalapex.adexport.server.constants.DataType;
import com.rivalapex.adexport.server.constants.DestinationType;
import com.rivalapex.adexport.server.constants.ExportFormat;
import java.time.LocalDate;
import lombok.Data;

/**
 * 导出执行上下文，贯穿取数、编码、交付整个流程。
 */
@Data
public class ExportExecutionContext {

    /**
     * 作业 ID；数仓同步复用导出流程时为同步配置 ID。
     */
    private String jobId;

    private String publisherId;

    private DataType dataType;

    private LocalDate startDate;

    private LocalDate endDate;

    private ExportFormat format;

    private Compression compression;

    private DestinationType destinationType;

    /**
     * 目的地参数（bucket、path、dataset、table）。
     */
    private ExportConfig.Destination destination;

    private GlobalConfig globalConfig;

    /**
     * 生成后的文件，交付阶段使用。
     */
    private GeneratedFile generatedFile;

    /**
     * JSON 是否按行分隔输出（数仓加载要求）。
     */
    private boolean newlineDelimitedJson;
}
