package com.rivalapex.adexport.server.plugin.sync;

import com.rivalapex.adexport.manager.plugin.WarehouseSyncPlugin;
import com.rivalapex.adexport.server.constants.Compression;
import com.rivalapex.adexport.server.constants.DestinationType;
import com.rivalapex.adexport.server.constants.ExportFormat;
import com.rivalapex.adexport.server.dto.ExportConfig;
import com.rivalapex.adexport.server.dto.ExportExecutionContext;
import com.rivalapex.adexport.server.dto.ExportResult;
import com.rivalapex.adexport.server.dto.WarehouseSyncContext;
import com.rivalapex.adexport.server.exception.NoDataException;
import com.rivalapex.adexport.server.service.ExportExecutor;
import lombok.extern.slf4j.Slf4j;

/**
 * 通过导出流水线完成同步的插件基类：把同步窗口导出为文件并交付到数仓可读取的位置。
 * 窗口内没有数据时同步 0 行，不视为失败。
 */
@Slf4j
abstract class ExportingSyncPlugin implements WarehouseSyncPlugin {

    private final ExportExecutor exportExecutor;

    protected ExportingSyncPlugin(ExportExecutor exportExecutor) {
        this.exportExecutor = exportExecutor;
    }

    protected long exportWindow(WarehouseSyncContext sync, ExportFormat format, Compression compression,
                                DestinationType destinationType, ExportConfig.Destination destination) {
        ExportExecutionContext ctx = new ExportExecutionContext();
        ctx.setJobId(sync.getSyncId());
        ctx.setPublisherId(sync.getPublisherId());
        ctx.setDataType(sync.getDataType());
        ctx.setStartDate(sync.getWindowStart());
        ctx.setEndDate(sync.getWindowEnd());
        ctx.setFormat(format);
        ctx.setCompression(compression);
        ctx.setDestinationType(destinationType);
        ctx.setDestination(destination);
        ctx.setGlobalConfig(sync.getGlobalConfig());
        ctx.setNewlineDelimitedJson(format == ExportFormat.JSON);
        try {
            ExportResult result = exportExecutor.execute(ctx);
            log.info("同步窗口导出完成: syncId={}, window=[{}, {}], rows={}, location={}",
                sync.getSyncId(), sync.getWindowStart(), sync.getWindowEnd(),
                result.getRowsExported(), result.getLocation());
            return result.getRowsExported();
        } catch (NoDataException e) {
            log.info("同步窗口内无数据: syncId={}, window=[{}, {}]",
                sync.getSyncId(), sync.getWindowStart(), sync.getWindowEnd());
            return 0;
        }
    }

    protected static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
