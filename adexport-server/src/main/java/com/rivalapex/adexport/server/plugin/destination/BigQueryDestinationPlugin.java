package com.rivalapex.adexport.server.plugin.destination;

import com.rivalapex.adexport.manager.plugin.DestinationPlugin;
import com.rivalapex.adexport.manager.warehouse.LoadSourceFormat;
import com.rivalapex.adexport.manager.warehouse.WarehouseLoadManager;
import com.rivalapex.adexport.server.constants.DestinationType;
import com.rivalapex.adexport.server.dto.ExportConfig;
import com.rivalapex.adexport.server.dto.ExportExecutionContext;
import com.rivalapex.adexport.server.exception.UploadException;
import java.io.IOException;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * BigQuery 目的地：按文件扩展名确定加载格式，追加写入 dataset.table。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BigQueryDestinationPlugin implements DestinationPlugin {

    private final WarehouseLoadManager warehouseLoadManager;

    @Override
    public boolean supports(Object context) {
        return context instanceof ExportExecutionContext
            && ((ExportExecutionContext) context).getDestinationType() == DestinationType.BIGQUERY;
    }

    @Override
    public String upload(Object context) {
        ExportExecutionContext ctx = (ExportExecutionContext) context;
        ExportConfig.Destination destination = ctx.getDestination();
        Path file = ctx.getGeneratedFile().getPath();
        String table = destination.getDataset() + "." + destination.getTable();
        try {
            LoadSourceFormat format = LoadSourceFormat.fromFileName(file.getFileName().toString());
            long loaded = warehouseLoadManager.load(destination.getDataset(), destination.getTable(), file, format);
            log.info("已加载到 BigQuery: jobId={}, table={}, rows={}", ctx.getJobId(), table, loaded);
            return "bigquery://" + table;
        } catch (IOException | IllegalArgumentException e) {
            throw new UploadException("Upload to bigquery failed: table=" + table + ", " + e.getMessage(), e);
        }
    }
}
