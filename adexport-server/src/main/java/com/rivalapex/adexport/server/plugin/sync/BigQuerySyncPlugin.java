package com.rivalapex.adexport.server.plugin.sync;

import com.rivalapex.adexport.server.constants.Compression;
import com.rivalapex.adexport.server.constants.DestinationType;
import com.rivalapex.adexport.server.constants.ExportFormat;
import com.rivalapex.adexport.server.constants.WarehouseType;
import com.rivalapex.adexport.server.dto.ExportConfig;
import com.rivalapex.adexport.server.dto.WarehouseSyncConfig;
import com.rivalapex.adexport.server.dto.WarehouseSyncContext;
import com.rivalapex.adexport.server.exception.ExportValidationException;
import com.rivalapex.adexport.server.service.ExportExecutor;
import org.springframework.stereotype.Component;

/**
 * BigQuery 同步：窗口数据导出为按行分隔的 JSON，直接加载到 dataset.table。
 */
@Component
public class BigQuerySyncPlugin extends ExportingSyncPlugin {

    public BigQuerySyncPlugin(ExportExecutor exportExecutor) {
        super(exportExecutor);
    }

    @Override
    public boolean supports(Object context) {
        return context instanceof WarehouseSyncContext
            && ((WarehouseSyncContext) context).getWarehouseType() == WarehouseType.BIGQUERY;
    }

    @Override
    public long sync(Object context) {
        WarehouseSyncContext ctx = (WarehouseSyncContext) context;
        WarehouseSyncConfig config = ctx.getConfig();
        if (isBlank(config.getDataset()) || isBlank(config.getTable())) {
            throw new ExportValidationException("dataset and table are required for bigquery sync");
        }
        ExportConfig.Destination destination = new ExportConfig.Destination();
        destination.setType(DestinationType.BIGQUERY.value());
        destination.setDataset(config.getDataset());
        destination.setTable(config.getTable());
        return exportWindow(ctx, ExportFormat.JSON, Compression.NONE, DestinationType.BIGQUERY, destination);
    }
}
