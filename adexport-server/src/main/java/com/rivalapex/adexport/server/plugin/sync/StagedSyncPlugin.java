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
 * Redshift / Snowflake 同步：窗口数据导出为 gzip CSV 暂存到 S3，
 * 数仓侧的 COPY 由客户自己的流水线执行。暂存的行数记为同步行数。
 */
@Component
public class StagedSyncPlugin extends ExportingSyncPlugin {

    public StagedSyncPlugin(ExportExecutor exportExecutor) {
        super(exportExecutor);
    }

    @Override
    public boolean supports(Object context) {
        if (!(context instanceof WarehouseSyncContext)) {
            return false;
        }
        WarehouseType type = ((WarehouseSyncContext) context).getWarehouseType();
        return type == WarehouseType.REDSHIFT || type == WarehouseType.SNOWFLAKE;
    }

    @Override
    public long sync(Object context) {
        WarehouseSyncContext ctx = (WarehouseSyncContext) context;
        WarehouseSyncConfig config = ctx.getConfig();
        if (isBlank(config.getStagingBucket())) {
            throw new ExportValidationException("stagingBucket is required for "
                + ctx.getWarehouseType().value() + " sync");
        }
        ExportConfig.Destination destination = new ExportConfig.Destination();
        destination.setType(DestinationType.S3.value());
        destination.setBucket(config.getStagingBucket());
        destination.setPath(stagingPath(config.getStagingPrefix(), ctx));
        return exportWindow(ctx, ExportFormat.CSV, Compression.GZIP, DestinationType.S3, destination);
    }

    static String stagingPath(String prefix, WarehouseSyncContext ctx) {
        String base = isBlank(prefix) ? "" : prefix.trim() + "/";
        return base + ctx.getWarehouseType().value() + "/" + ctx.getWindowEnd();
    }
}
