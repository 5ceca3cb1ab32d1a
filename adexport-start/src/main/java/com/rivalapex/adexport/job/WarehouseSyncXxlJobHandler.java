package com.rivalapex.adexport.job;

import com.rivalapex.adexport.dao.WarehouseSyncEntity;
import com.rivalapex.adexport.dao.WarehouseSyncStatus;
import com.rivalapex.adexport.server.exception.SyncInProgressException;
import com.rivalapex.adexport.server.service.WarehouseSyncService;
import com.xxl.job.core.context.XxlJobHelper;
import com.xxl.job.core.handler.annotation.XxlJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 提供给 xxl-job 的数仓同步处理器。
 *
 * 调度中心配置示例：
 * - JobHandler：warehouseSyncJobHandler，执行参数填写同步 id，如 "sync-1700000000000-k3j9x2a1b"
 * - JobHandler：dueSyncJobHandler，无参数，执行所有已到期的同步
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WarehouseSyncXxlJobHandler {

    private final WarehouseSyncService warehouseSyncService;

    @XxlJob("warehouseSyncJobHandler")
    public void executeSync() {
        String param = XxlJobHelper.getJobParam();
        XxlJobHelper.log("warehouseSyncJobHandler start, param={}", param);

        if (param == null || param.trim().isEmpty()) {
            XxlJobHelper.handleFail("缺少参数，需提供同步 id");
            return;
        }
        String syncId = param.trim();
        try {
            WarehouseSyncEntity sync = warehouseSyncService.executeWarehouseSync(syncId);
            if (WarehouseSyncStatus.ERROR.value().equals(sync.getStatus())) {
                XxlJobHelper.handleFail("同步失败：" + sync.getLastError());
                return;
            }
            XxlJobHelper.log("warehouseSyncJobHandler success, syncId={}, rowsSynced={}",
                syncId, sync.getRowsSynced());
        } catch (SyncInProgressException e) {
            XxlJobHelper.log("同步正在执行，跳过本次调度: syncId={}", syncId);
        } catch (RuntimeException e) {
            log.error("warehouseSyncJobHandler failed, param={}", param, e);
            XxlJobHelper.log(e);
            XxlJobHelper.handleFail("warehouseSyncJobHandler 执行失败：" + e.getMessage());
            throw e;
        }
    }

    @XxlJob("dueSyncJobHandler")
    public void executeDueSyncs() {
        int executed = warehouseSyncService.runDueSyncs();
        XxlJobHelper.log("dueSyncJobHandler 执行到期同步 {} 个", executed);
    }
}
