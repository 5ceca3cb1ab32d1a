package com.rivalapex.adexport.server.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 进程内到期同步轮询，adexport.sync.scheduler.enabled=true 时启用。
 * 使用 xxl-job 调度时关闭此轮询，改由 dueSyncJobHandler 触发。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "adexport.sync.scheduler.enabled", havingValue = "true")
public class WarehouseSyncScheduler {

    private final WarehouseSyncService warehouseSyncService;

    @Scheduled(fixedDelayString = "${adexport.sync.scheduler.interval-ms:60000}",
        initialDelayString = "${adexport.sync.scheduler.interval-ms:60000}")
    public void pollDueSyncs() {
        try {
            warehouseSyncService.runDueSyncs();
        } catch (RuntimeException e) {
            log.error("到期同步轮询失败", e);
        }
    }
}
