package com.rivalapex.adexport;

import com.rivalapex.adexport.dao.WarehouseSyncEntity;
import com.rivalapex.adexport.server.service.WarehouseSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 启动类。默认常驻提供 HTTP API；带 --syncId 参数时先执行一次指定的数仓同步。
 *
 * 示例：
 *  java -jar adexport-start.jar --syncId=sync-1700000000000-k3j9x2a1b
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@ComponentScan(basePackages = "com.rivalapex.adexport")
@RequiredArgsConstructor
public class AdExportApplication implements CommandLineRunner {

    private static final String SYNC_ID_ARG = "--syncId=";

    private final WarehouseSyncService warehouseSyncService;

    public static void main(String[] args) {
        SpringApplication.run(AdExportApplication.class, args);
    }

    @Override
    public void run(String... args) {
        String syncId = null;
        for (String arg : args) {
            if (arg.startsWith(SYNC_ID_ARG)) {
                syncId = arg.substring(SYNC_ID_ARG.length());
            }
        }
        if (syncId == null || syncId.isEmpty()) {
            log.info("未指定 syncId，以常驻模式启动");
            return;
        }
        WarehouseSyncEntity sync = warehouseSyncService.executeWarehouseSync(syncId);
        log.info("命令行同步完成: syncId={}, status={}, rowsSynced={}, lastError={}",
            syncId, sync.getStatus(), sync.getRowsSynced(), sync.getLastError());
    }
}
