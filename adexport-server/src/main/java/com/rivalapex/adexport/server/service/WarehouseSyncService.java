package com.rivalapex.adexport.server.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rivalapex.adexport.dao.WarehouseSyncEntity;
import com.rivalapex.adexport.dao.WarehouseSyncRepository;
import com.rivalapex.adexport.dao.WarehouseSyncStatus;
import com.rivalapex.adexport.manager.id.JobIdGenerator;
import com.rivalapex.adexport.manager.plugin.WarehouseSyncPlugin;
import com.rivalapex.adexport.server.constants.DataType;
import com.rivalapex.adexport.server.constants.WarehouseType;
import com.rivalapex.adexport.server.dto.WarehouseSyncConfig;
import com.rivalapex.adexport.server.dto.WarehouseSyncContext;
import com.rivalapex.adexport.server.exception.ExportException;
import com.rivalapex.adexport.server.exception.ExportValidationException;
import com.rivalapex.adexport.server.exception.NotFoundException;
import com.rivalapex.adexport.server.exception.SyncInProgressException;
import com.rivalapex.adexport.server.worker.core.WarehouseSyncPluginRegistry;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * 数仓同步调度。时间均为 UTC，nextSyncTime 始终等于 lastSyncTime + syncInterval 小时。
 *
 * <p>同一同步同一时刻只执行一次：执行前通过仓储的条件更新获取锁，finally 中释放。
 * 持锁进程异常退出时锁会残留，超过 lockLeaseMinutes 后允许其他执行重新获取。
 *
 * <p>每次只同步 syncedThrough 之后、当前日期之前的完整自然日，成功后推进 syncedThrough，
 * 相邻两次执行的窗口不重叠，失败的日期留给下一次执行。
 */
@Slf4j
@Service
public class WarehouseSyncService {

    public static final int MIN_INTERVAL_HOURS = 1;

    public static final int MAX_INTERVAL_HOURS = 168;

    public static final long DEFAULT_LOCK_LEASE_MINUTES = 360;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final WarehouseSyncRepository warehouseSyncRepository;
    private final WarehouseSyncPluginRegistry pluginRegistry;
    private final GlobalConfigService globalConfigService;
    private final JobIdGenerator jobIdGenerator;

    private Clock clock = Clock.systemUTC();

    @Value("${adexport.sync.lock-lease-minutes:360}")
    private long lockLeaseMinutes = DEFAULT_LOCK_LEASE_MINUTES;

    public WarehouseSyncService(WarehouseSyncRepository warehouseSyncRepository,
                                WarehouseSyncPluginRegistry pluginRegistry,
                                GlobalConfigService globalConfigService,
                                JobIdGenerator jobIdGenerator) {
        this.warehouseSyncRepository = warehouseSyncRepository;
        this.pluginRegistry = pluginRegistry;
        this.globalConfigService = globalConfigService;
        this.jobIdGenerator = jobIdGenerator;
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }

    void setLockLeaseMinutes(long lockLeaseMinutes) {
        this.lockLeaseMinutes = lockLeaseMinutes;
    }

    public WarehouseSyncEntity scheduleWarehouseSync(String publisherId, String warehouseType,
                                                     Integer syncInterval, WarehouseSyncConfig config) {
        if (publisherId == null || publisherId.trim().isEmpty()) {
            throw new ExportValidationException("publisherId is required");
        }
        WarehouseType type = WarehouseType.fromValue(warehouseType);
        if (syncInterval == null || syncInterval < MIN_INTERVAL_HOURS || syncInterval > MAX_INTERVAL_HOURS) {
            throw new ExportValidationException("syncInterval must be between "
                + MIN_INTERVAL_HOURS + " and " + MAX_INTERVAL_HOURS + " hours");
        }
        WarehouseSyncConfig effective = config != null ? config : new WarehouseSyncConfig();
        if (effective.getDataType() != null) {
            DataType.fromValue(effective.getDataType());
        }

        LocalDateTime now = now();
        WarehouseSyncEntity sync = new WarehouseSyncEntity();
        sync.setId(jobIdGenerator.nextSyncId());
        sync.setPublisherId(publisherId);
        sync.setWarehouseType(type.value());
        sync.setStatus(WarehouseSyncStatus.ACTIVE.value());
        sync.setSyncInterval(syncInterval);
        sync.setLastSyncTime(now);
        sync.setNextSyncTime(now.plusHours(syncInterval));
        sync.setRowsSynced(0);
        sync.setSyncedThrough(now.toLocalDate().minusDays(1));
        sync.setConfig(toJson(effective));
        sync.setCreatedAt(now);
        sync.setUpdatedAt(now);
        warehouseSyncRepository.create(sync);
        log.info("数仓同步已创建: syncId={}, publisherId={}, warehouse={}, interval={}h, next={}",
            sync.getId(), publisherId, type.value(), syncInterval, sync.getNextSyncTime());
        return sync;
    }

    /**
     * 执行一次同步。插件失败时记录原因，时间照常推进，不抛出；已暂停的同步保持暂停，其余置为 error。
     *
     * @throws NotFoundException 同步不存在
     * @throws SyncInProgressException 同一同步正在执行且锁未过期
     */
    public WarehouseSyncEntity executeWarehouseSync(String syncId) {
        WarehouseSyncEntity sync = warehouseSyncRepository.findById(syncId)
            .orElseThrow(() -> new NotFoundException("Warehouse sync " + syncId + " not found"));
        LocalDateTime now = now();
        if (!warehouseSyncRepository.tryAcquire(syncId, now, staleBefore(now))) {
            throw new SyncInProgressException("Warehouse sync " + syncId + " is already running");
        }
        if (sync.isRunning()) {
            log.warn("执行锁已超过租期，视为持有者异常退出并重新获取: syncId={}, acquiredAt={}",
                syncId, sync.getLockAcquiredAt());
        }
        try {
            LocalDate windowEnd = now.toLocalDate().minusDays(1);
            LocalDate windowStart = sync.getSyncedThrough() != null
                ? sync.getSyncedThrough().plusDays(1) : windowEnd;
            log.info("开始执行数仓同步: syncId={}, warehouse={}, window={}..{}",
                syncId, sync.getWarehouseType(), windowStart, windowEnd);
            long rows = 0;
            String error = null;
            if (windowStart.isAfter(windowEnd)) {
                log.info("没有新的完整自然日需要同步: syncId={}, syncedThrough={}", syncId, sync.getSyncedThrough());
            } else {
                try {
                    rows = runPlugin(sync, windowStart, windowEnd);
                    sync.setSyncedThrough(windowEnd);
                } catch (Exception e) {
                    log.error("数仓同步失败: syncId={}", syncId, e);
                    error = ExportJobService.messageOf(e);
                }
            }
            sync.setLastSyncTime(now);
            sync.setNextSyncTime(now.plusHours(sync.getSyncInterval()));
            sync.setRowsSynced(rows);
            sync.setLastError(error);
            boolean paused = WarehouseSyncStatus.PAUSED.value().equals(sync.getStatus());
            if (!paused) {
                sync.setStatus(error != null ? WarehouseSyncStatus.ERROR.value() : WarehouseSyncStatus.ACTIVE.value());
            }
            sync.setUpdatedAt(now);
            warehouseSyncRepository.update(sync);
            log.info("数仓同步结束: syncId={}, status={}, rows={}, syncedThrough={}, next={}",
                syncId, sync.getStatus(), rows, sync.getSyncedThrough(), sync.getNextSyncTime());
            return sync;
        } finally {
            warehouseSyncRepository.release(syncId);
        }
    }

    public Optional<WarehouseSyncEntity> getWarehouseSync(String syncId) {
        if (syncId == null) {
            return Optional.empty();
        }
        return warehouseSyncRepository.findById(syncId);
    }

    public List<WarehouseSyncEntity> listWarehouseSyncs(String publisherId) {
        return warehouseSyncRepository.findByPublisherId(publisherId);
    }

    public WarehouseSyncEntity pauseWarehouseSync(String syncId) {
        return changeStatus(syncId, WarehouseSyncStatus.PAUSED);
    }

    /**
     * 恢复为 active，nextSyncTime 不变；已过期的同步在下一次扫描时执行。
     */
    public WarehouseSyncEntity resumeWarehouseSync(String syncId) {
        return changeStatus(syncId, WarehouseSyncStatus.ACTIVE);
    }

    /**
     * 执行所有到期且未暂停的同步，单个失败不影响其余。
     *
     * @return 实际执行的同步数
     */
    public int runDueSyncs(LocalDateTime now) {
        List<WarehouseSyncEntity> due = warehouseSyncRepository.findDue(now, staleBefore(now));
        int executed = 0;
        for (WarehouseSyncEntity sync : due) {
            try {
                executeWarehouseSync(sync.getId());
                executed++;
            } catch (SyncInProgressException e) {
                log.debug("同步正在执行，跳过: syncId={}", sync.getId());
            } catch (RuntimeException e) {
                log.error("执行到期同步失败: syncId={}", sync.getId(), e);
            }
        }
        if (!due.isEmpty()) {
            log.info("到期同步扫描完成: due={}, executed={}", due.size(), executed);
        }
        return executed;
    }

    public int runDueSyncs() {
        return runDueSyncs(now());
    }

    private long runPlugin(WarehouseSyncEntity sync, LocalDate windowStart, LocalDate windowEnd) throws Exception {
        WarehouseSyncConfig config = fromJson(sync.getConfig());
        DataType dataType = config.getDataType() != null
            ? DataType.fromValue(config.getDataType()) : DataType.IMPRESSIONS;
        WarehouseSyncContext context = new WarehouseSyncContext(
            sync.getId(),
            sync.getPublisherId(),
            WarehouseType.fromValue(sync.getWarehouseType()),
            dataType,
            windowStart,
            windowEnd,
            config,
            globalConfigService.getGlobalConfig());
        WarehouseSyncPlugin plugin = pluginRegistry.select(context);
        if (plugin == null) {
            throw new ExportException("No sync plugin for warehouse: " + sync.getWarehouseType());
        }
        return plugin.sync(context);
    }

    private WarehouseSyncEntity changeStatus(String syncId, WarehouseSyncStatus status) {
        WarehouseSyncEntity sync = warehouseSyncRepository.findById(syncId)
            .orElseThrow(() -> new NotFoundException("Warehouse sync " + syncId + " not found"));
        String previous = sync.getStatus();
        sync.setStatus(status.value());
        sync.setUpdatedAt(now());
        warehouseSyncRepository.update(sync);
        log.info("数仓同步状态变更: syncId={}, {} -> {}", syncId, previous, status.value());
        return sync;
    }

    private LocalDateTime staleBefore(LocalDateTime now) {
        return now.minusMinutes(lockLeaseMinutes);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static String toJson(WarehouseSyncConfig config) {
        try {
            return OBJECT_MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new ExportValidationException("config is not serializable: " + e.getOriginalMessage());
        }
    }

    private static WarehouseSyncConfig fromJson(String json) throws JsonProcessingException {
        if (json == null || json.trim().isEmpty()) {
            return new WarehouseSyncConfig();
        }
        return OBJECT_MAPPER.readValue(json, WarehouseSyncConfig.class);
    }
}
