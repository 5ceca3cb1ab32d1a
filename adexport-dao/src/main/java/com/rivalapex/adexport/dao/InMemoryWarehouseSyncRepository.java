package com.rivalapex.adexport.dao;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * 基于内存的数仓同步配置仓储实现。
 */
@Repository
@ConditionalOnProperty(name = "adexport.persistence.type", havingValue = "memory")
public class InMemoryWarehouseSyncRepository implements WarehouseSyncRepository {

    private final Map<String, WarehouseSyncEntity> store = new ConcurrentHashMap<>();

    @Override
    public WarehouseSyncEntity create(WarehouseSyncEntity entity) {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(now);
        }
        entity.setUpdatedAt(now);
        entity.setRunning(false);
        if (store.putIfAbsent(entity.getId(), copy(entity)) != null) {
            throw new IllegalStateException("同步配置已存在: " + entity.getId());
        }
        return entity;
    }

    @Override
    public boolean update(WarehouseSyncEntity entity) {
        entity.setUpdatedAt(LocalDateTime.now(ZoneOffset.UTC));
        return store.computeIfPresent(entity.getId(), (id, existing) -> {
            WarehouseSyncEntity updated = copy(entity);
            // 执行锁只由 tryAcquire/release 维护
            updated.setRunning(existing.isRunning());
            updated.setLockAcquiredAt(existing.getLockAcquiredAt());
            updated.setCreatedAt(existing.getCreatedAt());
            return updated;
        }) != null;
    }

    @Override
    public Optional<WarehouseSyncEntity> findById(String id) {
        return Optional.ofNullable(store.get(id)).map(InMemoryWarehouseSyncRepository::copy);
    }

    @Override
    public List<WarehouseSyncEntity> findByPublisherId(String publisherId) {
        return store.values().stream()
            .filter(e -> publisherId.equals(e.getPublisherId()))
            .sorted(Comparator.comparing(WarehouseSyncEntity::getCreatedAt).reversed())
            .map(InMemoryWarehouseSyncRepository::copy)
            .collect(Collectors.toList());
    }

    @Override
    public List<WarehouseSyncEntity> findDue(LocalDateTime now, LocalDateTime staleBefore) {
        return store.values().stream()
            .filter(e -> !WarehouseSyncStatus.PAUSED.value().equals(e.getStatus()))
            .filter(e -> isAcquirable(e, staleBefore))
            .filter(e -> e.getNextSyncTime() != null && !e.getNextSyncTime().isAfter(now))
            .sorted(Comparator.comparing(WarehouseSyncEntity::getNextSyncTime))
            .map(InMemoryWarehouseSyncRepository::copy)
            .collect(Collectors.toList());
    }

    @Override
    public boolean tryAcquire(String id, LocalDateTime now, LocalDateTime staleBefore) {
        AtomicBoolean acquired = new AtomicBoolean(false);
        store.computeIfPresent(id, (key, existing) -> {
            if (isAcquirable(existing, staleBefore)) {
                existing.setRunning(true);
                existing.setLockAcquiredAt(now);
                acquired.set(true);
            }
            return existing;
        });
        return acquired.get();
    }

    @Override
    public void release(String id) {
        store.computeIfPresent(id, (key, existing) -> {
            existing.setRunning(false);
            existing.setLockAcquiredAt(null);
            return existing;
        });
    }

    private static boolean isAcquirable(WarehouseSyncEntity entity, LocalDateTime staleBefore) {
        return !entity.isRunning()
            || entity.getLockAcquiredAt() == null
            || entity.getLockAcquiredAt().isBefore(staleBefore);
    }

    private static WarehouseSyncEntity copy(WarehouseSyncEntity source) {
        WarehouseSyncEntity target = new WarehouseSyncEntity();
        target.setId(source.getId());
        target.setPublisherId(source.getPublisherId());
        target.setWarehouseType(source.getWarehouseType());
        target.setStatus(source.getStatus());
        target.setSyncInterval(source.getSyncInterval());
        target.setLastSyncTime(source.getLastSyncTime());
        target.setNextSyncTime(source.getNextSyncTime());
        target.setRowsSynced(source.getRowsSynced());
        target.setSyncedThrough(source.getSyncedThrough());
        target.setLastError(source.getLastError());
        target.setConfig(source.getConfig());
        target.setRunning(source.isRunning());
        target.setLockAcquiredAt(source.getLockAcquiredAt());
        target.setCreatedAt(source.getCreatedAt());
        target.setUpdatedAt(source.getUpdatedAt());
        return target;
    }
}
