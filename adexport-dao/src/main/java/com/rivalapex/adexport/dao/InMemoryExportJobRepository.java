package com.rivalapex.adexport.dao;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * 基于内存的导出作业仓储实现，存取均为副本，行为与数据库实现一致。
 */
@Repository
@ConditionalOnProperty(name = "adexport.persistence.type", havingValue = "memory")
public class InMemoryExportJobRepository implements ExportJobRepository {

    private final Map<String, ExportJobEntity> store = new ConcurrentHashMap<>();

    @Override
    public ExportJobEntity create(ExportJobEntity entity) {
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(LocalDateTime.now(ZoneOffset.UTC));
        }
        if (store.putIfAbsent(entity.getId(), copy(entity)) != null) {
            throw new IllegalStateException("导出作业已存在: " + entity.getId());
        }
        return entity;
    }

    @Override
    public boolean update(ExportJobEntity entity) {
        return store.computeIfPresent(entity.getId(), (id, existing) -> {
            existing.setStatus(entity.getStatus());
            existing.setRowsExported(entity.getRowsExported());
            existing.setFileSize(entity.getFileSize());
            existing.setLocation(entity.getLocation());
            existing.setError(entity.getError());
            existing.setCompletedAt(entity.getCompletedAt());
            return existing;
        }) != null;
    }

    @Override
    public Optional<ExportJobEntity> findById(String id) {
        return Optional.ofNullable(store.get(id)).map(InMemoryExportJobRepository::copy);
    }

    @Override
    public List<ExportJobEntity> findByPublisherId(String publisherId, int limit) {
        return store.values().stream()
            .filter(e -> publisherId.equals(e.getPublisherId()))
            .sorted(Comparator.comparing(ExportJobEntity::getCreatedAt).reversed())
            .limit(limit)
            .map(InMemoryExportJobRepository::copy)
            .collect(Collectors.toList());
    }

    @Override
    public List<ExportJobEntity> findByStatusIn(Collection<String> statuses) {
        return store.values().stream()
            .filter(e -> statuses.contains(e.getStatus()))
            .map(InMemoryExportJobRepository::copy)
            .collect(Collectors.toList());
    }

    private static ExportJobEntity copy(ExportJobEntity source) {
        ExportJobEntity target = new ExportJobEntity();
        target.setId(source.getId());
        target.setPublisherId(source.getPublisherId());
        target.setDataType(source.getDataType());
        target.setFormat(source.getFormat());
        target.setCompression(source.getCompression());
        target.setDestination(source.getDestination());
        target.setStatus(source.getStatus());
        target.setStartDate(source.getStartDate());
        target.setEndDate(source.getEndDate());
        target.setRowsExported(source.getRowsExported());
        target.setFileSize(source.getFileSize());
        target.setLocation(source.getLocation());
        target.setError(source.getError());
        target.setConfig(source.getConfig());
        target.setCreatedAt(source.getCreatedAt());
        target.setCompletedAt(source.getCompletedAt());
        return target;
    }
}
