package com.rivalapex.adexport.dao;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * 基于数据库的数仓同步配置仓储实现。执行锁通过条件更新 running 列实现，多节点部署同样有效。
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "adexport.persistence.type", havingValue = "database", matchIfMissing = true)
@RequiredArgsConstructor
public class DatabaseWarehouseSyncRepository implements WarehouseSyncRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL =
        "INSERT INTO warehouse_syncs (id, publisher_id, warehouse_type, status, sync_interval, " +
        "last_sync_time, next_sync_time, rows_synced, synced_through, last_error, config, running, " +
        "created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, FALSE, ?, ?)";

    private static final String UPDATE_SQL =
        "UPDATE warehouse_syncs SET status = ?, sync_interval = ?, last_sync_time = ?, next_sync_time = ?, " +
        "rows_synced = ?, synced_through = ?, last_error = ?, config = ?, updated_at = ? WHERE id = ?";

    private static final String SELECT_BY_ID_SQL =
        "SELECT * FROM warehouse_syncs WHERE id = ?";

    private static final String SELECT_BY_PUBLISHER_SQL =
        "SELECT * FROM warehouse_syncs WHERE publisher_id = ? ORDER BY created_at DESC";

    private static final String SELECT_DUE_SQL =
        "SELECT * FROM warehouse_syncs WHERE status <> 'paused' " +
        "AND (running = FALSE OR lock_acquired_at IS NULL OR lock_acquired_at < ?) " +
        "AND next_sync_time <= ? ORDER BY next_sync_time";

    private static final String ACQUIRE_SQL =
        "UPDATE warehouse_syncs SET running = TRUE, lock_acquired_at = ?, updated_at = ? WHERE id = ? " +
        "AND (running = FALSE OR lock_acquired_at IS NULL OR lock_acquired_at < ?)";

    private static final String RELEASE_SQL =
        "UPDATE warehouse_syncs SET running = FALSE, lock_acquired_at = NULL, updated_at = ? WHERE id = ?";

    private static final RowMapper<WarehouseSyncEntity> ROW_MAPPER = new WarehouseSyncRowMapper();

    @Override
    public WarehouseSyncEntity create(WarehouseSyncEntity entity) {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(now);
        }
        entity.setUpdatedAt(now);
        entity.setRunning(false);
        jdbcTemplate.update(INSERT_SQL,
            entity.getId(),
            entity.getPublisherId(),
            entity.getWarehouseType(),
            entity.getStatus(),
            entity.getSyncInterval(),
            toTimestamp(entity.getLastSyncTime()),
            toTimestamp(entity.getNextSyncTime()),
            entity.getRowsSynced(),
            toDate(entity.getSyncedThrough()),
            entity.getLastError(),
            entity.getConfig(),
            toTimestamp(entity.getCreatedAt()),
            toTimestamp(entity.getUpdatedAt())
        );
        log.debug("插入同步配置: id={}, publisherId={}, warehouseType={}",
            entity.getId(), entity.getPublisherId(), entity.getWarehouseType());
        return entity;
    }

    @Override
    public boolean update(WarehouseSyncEntity entity) {
        entity.setUpdatedAt(LocalDateTime.now(ZoneOffset.UTC));
        int rows = jdbcTemplate.update(UPDATE_SQL,
            entity.getStatus(),
            entity.getSyncInterval(),
            toTimestamp(entity.getLastSyncTime()),
            toTimestamp(entity.getNextSyncTime()),
            entity.getRowsSynced(),
            toDate(entity.getSyncedThrough()),
            entity.getLastError(),
            entity.getConfig(),
            toTimestamp(entity.getUpdatedAt()),
            entity.getId()
        );
        if (rows == 0) {
            log.warn("更新同步配置失败，记录不存在: id={}", entity.getId());
            return false;
        }
        return true;
    }

    @Override
    public Optional<WarehouseSyncEntity> findById(String id) {
        List<WarehouseSyncEntity> results = jdbcTemplate.query(SELECT_BY_ID_SQL, ROW_MAPPER, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WarehouseSyncEntity> findByPublisherId(String publisherId) {
        return jdbcTemplate.query(SELECT_BY_PUBLISHER_SQL, ROW_MAPPER, publisherId);
    }

    @Override
    public List<WarehouseSyncEntity> findDue(LocalDateTime now, LocalDateTime staleBefore) {
        return jdbcTemplate.query(SELECT_DUE_SQL, ROW_MAPPER, toTimestamp(staleBefore), toTimestamp(now));
    }

    @Override
    public boolean tryAcquire(String id, LocalDateTime now, LocalDateTime staleBefore) {
        int rows = jdbcTemplate.update(ACQUIRE_SQL, toTimestamp(now), toTimestamp(now), id, toTimestamp(staleBefore));
        if (rows == 1) {
            log.debug("获取同步执行锁: id={}, acquiredAt={}", id, now);
        }
        return rows == 1;
    }

    @Override
    public void release(String id) {
        jdbcTemplate.update(RELEASE_SQL, toTimestamp(LocalDateTime.now(ZoneOffset.UTC)), id);
    }

    /**
     * RowMapper实现
     */
    private static class WarehouseSyncRowMapper implements RowMapper<WarehouseSyncEntity> {
        @Override
        public WarehouseSyncEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            WarehouseSyncEntity entity = new WarehouseSyncEntity();
            entity.setId(rs.getString("id"));
            entity.setPublisherId(rs.getString("publisher_id"));
            entity.setWarehouseType(rs.getString("warehouse_type"));
            entity.setStatus(rs.getString("status"));
            entity.setSyncInterval(rs.getInt("sync_interval"));
            entity.setLastSyncTime(toLocalDateTime(rs.getTimestamp("last_sync_time")));
            entity.setNextSyncTime(toLocalDateTime(rs.getTimestamp("next_sync_time")));
            entity.setRowsSynced(rs.getLong("rows_synced"));
            Date syncedThrough = rs.getDate("synced_through");
            entity.setSyncedThrough(syncedThrough != null ? syncedThrough.toLocalDate() : null);
            entity.setLastError(rs.getString("last_error"));
            entity.setConfig(rs.getString("config"));
            entity.setRunning(rs.getBoolean("running"));
            entity.setLockAcquiredAt(toLocalDateTime(rs.getTimestamp("lock_acquired_at")));
            entity.setCreatedAt(toLocalDateTime(rs.getTimestamp("created_at")));
            entity.setUpdatedAt(toLocalDateTime(rs.getTimestamp("updated_at")));
            return entity;
        }
    }

    private static Timestamp toTimestamp(LocalDateTime dateTime) {
        return dateTime != null ? Timestamp.valueOf(dateTime) : null;
    }

    private static Date toDate(LocalDate date) {
        return date != null ? Date.valueOf(date) : null;
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }
}
