package com.rivalapex.adexport.dao;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * 基于数据库的导出作业仓储实现
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "adexport.persistence.type", havingValue = "database", matchIfMissing = true)
@RequiredArgsConstructor
public class DatabaseExportJobRepository implements ExportJobRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL =
        "INSERT INTO export_jobs (id, publisher_id, data_type, format, compression, destination, status, " +
        "start_date, end_date, rows_exported, file_size, location, error, config, created_at, completed_at) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_SQL =
        "UPDATE export_jobs SET status = ?, rows_exported = ?, file_size = ?, location = ?, " +
        "error = ?, completed_at = ? WHERE id = ?";

    private static final String SELECT_BY_ID_SQL =
        "SELECT * FROM export_jobs WHERE id = ?";

    private static final String SELECT_BY_PUBLISHER_SQL =
        "SELECT * FROM export_jobs WHERE publisher_id = ? ORDER BY created_at DESC LIMIT ?";

    private static final String SELECT_BY_STATUS_SQL =
        "SELECT * FROM export_jobs WHERE status IN (%s) ORDER BY created_at";

    private static final RowMapper<ExportJobEntity> ROW_MAPPER = new ExportJobRowMapper();

    @Override
    public ExportJobEntity create(ExportJobEntity entity) {
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(LocalDateTime.now(ZoneOffset.UTC));
        }
        jdbcTemplate.update(INSERT_SQL,
            entity.getId(),
            entity.getPublisherId(),
            entity.getDataType(),
            entity.getFormat(),
            entity.getCompression(),
            entity.getDestination(),
            entity.getStatus(),
            toDate(entity.getStartDate()),
            toDate(entity.getEndDate()),
            entity.getRowsExported(),
            entity.getFileSize(),
            entity.getLocation(),
            entity.getError(),
            entity.getConfig(),
            toTimestamp(entity.getCreatedAt()),
            toTimestamp(entity.getCompletedAt())
        );
        log.debug("插入导出作业: id={}, publisherId={}, dataType={}",
            entity.getId(), entity.getPublisherId(), entity.getDataType());
        return entity;
    }

    @Override
    public boolean update(ExportJobEntity entity) {
        int rows = jdbcTemplate.update(UPDATE_SQL,
            entity.getStatus(),
            entity.getRowsExported(),
            entity.getFileSize(),
            entity.getLocation(),
            entity.getError(),
            toTimestamp(entity.getCompletedAt()),
            entity.getId()
        );
        if (rows == 0) {
            log.warn("更新导出作业失败，记录不存在: id={}", entity.getId());
            return false;
        }
        log.debug("更新导出作业: id={}, status={}", entity.getId(), entity.getStatus());
        return true;
    }

    @Override
    public Optional<ExportJobEntity> findById(String id) {
        List<ExportJobEntity> results = jdbcTemplate.query(SELECT_BY_ID_SQL, ROW_MAPPER, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<ExportJobEntity> findByPublisherId(String publisherId, int limit) {
        return jdbcTemplate.query(SELECT_BY_PUBLISHER_SQL, ROW_MAPPER, publisherId, limit);
    }

    @Override
    public List<ExportJobEntity> findByStatusIn(Collection<String> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return Collections.emptyList();
        }
        String placeholders = String.join(", ", Collections.nCopies(statuses.size(), "?"));
        return jdbcTemplate.query(String.format(SELECT_BY_STATUS_SQL, placeholders), ROW_MAPPER,
            new ArrayList<>(statuses).toArray());
    }

    /**
     * RowMapper实现
     */
    private static class ExportJobRowMapper implements RowMapper<ExportJobEntity> {
        @Override
        public ExportJobEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            ExportJobEntity entity = new ExportJobEntity();
            entity.setId(rs.getString("id"));
            entity.setPublisherId(rs.getString("publisher_id"));
            entity.setDataType(rs.getString("data_type"));
            entity.setFormat(rs.getString("format"));
            entity.setCompression(rs.getString("compression"));
            entity.setDestination(rs.getString("destination"));
            entity.setStatus(rs.getString("status"));
            entity.setStartDate(toLocalDate(rs.getDate("start_date")));
            entity.setEndDate(toLocalDate(rs.getDate("end_date")));
            entity.setRowsExported(rs.getLong("rows_exported"));
            entity.setFileSize(rs.getLong("file_size"));
            entity.setLocation(rs.getString("location"));
            entity.setError(rs.getString("error"));
            entity.setConfig(rs.getString("config"));
            entity.setCreatedAt(toLocalDateTime(rs.getTimestamp("created_at")));
            entity.setCompletedAt(toLocalDateTime(rs.getTimestamp("completed_at")));
            return entity;
        }
    }

    private static Timestamp toTimestamp(LocalDateTime dateTime) {
        return dateTime != null ? Timestamp.valueOf(dateTime) : null;
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }

    private static Date toDate(LocalDate date) {
        return date != null ? Date.valueOf(date) : null;
    }

    private static LocalDate toLocalDate(Date date) {
        return date != null ? date.toLocalDate() : null;
    }
}
