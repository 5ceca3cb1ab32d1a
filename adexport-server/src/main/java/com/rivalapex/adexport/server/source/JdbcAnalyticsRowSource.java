package com.rivalapex.adexport.server.source;

import com.rivalapex.adexport.server.constants.DataType;
import com.rivalapex.adexport.server.dto.GlobalConfig;
import com.rivalapex.adexport.server.exception.RowFetchException;
import com.rivalapex.adexport.server.service.GlobalConfigService;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import javax.annotation.PreDestroy;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 基于 JDBC 游标的分析库行源。
 *
 * 关闭自动提交并设置 fetchSize，PostgreSQL 驱动据此按批拉取，内存占用与批大小成正比。
 * 配置了 analytics.jdbc_url 时使用独立的只读 HikariCP 连接池，否则复用主数据源。
 */
@Slf4j
@Component
public class JdbcAnalyticsRowSource implements RowSource {

    private final DataSource primaryDataSource;
    private final GlobalConfigService globalConfigService;

    private volatile HikariDataSource analyticsDataSource;

    public JdbcAnalyticsRowSource(DataSource primaryDataSource, GlobalConfigService globalConfigService) {
        this.primaryDataSource = primaryDataSource;
        this.globalConfigService = globalConfigService;
    }

    @Override
    public Stream<ExportRow> fetch(DataType dataType, String publisherId, LocalDate startDate, LocalDate endDate) {
        GlobalConfig config = globalConfigService.getGlobalConfig();
        int batchSize = config.getExport().getStreamBatchSize();
        String sql = AnalyticsQueries.sqlFor(dataType);
        // [startDate 00:00 UTC, endDate + 1 天 00:00 UTC)
        OffsetDateTime from = startDate.atStartOfDay().atOffset(ZoneOffset.UTC);
        OffsetDateTime to = endDate.plusDays(1).atStartOfDay().atOffset(ZoneOffset.UTC);

        Connection connection = null;
        PreparedStatement statement = null;
        ResultSet resultSet = null;
        try {
            connection = dataSource(config).getConnection();
            connection.setAutoCommit(false);
            connection.setReadOnly(true);
            statement = connection.prepareStatement(sql, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
            statement.setFetchSize(batchSize);
            if (dataType == DataType.ALL) {
                statement.setLargeMaxRows(config.getExport().getMaxRawRows());
            }
            Integer timeout = config.getAnalytics() != null ? config.getAnalytics().getQueryTimeoutSec() : null;
            if (timeout != null && timeout > 0) {
                statement.setQueryTimeout(timeout);
            }
            statement.setString(1, publisherId);
            statement.setObject(2, from);
            statement.setObject(3, to);
            resultSet = statement.executeQuery();
            log.info("开始流式读取: dataType={}, publisherId={}, range=[{}, {}], fetchSize={}",
                dataType.value(), publisherId, startDate, endDate, batchSize);

            CursorHandle handle = new CursorHandle(connection, statement, resultSet);
            return StreamSupport.stream(new ResultSetSpliterator(resultSet, dataType), false)
                .onClose(handle::close);
        } catch (SQLException e) {
            new CursorHandle(connection, statement, resultSet).close();
            throw new RowFetchException("Query failed for " + dataType.value() + ": " + e.getMessage(), e);
        }
    }

    private DataSource dataSource(GlobalConfig config) {
        GlobalConfig.AnalyticsDatabaseConfig analytics = config.getAnalytics();
        if (analytics == null || analytics.getJdbcUrl() == null || analytics.getJdbcUrl().trim().isEmpty()) {
            return primaryDataSource;
        }
        HikariDataSource current = analyticsDataSource;
        if (current == null) {
            synchronized (this) {
                current = analyticsDataSource;
                if (current == null) {
                    current = createDataSource(analytics, config.getConcurrency().getMaxExportJobs());
                    analyticsDataSource = current;
                }
            }
        }
        return current;
    }

    /**
     * 创建分析库只读连接池
     */
    private HikariDataSource createDataSource(GlobalConfig.AnalyticsDatabaseConfig analytics, int defaultPoolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(analytics.getJdbcUrl());
        hikariConfig.setUsername(analytics.getUsername());
        hikariConfig.setPassword(analytics.getPassword());
        hikariConfig.setPoolName("adexport-analytics");
        hikariConfig.setMaximumPoolSize(analytics.getMaxPoolSize() != null ? analytics.getMaxPoolSize() : defaultPoolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setAutoCommit(false);
        hikariConfig.setReadOnly(true);
        hikariConfig.setConnectionTimeout(30_000);
        log.info("创建分析库连接池: url={}, maxPoolSize={}", analytics.getJdbcUrl(), hikariConfig.getMaximumPoolSize());
        return new HikariDataSource(hikariConfig);
    }

    @PreDestroy
    public void close() {
        if (analyticsDataSource != null) {
            analyticsDataSource.close();
        }
    }

    static Object normalize(Object value) {
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toInstant();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof BigInteger) {
            return ((BigInteger) value).longValue();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).doubleValue();
        }
        if (value == null || value instanceof Number || value instanceof Boolean || value instanceof String
            || value instanceof LocalDate) {
            return value;
        }
        return value.toString();
    }

    /**
     * 逐行推进游标，不预读。
     */
    private static final class ResultSetSpliterator extends Spliterators.AbstractSpliterator<ExportRow> {

        private final ResultSet resultSet;
        private final DataType dataType;
        private String[] labels;

        ResultSetSpliterator(ResultSet resultSet, DataType dataType) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.resultSet = resultSet;
            this.dataType = dataType;
        }

        @Override
        public boolean tryAdvance(Consumer<? super ExportRow> action) {
            try {
                if (!resultSet.next()) {
                    return false;
                }
                if (labels == null) {
                    ResultSetMetaData metaData = resultSet.getMetaData();
                    labels = new String[metaData.getColumnCount()];
                    for (int i = 0; i < labels.length; i++) {
                        labels[i] = metaData.getColumnLabel(i + 1);
                    }
                }
                Map<String, Object> values = new LinkedHashMap<>();
                for (int i = 0; i < labels.length; i++) {
                    values.put(labels[i], normalize(resultSet.getObject(i + 1)));
                }
                action.accept(new ExportRow(values));
                return true;
            } catch (SQLException e) {
                throw new RowFetchException("Reading rows failed for " + dataType.value() + ": " + e.getMessage(), e);
            }
        }
    }

    /**
     * 关闭游标并归还连接。
     */
    private static final class CursorHandle {

        private final Connection connection;
        private final PreparedStatement statement;
        private final ResultSet resultSet;

        CursorHandle(Connection connection, PreparedStatement statement, ResultSet resultSet) {
            this.connection = connection;
            this.statement = statement;
            this.resultSet = resultSet;
        }

        void close() {
            try {
                if (resultSet != null) {
                    resultSet.close();
                }
                if (statement != null) {
                    statement.close();
                }
            } catch (SQLException e) {
                log.warn("关闭游标失败", e);
            }
            if (connection != null) {
                try {
                    connection.rollback();
                    connection.setAutoCommit(true);
                } catch (SQLException e) {
                    log.warn("重置连接状态失败", e);
                }
                try {
                    connection.close();
                } catch (SQLException e) {
                    log.warn("归还连接失败", e);
                }
            }
        }
    }
}
