package com.rivalapex.adexport.server.source;

import com.rivalapex.adexport.server.constants.DataType;

/**
 * 各数据类型的聚合查询。参数依次为 publisher_id、起始时间（含）、结束时间（不含）。
 * 列别名与 ExportSchemas 中声明的列一一对应。
 */
final class AnalyticsQueries {

    static final String IMPRESSIONS_SQL =
        "SELECT to_char(date_trunc('day', observed_at), 'YYYY-MM-DD') AS date, " +
        "publisher_id, " +
        "COALESCE(app_id, '') AS app_id, " +
        "COALESCE(adapter_name, '') AS adapter_name, " +
        "COALESCE(ad_format, '') AS ad_format, " +
        "COALESCE(country_code, 'ZZ') AS country, " +
        "COUNT(*) AS impressions, " +
        "COALESCE(SUM(revenue_usd), 0)::double precision AS revenue, " +
        "COALESCE(AVG(latency_ms), 0)::double precision AS avg_latency " +
        "FROM analytics_impressions " +
        "WHERE publisher_id = ? AND observed_at >= ? AND observed_at < ? " +
        "GROUP BY 1, 2, 3, 4, 5, 6 " +
        "ORDER BY date ASC, impressions DESC";

    static final String REVENUE_SQL =
        "SELECT to_char(date_trunc('day', observed_at), 'YYYY-MM-DD') AS date, " +
        "publisher_id, " +
        "COALESCE(app_id, '') AS app_id, " +
        "COALESCE(adapter_name, '') AS adapter_name, " +
        "COALESCE(ad_format, '') AS ad_format, " +
        "COALESCE(country_code, 'ZZ') AS country, " +
        "COALESCE(SUM(revenue_usd), 0)::double precision AS revenue, " +
        "COUNT(DISTINCT impression_id) AS impressions, " +
        "CASE WHEN COUNT(DISTINCT impression_id) > 0 " +
        "THEN (COALESCE(SUM(revenue_usd), 0) / COUNT(DISTINCT impression_id) * 1000)::double precision " +
        "ELSE 0 END AS ecpm " +
        "FROM analytics_revenue_events " +
        "WHERE publisher_id = ? AND observed_at >= ? AND observed_at < ? " +
        "GROUP BY 1, 2, 3, 4, 5, 6 " +
        "ORDER BY date ASC, revenue DESC";

    static final String FRAUD_EVENTS_SQL =
        "SELECT to_char(date_trunc('day', observed_at), 'YYYY-MM-DD') AS date, " +
        "publisher_id, " +
        "COALESCE(fraud_type, 'unknown') AS fraud_type, " +
        "COALESCE(details->>'risk_level', CASE WHEN blocked THEN 'blocked' ELSE 'info' END) AS risk_level, " +
        "COUNT(*) AS events, " +
        "(COALESCE(SUM(revenue_blocked_cents), 0) / 100.0)::double precision AS blocked_revenue " +
        "FROM analytics_fraud_events " +
        "WHERE publisher_id = ? AND observed_at >= ? AND observed_at < ? " +
        "GROUP BY 1, 2, 3, 4 " +
        "ORDER BY date ASC, events DESC";

    static final String TELEMETRY_SQL =
        "SELECT to_char(date_trunc('day', observed_at), 'YYYY-MM-DD') AS date, " +
        "publisher_id, " +
        "COALESCE(payload->>'app_id', payload->>'application_id', '') AS app_id, " +
        "COALESCE(payload->>'sdk_version', payload->>'sdkVersion', '') AS sdk_version, " +
        "COALESCE(payload->>'os', payload->>'platform', '') AS os, " +
        "COALESCE(payload->>'device_type', payload->>'deviceType', 'unknown') AS device_type, " +
        "COUNT(DISTINCT NULLIF(payload->>'session_id', '')) AS sessions, " +
        "COALESCE(AVG(CASE " +
        "WHEN (payload->>'session_duration_ms') ~ '^[0-9]+$' " +
        "THEN (payload->>'session_duration_ms')::numeric / 1000 " +
        "WHEN (payload->>'session_duration_sec') ~ '^[0-9]+(\\.[0-9]+)?$' " +
        "THEN (payload->>'session_duration_sec')::numeric " +
        "ELSE NULL END), 0)::double precision AS avg_session_duration, " +
        "SUM(CASE WHEN event_type = 'anr' THEN 1 ELSE 0 END) AS anr_count, " +
        "SUM(CASE WHEN event_type = 'crash' THEN 1 ELSE 0 END) AS crash_count " +
        "FROM analytics_sdk_telemetry " +
        "WHERE publisher_id = ? AND observed_at >= ? AND observed_at < ? " +
        "GROUP BY 1, 2, 3, 4, 5, 6 " +
        "ORDER BY date ASC, sessions DESC";

    static final String ALL_SQL =
        "SELECT id::text AS id, event_id::text AS event_id, observed_at, publisher_id, " +
        "COALESCE(app_id, '') AS app_id, COALESCE(placement_id, '') AS placement_id, " +
        "COALESCE(adapter_id, '') AS adapter_id, COALESCE(adapter_name, '') AS adapter_name, " +
        "COALESCE(ad_unit_id, '') AS ad_unit_id, COALESCE(ad_format, '') AS ad_format, " +
        "COALESCE(country_code, 'ZZ') AS country_code, COALESCE(device_type, 'unknown') AS device_type, " +
        "COALESCE(os, 'unknown') AS os, COALESCE(os_version, '') AS os_version, " +
        "COALESCE(session_id, '') AS session_id, COALESCE(user_id, '') AS user_id, " +
        "COALESCE(request_id, '') AS request_id, COALESCE(status, '') AS status, " +
        "filled, viewable, measurable, view_duration_ms, latency_ms, " +
        "COALESCE(revenue_usd, 0)::double precision AS revenue_usd, is_test_mode, " +
        "COALESCE(meta::text, '{}') AS meta_json, created_at " +
        "FROM analytics_impressions " +
        "WHERE publisher_id = ? AND observed_at >= ? AND observed_at < ? " +
        "ORDER BY observed_at";

    private AnalyticsQueries() {
    }

    static String sqlFor(DataType dataType) {
        switch (dataType) {
            case IMPRESSIONS:
                return IMPRESSIONS_SQL;
            case REVENUE:
                return REVENUE_SQL;
            case FRAUD_EVENTS:
                return FRAUD_EVENTS_SQL;
            case TELEMETRY:
                return TELEMETRY_SQL;
            case ALL:
                return ALL_SQL;
            default:
                throw new IllegalArgumentException("未知的数据类型: " + dataType);
        }
    }
}
