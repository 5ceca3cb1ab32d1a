package com.rivalapex.adexport.server.schema;

import com.rivalapex.adexport.server.constants.DataType;
import java.util.EnumMap;
import java.util.Map;

/**
 * 各数据类型的导出结构，与分析库查询的列别名保持一致。
 */
public final class ExportSchemas {

    private static final Map<DataType, ExportSchema> SCHEMAS = new EnumMap<>(DataType.class);

    static {
        SCHEMAS.put(DataType.IMPRESSIONS, ExportSchema.builder("impressions")
            .string("date")
            .string("publisher_id")
            .string("app_id")
            .string("adapter_name")
            .string("ad_format")
            .string("country")
            .int64("impressions")
            .float64("revenue")
            .float64("avg_latency")
            .build());

        SCHEMAS.put(DataType.REVENUE, ExportSchema.builder("revenue")
            .string("date")
            .string("publisher_id")
            .string("app_id")
            .string("adapter_name")
            .string("ad_format")
            .string("country")
            .float64("revenue")
            .int64("impressions")
            .float64("ecpm")
            .build());

        SCHEMAS.put(DataType.FRAUD_EVENTS, ExportSchema.builder("fraud_events")
            .string("date")
            .string("publisher_id")
            .string("fraud_type")
            .string("risk_level")
            .int64("events")
            .float64("blocked_revenue")
            .build());

        SCHEMAS.put(DataType.TELEMETRY, ExportSchema.builder("telemetry")
            .string("date")
            .string("publisher_id")
            .string("app_id")
            .string("sdk_version")
            .string("os")
            .string("device_type")
            .int64("sessions")
            .float64("avg_session_duration")
            .int64("anr_count")
            .int64("crash_count")
            .build());

        SCHEMAS.put(DataType.ALL, ExportSchema.builder("all")
            .string("id")
            .string("event_id")
            .timestamp("observed_at")
            .string("publisher_id")
            .string("app_id")
            .string("placement_id")
            .string("adapter_id")
            .string("adapter_name")
            .string("ad_unit_id")
            .string("ad_format")
            .string("country_code")
            .string("device_type")
            .string("os")
            .string("os_version")
            .string("session_id")
            .string("user_id")
            .string("request_id")
            .string("status")
            .bool("filled")
            .bool("viewable")
            .bool("measurable")
            .int64("view_duration_ms")
            .int64("latency_ms")
            .float64("revenue_usd")
            .bool("is_test_mode")
            .string("meta_json")
            .timestamp("created_at")
            .build());
    }

    private ExportSchemas() {
    }

    public static ExportSchema forDataType(DataType dataType) {
        ExportSchema schema = SCHEMAS.get(dataType);
        if (schema == null) {
            throw new IllegalArgumentException("未声明导出结构: " + dataType);
        }
        return schema;
    }
}
