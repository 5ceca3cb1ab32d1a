package com.rivalapex.adexport.server.schema;

import java.math.BigInteger;
import java.time.Instant;

/**
 * 导出列的逻辑类型。
 */
public enum ColumnType {

    STRING,
    INT64,
    DOUBLE,
    BOOLEAN,
    /**
     * 毫秒精度 UTC 时间戳。
     */
    TIMESTAMP;

    /**
     * 值是否可以按该类型写出，null 总是允许（所有列均为 optional）。
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        switch (this) {
            case STRING:
                return value instanceof CharSequence;
            case INT64:
                return value instanceof Long || value instanceof Integer || value instanceof Short
                    || value instanceof Byte || value instanceof BigInteger;
            case DOUBLE:
                return value instanceof Number;
            case BOOLEAN:
                return value instanceof Boolean;
            case TIMESTAMP:
                return value instanceof Instant;
            default:
                return false;
        }
    }
}
