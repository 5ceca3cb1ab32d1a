package com.rivalapex.adexport.server.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 一行导出数据，列按查询投影顺序排列，值可以为 null。
 */
public final class ExportRow {

    private final Map<String, Object> values;

    public ExportRow(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * 以 列名, 值, 列名, 值 ... 的形式构造。
     */
    public static ExportRow of(Object... columnsAndValues) {
        if (columnsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("列名与值必须成对出现");
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            values.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
        }
        return new ExportRow(values);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public Object get(String column) {
        return values.get(column);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
