package com.rivalapex.adexport.server.schema;

import com.rivalapex.adexport.server.exception.EncodingException;
import com.rivalapex.adexport.server.source.ExportRow;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 某一数据类型的固定列结构，在写出前声明，不从数据推断。
 */
public final class ExportSchema {

    private final String name;

    private final List<ExportColumn> columns;

    private ExportSchema(String name, List<ExportColumn> columns) {
        this.name = name;
        this.columns = Collections.unmodifiableList(columns);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public List<ExportColumn> getColumns() {
        return columns;
    }

    /**
     * 校验一行是否符合结构：不允许未声明的列，已声明列的值类型必须匹配。
     *
     * @param rowNumber 从 1 开始的行号，用于错误信息
     */
    public void validate(ExportRow row, long rowNumber) {
        for (String column : row.columns()) {
            if (find(column) == null) {
                throw new EncodingException("Row " + rowNumber + " has column '" + column
                    + "' not declared in schema " + name);
            }
        }
        for (ExportColumn column : columns) {
            Object value = row.get(column.getName());
            if (!column.getType().accepts(value)) {
                throw new EncodingException("Row " + rowNumber + " column '" + column.getName() + "' expected "
                    + column.getType() + " but got " + value.getClass().getSimpleName());
            }
        }
    }

    private ExportColumn find(String columnName) {
        for (ExportColumn column : columns) {
            if (column.getName().equals(columnName)) {
                return column;
            }
        }
        return null;
    }

    public static final class Builder {

        private final String name;
        private final List<ExportColumn> columns = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder string(String column) {
            return column(column, ColumnType.STRING);
        }

        public Builder int64(String column) {
            return column(column, ColumnType.INT64);
        }

        public Builder float64(String column) {
            return column(column, ColumnType.DOUBLE);
        }

        public Builder bool(String column) {
            return column(column, ColumnType.BOOLEAN);
        }

        public Builder timestamp(String column) {
            return column(column, ColumnType.TIMESTAMP);
        }

        public Builder column(String column, ColumnType type) {
            columns.add(new ExportColumn(column, type));
            return this;
        }

        public ExportSchema build() {
            return new ExportSchema(name, new ArrayList<>(columns));
        }
    }
}
