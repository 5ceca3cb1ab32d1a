package com.rivalapex.adexport.manager.warehouse;

/**
 * 数仓加载作业的源文件格式。
 */
public enum LoadSourceFormat {

    CSV(true),
    NEWLINE_DELIMITED_JSON(true),
    PARQUET(false);

    private final boolean autodetect;

    LoadSourceFormat(boolean autodetect) {
        this.autodetect = autodetect;
    }

    /**
     * 是否需要数仓自动推断表结构（Parquet 自带 schema）。
     */
    public boolean isAutodetect() {
        return autodetect;
    }

    /**
     * 按文件扩展名选择源格式，.gz 后缀会先被剥离。
     *
     * @throws IllegalArgumentException 不支持的扩展名
     */
    public static LoadSourceFormat fromFileName(String fileName) {
        String name = fileName.toLowerCase();
        if (name.endsWith(".gz")) {
            name = name.substring(0, name.length() - 3);
        }
        if (name.endsWith(".csv")) {
            return CSV;
        }
        if (name.endsWith(".json") || name.endsWith(".ndjson")) {
            return NEWLINE_DELIMITED_JSON;
        }
        if (name.endsWith(".parquet")) {
            return PARQUET;
        }
        throw new IllegalArgumentException("不支持的加载文件类型: " + fileName);
    }
}
