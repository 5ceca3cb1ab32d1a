package com.rivalapex.adexport.manager.warehouse;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 数仓加载作业抽象：把本地文件作为一次 load job 追加到目标表。
 */
public interface WarehouseLoadManager {

    /**
     * @return 加载行数，数仓未返回统计时为 -1
     */
    long load(String dataset, String table, Path file, LoadSourceFormat format) throws IOException;
}
