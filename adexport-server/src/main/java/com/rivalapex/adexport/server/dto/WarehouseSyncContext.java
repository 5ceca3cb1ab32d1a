package com.rivalapex.adexport.server.dto;

import com.rivalapex.adexport.server.constants.DataType;
import com.rivalapex.adexport.server.constants.WarehouseType;
import java.time.LocalDate;
import lombok.Value;

/**
 * 单次数仓同步的执行上下文。同步窗口为 [windowStart, windowEnd] 两端包含的日期。
 */
@Value
public class WarehouseSyncContext {

    String syncId;

    String publisherId;

    WarehouseType warehouseType;

    DataType dataType;

    LocalDate windowStart;

    LocalDate windowEnd;

    WarehouseSyncConfig config;

    GlobalConfig globalConfig;
}
