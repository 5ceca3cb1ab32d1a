package com.rivalapex.adexport.web.dto;

import com.rivalapex.adexport.server.dto.WarehouseSyncConfig;
import lombok.Data;

@Data
public class ScheduleWarehouseSyncRequest {

    private String warehouseType;

    /**
     * 小时，1-168。
     */
    private Integer syncInterval;

    private WarehouseSyncConfig config;
}
