package com.rivalapex.adexport.web.controller;

import static com.rivalapex.adexport.web.controller.ExportJobController.PUBLISHER_HEADER;

import com.rivalapex.adexport.dao.WarehouseSyncEntity;
import com.rivalapex.adexport.server.exception.NotFoundException;
import com.rivalapex.adexport.server.service.WarehouseSyncService;
import com.rivalapex.adexport.web.ApiResponses;
import com.rivalapex.adexport.web.TenantAccessException;
import com.rivalapex.adexport.web.dto.ScheduleWarehouseSyncRequest;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 数仓同步 API。
 */
@RestController
@RequestMapping("/api/warehouse/sync")
@RequiredArgsConstructor
public class WarehouseSyncController {

    private final WarehouseSyncService warehouseSyncService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> schedule(@RequestHeader(PUBLISHER_HEADER) String publisherId,
                                                        @RequestBody ScheduleWarehouseSyncRequest request) {
        WarehouseSyncEntity sync = warehouseSyncService.scheduleWarehouseSync(publisherId,
            request.getWarehouseType(), request.getSyncInterval(), request.getConfig());
        return ApiResponses.created(sync, ApiResponses.meta(
            "message", "Warehouse sync scheduled to run every " + sync.getSyncInterval() + " hour(s)",
            "nextSync", sync.getNextSyncTime()));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> list(@RequestHeader(PUBLISHER_HEADER) String publisherId) {
        List<WarehouseSyncEntity> syncs = warehouseSyncService.listWarehouseSyncs(publisherId);
        return ApiResponses.ok(syncs, ApiResponses.meta("count", syncs.size()));
    }

    @GetMapping("/{syncId}")
    public ResponseEntity<Map<String, Object>> get(@RequestHeader(PUBLISHER_HEADER) String publisherId,
                                                   @PathVariable String syncId) {
        return ApiResponses.ok(loadOwned(publisherId, syncId));
    }

    /**
     * 手动执行一次同步；同一同步正在执行时返回 409。
     */
    @PostMapping("/{syncId}/execute")
    public ResponseEntity<Map<String, Object>> execute(@RequestHeader(PUBLISHER_HEADER) String publisherId,
                                                       @PathVariable String syncId) {
        loadOwned(publisherId, syncId);
        WarehouseSyncEntity sync = warehouseSyncService.executeWarehouseSync(syncId);
        return ApiResponses.ok(sync, ApiResponses.meta(
            "message", "Warehouse sync executed successfully",
            "nextSync", sync.getNextSyncTime()));
    }

    @PostMapping("/{syncId}/pause")
    public ResponseEntity<Map<String, Object>> pause(@RequestHeader(PUBLISHER_HEADER) String publisherId,
                                                     @PathVariable String syncId) {
        loadOwned(publisherId, syncId);
        return ApiResponses.ok(warehouseSyncService.pauseWarehouseSync(syncId));
    }

    @PostMapping("/{syncId}/resume")
    public ResponseEntity<Map<String, Object>> resume(@RequestHeader(PUBLISHER_HEADER) String publisherId,
                                                      @PathVariable String syncId) {
        loadOwned(publisherId, syncId);
        return ApiResponses.ok(warehouseSyncService.resumeWarehouseSync(syncId));
    }

    private WarehouseSyncEntity loadOwned(String publisherId, String syncId) {
        WarehouseSyncEntity sync = warehouseSyncService.getWarehouseSync(syncId)
            .orElseThrow(() -> new NotFoundException("Warehouse sync " + syncId + " not found"));
        if (!sync.getPublisherId().equals(publisherId)) {
            throw new TenantAccessException("publisher " + publisherId + " -> sync " + syncId);
        }
        return sync;
    }
}
