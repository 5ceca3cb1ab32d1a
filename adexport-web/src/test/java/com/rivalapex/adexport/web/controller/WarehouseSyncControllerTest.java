package com.rivalapex.adexport.web.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.rivalapex.adexport.dao.WarehouseSyncEntity;
import com.rivalapex.adexport.server.dto.WarehouseSyncConfig;
import com.rivalapex.adexport.server.exception.ExportValidationException;
import com.rivalapex.adexport.server.exception.SyncInProgressException;
import com.rivalapex.adexport.server.service.WarehouseSyncService;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = WarehouseSyncController.class)
class WarehouseSyncControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WarehouseSyncService warehouseSyncService;

    @Test
    void schedule_returns201WithNextSync() throws Exception {
        WarehouseSyncEntity sync = sync("sync-1", "pub-1", "active");
        sync.setSyncInterval(6);
        sync.setNextSyncTime(LocalDateTime.of(2024, 3, 1, 12, 0));
        when(warehouseSyncService.scheduleWarehouseSync(eq("pub-1"), eq("bigquery"), eq(6),
            any(WarehouseSyncConfig.class))).thenReturn(sync);

        mockMvc.perform(post("/api/warehouse/sync")
                .header("X-Publisher-Id", "pub-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"warehouseType\":\"bigquery\",\"syncInterval\":6,"
                    + "\"config\":{\"dataset\":\"ads\",\"table\":\"impressions\"}}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.id").value("sync-1"))
            .andExpect(jsonPath("$.meta.message").value("Warehouse sync scheduled to run every 6 hour(s)"))
            .andExpect(jsonPath("$.meta.nextSync").value("2024-03-01T12:00:00"));
    }

    @Test
    void schedule_intervalOutOfRange_returns400() throws Exception {
        when(warehouseSyncService.scheduleWarehouseSync(anyString(), anyString(), eq(200), any()))
            .thenThrow(new ExportValidationException("syncInterval must be between 1 and 168 hours"));

        mockMvc.perform(post("/api/warehouse/sync")
                .header("X-Publisher-Id", "pub-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"warehouseType\":\"redshift\",\"syncInterval\":200}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("syncInterval must be between 1 and 168 hours"));
    }

    @Test
    void list_returnsTenantSyncs() throws Exception {
        when(warehouseSyncService.listWarehouseSyncs("pub-1"))
            .thenReturn(Collections.singletonList(sync("sync-1", "pub-1", "active")));

        mockMvc.perform(get("/api/warehouse/sync").header("X-Publisher-Id", "pub-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].warehouseType").value("bigquery"))
            .andExpect(jsonPath("$.meta.count").value(1));
    }

    @Test
    void execute_returnsRunResult() throws Exception {
        WarehouseSyncEntity sync = sync("sync-1", "pub-1", "active");
        when(warehouseSyncService.getWarehouseSync("sync-1")).thenReturn(Optional.of(sync));
        WarehouseSyncEntity ran = sync("sync-1", "pub-1", "active");
        ran.setRowsSynced(42);
        when(warehouseSyncService.executeWarehouseSync("sync-1")).thenReturn(ran);

        mockMvc.perform(post("/api/warehouse/sync/sync-1/execute").header("X-Publisher-Id", "pub-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.rowsSynced").value(42))
            .andExpect(jsonPath("$.meta.message").value("Warehouse sync executed successfully"));
    }

    @Test
    void execute_alreadyRunning_returns409() throws Exception {
        when(warehouseSyncService.getWarehouseSync("sync-1"))
            .thenReturn(Optional.of(sync("sync-1", "pub-1", "active")));
        when(warehouseSyncService.executeWarehouseSync("sync-1"))
            .thenThrow(new SyncInProgressException("Warehouse sync sync-1 is already running"));

        mockMvc.perform(post("/api/warehouse/sync/sync-1/execute").header("X-Publisher-Id", "pub-1"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void execute_otherTenant_returns403WithoutRunning() throws Exception {
        when(warehouseSyncService.getWarehouseSync("sync-1"))
            .thenReturn(Optional.of(sync("sync-1", "pub-2", "active")));

        mockMvc.perform(post("/api/warehouse/sync/sync-1/execute").header("X-Publisher-Id", "pub-1"))
            .andExpect(status().isForbidden());
        verify(warehouseSyncService, never()).executeWarehouseSync(anyString());
    }

    @Test
    void get_unknownSync_returns404() throws Exception {
        when(warehouseSyncService.getWarehouseSync("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/warehouse/sync/nope").header("X-Publisher-Id", "pub-1"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Warehouse sync nope not found"));
    }

    @Test
    void pauseAndResume_returnUpdatedStatus() throws Exception {
        when(warehouseSyncService.getWarehouseSync("sync-1"))
            .thenReturn(Optional.of(sync("sync-1", "pub-1", "active")));
        when(warehouseSyncService.pauseWarehouseSync("sync-1")).thenReturn(sync("sync-1", "pub-1", "paused"));
        when(warehouseSyncService.resumeWarehouseSync("sync-1")).thenReturn(sync("sync-1", "pub-1", "active"));

        mockMvc.perform(post("/api/warehouse/sync/sync-1/pause").header("X-Publisher-Id", "pub-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("paused"));
        mockMvc.perform(post("/api/warehouse/sync/sync-1/resume").header("X-Publisher-Id", "pub-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("active"));
    }

    private static WarehouseSyncEntity sync(String id, String publisherId, String status) {
        WarehouseSyncEntity sync = new WarehouseSyncEntity();
        sync.setId(id);
        sync.setPublisherId(publisherId);
        sync.setWarehouseType("bigquery");
        sync.setStatus(status);
        sync.setSyncInterval(24);
        return sync;
    }
}
