package com.rivalapex.adexport.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rivalapex.adexport.dao.WarehouseSyncEntity;
import com.rivalapex.adexport.server.exception.SyncInProgressException;
import com.rivalapex.adexport.server.service.WarehouseSyncService;
import com.xxl.job.core.context.XxlJobContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WarehouseSyncXxlJobHandlerTest {

    @Mock
    private WarehouseSyncService warehouseSyncService;

    @InjectMocks
    private WarehouseSyncXxlJobHandler handler;

    @AfterEach
    void clearContext() {
        XxlJobContext.setXxlJobContext(null);
    }

    @Test
    void executeSync_missingParam_failsWithoutRunning() {
        XxlJobContext context = contextWithParam("  ");

        handler.executeSync();

        assertThat(context.getHandleCode()).isEqualTo(XxlJobContext.HANDLE_CODE_FAIL);
        verify(warehouseSyncService, never()).executeWarehouseSync(anyString());
    }

    @Test
    void executeSync_successfulRun_keepsSuccessCode() {
        XxlJobContext context = contextWithParam(" sync-1 ");
        when(warehouseSyncService.executeWarehouseSync("sync-1")).thenReturn(sync("active", null));

        handler.executeSync();

        assertThat(context.getHandleCode()).isEqualTo(XxlJobContext.HANDLE_CODE_SUCCESS);
    }

    @Test
    void executeSync_runEndedInError_reportsFailure() {
        XxlJobContext context = contextWithParam("sync-1");
        when(warehouseSyncService.executeWarehouseSync("sync-1"))
            .thenReturn(sync("error", "stagingBucket is required for redshift sync"));

        handler.executeSync();

        assertThat(context.getHandleCode()).isEqualTo(XxlJobContext.HANDLE_CODE_FAIL);
        assertThat(context.getHandleMsg()).contains("stagingBucket is required");
    }

    @Test
    void executeSync_alreadyRunning_isSkipped() {
        XxlJobContext context = contextWithParam("sync-1");
        when(warehouseSyncService.executeWarehouseSync("sync-1"))
            .thenThrow(new SyncInProgressException("Warehouse sync sync-1 is already running"));

        handler.executeSync();

        assertThat(context.getHandleCode()).isEqualTo(XxlJobContext.HANDLE_CODE_SUCCESS);
    }

    @Test
    void executeDueSyncs_delegatesToService() {
        contextWithParam(null);
        when(warehouseSyncService.runDueSyncs()).thenReturn(3);

        handler.executeDueSyncs();

        verify(warehouseSyncService).runDueSyncs();
    }

    private static XxlJobContext contextWithParam(String param) {
        XxlJobContext context = new XxlJobContext(1L, param, null, 0, 1);
        XxlJobContext.setXxlJobContext(context);
        return context;
    }

    private static WarehouseSyncEntity sync(String status, String lastError) {
        WarehouseSyncEntity sync = new WarehouseSyncEntity();
        sync.setId("sync-1");
        sync.setStatus(status);
        sync.setLastError(lastError);
        sync.setRowsSynced(10);
        return sync;
    }
}
