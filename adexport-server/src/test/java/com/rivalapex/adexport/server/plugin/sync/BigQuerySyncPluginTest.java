package com.rivalapex.adexport.server.plugin.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rivalapex.adexport.server.constants.DataType;
import com.rivalapex.adexport.server.constants.DestinationType;
import com.rivalapex.adexport.server.constants.ExportFormat;
import com.rivalapex.adexport.server.constants.WarehouseType;
import com.rivalapex.adexport.server.dto.ExportExecutionContext;
import com.rivalapex.adexport.server.dto.ExportResult;
import com.rivalapex.adexport.server.dto.WarehouseSyncConfig;
import com.rivalapex.adexport.server.dto.WarehouseSyncContext;
import com.rivalapex.adexport.server.exception.ExportValidationException;
import com.rivalapex.adexport.server.service.ExportExecutor;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BigQuerySyncPluginTest {

    @Mock
    private ExportExecutor exportExecutor;

    private WarehouseSyncContext context(String dataset, String table) {
        WarehouseSyncConfig config = new WarehouseSyncConfig();
        config.setDataset(dataset);
        config.setTable(table);
        return new WarehouseSyncContext("sync-1", "pub-1", WarehouseType.BIGQUERY, DataType.IMPRESSIONS,
            LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 2), config, null);
    }

    @Test
    void sync_loadsNewlineDelimitedJson() {
        BigQuerySyncPlugin plugin = new BigQuerySyncPlugin(exportExecutor);
        when(exportExecutor.execute(any())).thenReturn(new ExportResult(12, 300, "bigquery://analytics.daily"));

        assertThat(plugin.sync(context("analytics", "daily"))).isEqualTo(12);

        ArgumentCaptor<ExportExecutionContext> captor = ArgumentCaptor.forClass(ExportExecutionContext.class);
        verify(exportExecutor).execute(captor.capture());
        assertThat(captor.getValue().getFormat()).isEqualTo(ExportFormat.JSON);
        assertThat(captor.getValue().isNewlineDelimitedJson()).isTrue();
        assertThat(captor.getValue().getDestinationType()).isEqualTo(DestinationType.BIGQUERY);
        assertThat(captor.getValue().getDestination().getTable()).isEqualTo("daily");
    }

    @Test
    void sync_withoutTable_isRejected() {
        BigQuerySyncPlugin plugin = new BigQuerySyncPlugin(exportExecutor);

        assertThatThrownBy(() -> plugin.sync(context("analytics", null)))
            .isInstanceOf(ExportValidationException.class);
    }
}
