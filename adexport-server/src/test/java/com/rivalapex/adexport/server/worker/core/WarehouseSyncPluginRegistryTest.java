package com.rivalapex.adexport.server.worker.core;

import static org.assertj.core.api.Assertions.assertThat;

import com.rivalapex.adexport.server.constants.DataType;
import com.rivalapex.adexport.server.constants.WarehouseType;
import com.rivalapex.adexport.server.dto.WarehouseSyncConfig;
import com.rivalapex.adexport.server.dto.WarehouseSyncContext;
import com.rivalapex.adexport.server.plugin.sync.BigQuerySyncPlugin;
import com.rivalapex.adexport.server.plugin.sync.StagedSyncPlugin;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;

class WarehouseSyncPluginRegistryTest {

    private final BigQuerySyncPlugin bigQuery = new BigQuerySyncPlugin(null);
    private final StagedSyncPlugin staged = new StagedSyncPlugin(null);

    private WarehouseSyncContext context(WarehouseType type) {
        return new WarehouseSyncContext("sync-1", "pub-1", type, DataType.IMPRESSIONS,
            LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 2), new WarehouseSyncConfig(), null);
    }

    @Test
    void select_routesByWarehouseType() {
        WarehouseSyncPluginRegistry registry = new WarehouseSyncPluginRegistry(Arrays.asList(bigQuery, staged));

        assertThat(registry.select(context(WarehouseType.BIGQUERY))).isSameAs(bigQuery);
        assertThat(registry.select(context(WarehouseType.REDSHIFT))).isSameAs(staged);
        assertThat(registry.select(context(WarehouseType.SNOWFLAKE))).isSameAs(staged);
    }

    @Test
    void select_returnsNullWhenPluginsEmpty() {
        WarehouseSyncPluginRegistry registry = new WarehouseSyncPluginRegistry(Collections.emptyList());
        assertThat(registry.select(context(WarehouseType.BIGQUERY))).isNull();
    }
}
