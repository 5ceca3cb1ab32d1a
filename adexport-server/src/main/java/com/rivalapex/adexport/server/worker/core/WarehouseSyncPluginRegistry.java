package com.rivalapex.adexport.server.worker.core;

import com.rivalapex.adexport.manager.plugin.WarehouseSyncPlugin;
import com.rivalapex.adexport.server.dto.WarehouseSyncContext;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 数仓同步插件注册与选择器。
 */
@Component
@RequiredArgsConstructor
public class WarehouseSyncPluginRegistry {

    private final List<WarehouseSyncPlugin> plugins;

    public WarehouseSyncPlugin select(WarehouseSyncContext context) {
        return plugins.stream()
            .filter(p -> p.supports(context))
            .findFirst()
            .orElse(null);
    }
}
