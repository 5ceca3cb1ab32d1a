package com.rivalapex.adexport.server.worker.core;

import com.rivalapex.adexport.manager.plugin.DestinationPlugin;
import com.rivalapex.adexport.server.dto.ExportExecutionContext;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 目的地插件注册与选择器。
 */
@Component
@RequiredArgsConstructor
public class DestinationPluginRegistry {

    private final List<DestinationPlugin> plugins;

    public DestinationPlugin select(ExportExecutionContext context) {
        return plugins.stream()
            .filter(p -> p.supports(context))
            .findFirst()
            .orElse(null);
    }
}
