package com.rivalapex.adexport.server.plugin.destination;

import com.rivalapex.adexport.manager.plugin.DestinationPlugin;
import com.rivalapex.adexport.server.constants.DestinationType;
import com.rivalapex.adexport.server.dto.ExportExecutionContext;
import org.springframework.stereotype.Component;

/**
 * 本地目的地：文件留在导出目录，位置即文件绝对路径，可通过下载接口获取。
 */
@Component
public class LocalDestinationPlugin implements DestinationPlugin {

    @Override
    public boolean supports(Object context) {
        return context instanceof ExportExecutionContext
            && ((ExportExecutionContext) context).getDestinationType() == DestinationType.LOCAL;
    }

    @Override
    public String upload(Object context) {
        ExportExecutionContext ctx = (ExportExecutionContext) context;
        return ctx.getGeneratedFile().getPath().toAbsolutePath().toString();
    }

    @Override
    public boolean isRemote() {
        return false;
    }
}
