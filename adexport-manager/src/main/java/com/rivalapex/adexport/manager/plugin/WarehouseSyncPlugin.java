package com.rivalapex.adexport.manager.plugin;

/**
 * 数仓同步插件接口。
 */
public interface WarehouseSyncPlugin {

    boolean supports(Object context);

    /**
     * 执行一次同步。
     *
     * @return 同步行数
     */
    long sync(Object context) throws Exception;
}
