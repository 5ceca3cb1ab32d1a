package com.rivalapex.adexport.manager.plugin;

/**
 * 导出目的地插件接口，本地磁盘、对象存储、数仓加载各自实现上传逻辑。
 *
 * 为避免模块循环依赖，这里不直接依赖 ExportExecutionContext，
 * 而是由实现类自行决定接受的上下文类型（通常在 adexport-server 中实现）。
 */
public interface DestinationPlugin {

    /**
     * 当前插件是否支持上下文中的目的地类型。
     *
     * @param context 运行时上下文对象，一般为 ExportExecutionContext
     */
    boolean supports(Object context);

    /**
     * 交付已生成的导出文件。
     *
     * @param context 运行时上下文对象，一般为 ExportExecutionContext
     * @return 最终位置（本地路径或远端 URI）
     */
    String upload(Object context) throws Exception;

    /**
     * 交付后是否需要删除本地文件。本地目的地返回 false。
     */
    default boolean isRemote() {
        return true;
    }
}
