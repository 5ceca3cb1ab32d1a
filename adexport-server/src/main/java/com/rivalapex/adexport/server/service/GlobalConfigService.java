package com.rivalapex.adexport.server.service;

import com.rivalapex.adexport.manager.filesystem.FileSystemManager;
import com.rivalapex.adexport.server.dto.GlobalConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import javax.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

/**
 * 加载 global.yaml，叠加环境变量覆盖项，并在启动时创建导出目录。
 *
 * 环境变量：EXPORT_DIR、DATA_EXPORT_STREAM_BATCH_SIZE、DATA_EXPORT_MAX_ROWS。
 */
@Slf4j
@Service
public class GlobalConfigService {

    private final YamlConfigLoader yamlConfigLoader;
    private final ResourceLoader resourceLoader;
    private final FileSystemManager fileSystemManager;

    @Value("${adexport.conf.global:classpath:conf/global.yaml}")
    private String globalConfigLocation;

    @Value("${EXPORT_DIR:}")
    private String exportDirOverride;

    @Value("${DATA_EXPORT_STREAM_BATCH_SIZE:}")
    private String batchSizeOverride;

    @Value("${DATA_EXPORT_MAX_ROWS:}")
    private String maxRowsOverride;

    private volatile GlobalConfig globalConfig;

    public GlobalConfigService(YamlConfigLoader yamlConfigLoader, ResourceLoader resourceLoader,
                               FileSystemManager fileSystemManager) {
        this.yamlConfigLoader = yamlConfigLoader;
        this.resourceLoader = resourceLoader;
        this.fileSystemManager = fileSystemManager;
    }

    @PostConstruct
    public void init() throws IOException {
        GlobalConfig loaded = load();
        Path exportDir = Paths.get(loaded.getExport().getExportDir());
        fileSystemManager.ensureDirectory(exportDir);
        this.globalConfig = loaded;
        log.info("全局配置加载完成: exportDir={}, batchSize={}, maxRawRows={}, maxExportJobs={}",
            exportDir, loaded.getExport().getStreamBatchSize(), loaded.getExport().getMaxRawRows(),
            loaded.getConcurrency().getMaxExportJobs());
    }

    public GlobalConfig getGlobalConfig() {
        GlobalConfig current = globalConfig;
        if (current == null) {
            throw new IllegalStateException("全局配置尚未加载");
        }
        return current;
    }

    GlobalConfig load() throws IOException {
        GlobalConfig config;
        Resource resource = resourceLoader.getResource(globalConfigLocation);
        if (resource.exists()) {
            config = yamlConfigLoader.loadGlobalConfig(resource);
            log.info("读取全局配置: {}", globalConfigLocation);
        } else {
            log.warn("全局配置不存在，使用默认值: {}", globalConfigLocation);
            config = new GlobalConfig();
        }
        config.applyDefaults();
        applyOverrides(config);
        return config;
    }

    private void applyOverrides(GlobalConfig config) {
        if (!isBlank(exportDirOverride)) {
            config.getExport().setExportDir(exportDirOverride.trim());
        }
        if (!isBlank(batchSizeOverride)) {
            config.getExport().setStreamBatchSize(parsePositiveInt("DATA_EXPORT_STREAM_BATCH_SIZE",
                batchSizeOverride, config.getExport().getStreamBatchSize()));
        }
        if (!isBlank(maxRowsOverride)) {
            config.getExport().setMaxRawRows((long) parsePositiveInt("DATA_EXPORT_MAX_ROWS",
                maxRowsOverride, config.getExport().getMaxRawRows().intValue()));
        }
    }

    private int parsePositiveInt(String name, String raw, int fallback) {
        try {
            int value = Integer.parseInt(raw.trim());
            if (value > 0) {
                return value;
            }
        } catch (NumberFormatException e) {
            log.warn("环境变量 {} 不是整数: {}", name, raw);
            return fallback;
        }
        log.warn("环境变量 {} 必须为正数: {}", name, raw);
        return fallback;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
