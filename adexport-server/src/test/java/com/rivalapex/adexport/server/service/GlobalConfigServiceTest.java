package com.rivalapex.adexport.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rivalapex.adexport.manager.filesystem.LocalFileSystemManager;
import com.rivalapex.adexport.server.dto.GlobalConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.test.util.ReflectionTestUtils;

class GlobalConfigServiceTest {

    @TempDir
    Path tempDir;

    private GlobalConfigService service;

    @BeforeEach
    void setUp() {
        service = new GlobalConfigService(new YamlConfigLoader(), new DefaultResourceLoader(),
            new LocalFileSystemManager());
        ReflectionTestUtils.setField(service, "globalConfigLocation", "classpath:conf/test_global.yaml");
        ReflectionTestUtils.setField(service, "exportDirOverride", "");
        ReflectionTestUtils.setField(service, "batchSizeOverride", "");
        ReflectionTestUtils.setField(service, "maxRowsOverride", "");
    }

    @Test
    void getGlobalConfig_beforeInit_throws() {
        assertThatThrownBy(() -> service.getGlobalConfig()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void init_appliesEnvironmentOverridesAndCreatesExportDir() throws IOException {
        Path exportDir = tempDir.resolve("exports");
        ReflectionTestUtils.setField(service, "exportDirOverride", exportDir.toString());
        ReflectionTestUtils.setField(service, "batchSizeOverride", "1000");
        ReflectionTestUtils.setField(service, "maxRowsOverride", "not-a-number");

        service.init();

        GlobalConfig config = service.getGlobalConfig();
        assertThat(config.getExport().getExportDir()).isEqualTo(exportDir.toString());
        assertThat(config.getExport().getStreamBatchSize()).isEqualTo(1000);
        assertThat(config.getExport().getMaxRawRows()).isEqualTo(5000L);
        assertThat(Files.isDirectory(exportDir)).isTrue();
    }

    @Test
    void load_missingFile_usesDefaults() throws IOException {
        ReflectionTestUtils.setField(service, "globalConfigLocation", "classpath:conf/absent.yaml");

        GlobalConfig config = service.load();

        assertThat(config.getExport().getExportDir()).isEqualTo(GlobalConfig.DEFAULT_EXPORT_DIR);
        assertThat(config.getConcurrency().getMaxExportJobs()).isEqualTo(4);
    }
}
