package com.rivalapex.adexport.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rivalapex.adexport.manager.compression.LocalCompressionManager;
import com.rivalapex.adexport.manager.filesystem.LocalFileSystemManager;
import com.rivalapex.adexport.server.constants.Compression;
import com.rivalapex.adexport.server.constants.DataType;
import com.rivalapex.adexport.server.constants.ExportFormat;
import com.rivalapex.adexport.server.dto.ExportExecutionContext;
import com.rivalapex.adexport.server.dto.GeneratedFile;
import com.rivalapex.adexport.server.dto.GlobalConfig;
import com.rivalapex.adexport.server.encoder.CsvFormatEncoder;
import com.rivalapex.adexport.server.encoder.FormatEncoderRegistry;
import com.rivalapex.adexport.server.encoder.JsonFormatEncoder;
import com.rivalapex.adexport.server.encoder.ParquetFormatEncoder;
import com.rivalapex.adexport.server.exception.EncodingException;
import com.rivalapex.adexport.server.exception.NoDataException;
import com.rivalapex.adexport.server.source.ExportRow;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.stream.Stream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExportFileGeneratorTest {

    @TempDir
    Path tempDir;

    private ExportFileGenerator generator;
    private Path exportDir;

    @BeforeEach
    void setUp() {
        LocalFileSystemManager fileSystemManager = new LocalFileSystemManager();
        FormatEncoderRegistry registry = new FormatEncoderRegistry(Arrays.asList(
            new CsvFormatEncoder(), new JsonFormatEncoder(), new ParquetFormatEncoder()));
        generator = new ExportFileGenerator(registry, new LocalCompressionManager(), fileSystemManager,
            new FileDeliveryService(fileSystemManager));
        exportDir = tempDir.resolve("exports");
    }

    private ExportExecutionContext context(ExportFormat format, Compression compression) {
        GlobalConfig globalConfig = new GlobalConfig().applyDefaults();
        globalConfig.getExport().setExportDir(exportDir.toString());
        ExportExecutionContext ctx = new ExportExecutionContext();
        ctx.setJobId("job-1");
        ctx.setPublisherId("pub-csv");
        ctx.setDataType(DataType.IMPRESSIONS);
        ctx.setFormat(format);
        ctx.setCompression(compression);
        ctx.setGlobalConfig(globalConfig);
        return ctx;
    }

    private Stream<ExportRow> csvRows() {
        return Stream.of(
            ExportRow.of("date", "2024-03-01", "publisher_id", "pub-csv", "impressions", 1L),
            ExportRow.of("date", "2024-03-01", "publisher_id", "pub-csv", "impressions", 2L));
    }

    @Test
    void generate_csv_createsExportDirAndRenamesTempFile() throws IOException {
        GeneratedFile file = generator.generate(context(ExportFormat.CSV, Compression.NONE), csvRows());

        assertThat(file.getRowsWritten()).isEqualTo(2);
        assertThat(file.getPath().getParent()).isEqualTo(exportDir);
        assertThat(file.getPath().getFileName().toString()).matches("impressions_pub-csv_\\d+_job-1\\.csv");
        assertThat(file.getFileSize()).isEqualTo(Files.size(file.getPath()));
        assertThat(Files.readAllLines(file.getPath(), StandardCharsets.UTF_8)).containsExactly(
            "date,publisher_id,impressions",
            "\"2024-03-01\",\"pub-csv\",1",
            "\"2024-03-01\",\"pub-csv\",2");
        try (Stream<Path> files = Files.list(exportDir)) {
            assertThat(files.filter(p -> p.toString().endsWith(".tmp"))).isEmpty();
        }
    }

    @Test
    void generate_gzip_reportsCompressedSize() throws IOException {
        GeneratedFile file = generator.generate(context(ExportFormat.CSV, Compression.GZIP), csvRows());

        assertThat(file.getPath().getFileName().toString()).endsWith(".csv.gz");
        assertThat(file.getFileSize()).isEqualTo(Files.size(file.getPath()));
        try (InputStream in = new GzipCompressorInputStream(Files.newInputStream(file.getPath()))) {
            String content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            assertThat(content).startsWith("date,publisher_id,impressions\n");
        }
    }

    @Test
    void generate_emptyStream_leavesNoFile() throws IOException {
        assertThatThrownBy(() -> generator.generate(context(ExportFormat.CSV, Compression.NONE), Stream.empty()))
            .isInstanceOf(NoDataException.class);

        try (Stream<Path> files = Files.list(exportDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void generate_parquetSchemaMismatch_leavesNoFile() throws IOException {
        Stream<ExportRow> rows = Stream.of(ExportRow.of("date", "2024-03-01", "unexpected", 1L));

        assertThatThrownBy(() -> generator.generate(context(ExportFormat.PARQUET, Compression.NONE), rows))
            .isInstanceOf(EncodingException.class);

        try (Stream<Path> files = Files.list(exportDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void fileNameOf_sanitizesPublisherId() {
        ExportExecutionContext ctx = context(ExportFormat.JSON, Compression.GZIP);
        ctx.setPublisherId("pub/../x y");

        assertThat(ExportFileGenerator.fileNameOf(ctx, 1700000000000L))
            .isEqualTo("impressions_pub____x_y_1700000000000_job-1.json.gz");
    }

    @Test
    void fileNameOf_sameMillisecondDifferentJobs_doNotCollide() {
        ExportExecutionContext first = context(ExportFormat.CSV, Compression.NONE);
        ExportExecutionContext second = context(ExportFormat.CSV, Compression.NONE);
        second.setJobId("job-2");

        assertThat(ExportFileGenerator.fileNameOf(first, 1700000000000L))
            .isNotEqualTo(ExportFileGenerator.fileNameOf(second, 1700000000000L));
    }

    @Test
    void generate_concurrentJobsSamePublisher_keepBothFiles() throws IOException {
        ExportExecutionContext other = context(ExportFormat.CSV, Compression.NONE);
        other.setJobId("job-2");

        GeneratedFile a = generator.generate(context(ExportFormat.CSV, Compression.NONE), csvRows());
        GeneratedFile b = generator.generate(other, csvRows());

        assertThat(a.getPath()).isNotEqualTo(b.getPath());
        assertThat(Files.exists(a.getPath())).isTrue();
        assertThat(Files.exists(b.getPath())).isTrue();
    }
}
