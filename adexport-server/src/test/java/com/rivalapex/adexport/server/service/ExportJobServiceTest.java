package com.rivalapex.adexport.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rivalapex.adexport.dao.ExportJobEntity;
import com.rivalapex.adexport.dao.InMemoryExportJobRepository;
import com.rivalapex.adexport.manager.id.JobIdGenerator;
import com.rivalapex.adexport.server.dto.ExportConfig;
import com.rivalapex.adexport.server.dto.ExportExecutionContext;
import com.rivalapex.adexport.server.dto.ExportResult;
import com.rivalapex.adexport.server.dto.GlobalConfig;
import com.rivalapex.adexport.server.exception.ExportValidationException;
import com.rivalapex.adexport.server.exception.NotFoundException;
import com.rivalapex.adexport.server.exception.UploadException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExportJobServiceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    @TempDir
    Path tempDir;

    @Mock
    private ExportExecutor exportExecutor;
    @Mock
    private ExportWorkerPool workerPool;
    @Mock
    private GlobalConfigService globalConfigService;
    @Mock
    private FileDeliveryService fileDeliveryService;

    private InMemoryExportJobRepository repository;
    private ExportJobService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryExportJobRepository();
        GlobalConfig globalConfig = new GlobalConfig().applyDefaults();
        globalConfig.getExport().setExportDir(tempDir.toString());
        lenient().when(globalConfigService.getGlobalConfig()).thenReturn(globalConfig);
        service = new ExportJobService(repository, new ExportJobStateMachine(repository),
            new ExportRequestValidator(), exportExecutor, workerPool, globalConfigService,
            fileDeliveryService, new JobIdGenerator());
    }

    private ExportConfig csvLocal() {
        ExportConfig config = new ExportConfig();
        config.setFormat("csv");
        return config;
    }

    private ExportJobEntity seed(String id, String status, String destination, String location) {
        ExportJobEntity job = new ExportJobEntity();
        job.setId(id);
        job.setPublisherId("pub-1");
        job.setDataType("impressions");
        job.setFormat("csv");
        job.setCompression("none");
        job.setDestination(destination);
        job.setStatus(status);
        job.setStartDate(DAY);
        job.setEndDate(DAY);
        job.setLocation(location);
        job.setCreatedAt(LocalDateTime.now());
        return repository.create(job);
    }

    @Test
    void createExportJob_returnsPendingJobWithZeroRows() {
        ExportJobEntity job = service.createExportJob("pub-1", "impressions", DAY, DAY, csvLocal());

        assertThat(job.getId()).startsWith("job-");
        assertThat(job.getStatus()).isEqualTo("pending");
        assertThat(job.getRowsExported()).isZero();
        assertThat(job.getDestination()).isEqualTo("local");
        assertThat(job.getConfig()).contains("\"format\":\"csv\"");
        verify(workerPool).submit(any(Runnable.class));
    }

    @Test
    void createExportJob_workerRunsImmediately_stillReturnsPendingSnapshot() {
        when(exportExecutor.execute(any(ExportExecutionContext.class)))
            .thenReturn(new ExportResult(7, 128, "/exports/b.csv"));
        doAnswer(invocation -> {
            invocation.<Runnable>getArgument(0).run();
            return null;
        }).when(workerPool).submit(any(Runnable.class));

        ExportJobEntity job = service.createExportJob("pub-1", "impressions", DAY, DAY, csvLocal());

        assertThat(job.getStatus()).isEqualTo("pending");
        assertThat(job.getRowsExported()).isZero();
        assertThat(job.getCompletedAt()).isNull();
        ExportJobEntity stored = repository.findById(job.getId()).orElseThrow(IllegalStateException::new);
        assertThat(stored.getStatus()).isEqualTo("completed");
        assertThat(stored.getRowsExported()).isEqualTo(7);
    }

    @Test
    void createExportJob_invalidRange_persistsNothing() {
        assertThatThrownBy(() -> service.createExportJob("pub-1", "impressions", DAY.plusDays(1), DAY, csvLocal()))
            .isInstanceOf(ExportValidationException.class);

        assertThat(repository.findByPublisherId("pub-1", 50)).isEmpty();
        verify(workerPool, never()).submit(any(Runnable.class));
    }

    @Test
    void createExportJob_queueFull_marksFailed() {
        doThrow(new RejectedExecutionException("full")).when(workerPool).submit(any(Runnable.class));

        ExportJobEntity job = service.createExportJob("pub-1", "impressions", DAY, DAY, csvLocal());

        assertThat(job.getStatus()).isEqualTo("failed");
        assertThat(job.getError()).isEqualTo("export queue is full");
    }

    @Test
    void submittedTask_runsExportToCompletion() {
        when(exportExecutor.execute(any(ExportExecutionContext.class)))
            .thenReturn(new ExportResult(2, 64, "/exports/a.csv"));
        ExportJobEntity job = service.createExportJob("pub-1", "impressions", DAY, DAY, csvLocal());
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(workerPool).submit(task.capture());

        task.getValue().run();

        ExportJobEntity done = service.getExportJob(job.getId()).orElseThrow(IllegalStateException::new);
        assertThat(done.getStatus()).isEqualTo("completed");
        assertThat(done.getRowsExported()).isEqualTo(2);
        assertThat(done.getFileSize()).isEqualTo(64);
        assertThat(done.getLocation()).isEqualTo("/exports/a.csv");
        assertThat(done.getCompletedAt()).isNotNull();
    }

    @Test
    void executeExport_uploadFailure_recordsError() {
        seed("job-up", "pending", "s3", null);
        when(exportExecutor.execute(any(ExportExecutionContext.class)))
            .thenThrow(new UploadException("Upload to s3 failed: bucket=b, key=k"));

        service.executeExport("job-up", new ExportExecutionContext());

        ExportJobEntity job = repository.findById("job-up").orElseThrow(IllegalStateException::new);
        assertThat(job.getStatus()).isEqualTo("failed");
        assertThat(job.getError()).isNotEmpty().contains("bucket=b");
    }

    @Test
    void executeExport_error_isCaughtAtTaskBoundary() {
        seed("job-oom", "pending", "local", null);
        when(exportExecutor.execute(any(ExportExecutionContext.class))).thenThrow(new StackOverflowError());

        service.executeExport("job-oom", new ExportExecutionContext());

        ExportJobEntity job = repository.findById("job-oom").orElseThrow(IllegalStateException::new);
        assertThat(job.getStatus()).isEqualTo("failed");
        assertThat(job.getError()).isEqualTo("StackOverflowError");
    }

    @Test
    void getExportJob_unknownId_isEmpty() {
        assertThat(service.getExportJob("job-missing")).isEmpty();
        assertThat(service.getExportJob(null)).isEmpty();
    }

    @Test
    void resolveDownload_pending_isNotCompleted() {
        ExportJobEntity job = seed("job-p", "pending", "local", null);

        assertThatThrownBy(() -> service.resolveDownload(job))
            .isInstanceOf(ExportValidationException.class)
            .hasMessage("Export job not completed");
    }

    @Test
    void resolveDownload_remote_isNotAvailable() {
        ExportJobEntity job = seed("job-r", "completed", "s3", "s3://b/k");

        assertThatThrownBy(() -> service.resolveDownload(job))
            .isInstanceOf(ExportValidationException.class)
            .hasMessage("Export file not available for download");
    }

    @Test
    void resolveDownload_completedLocal_returnsPath() throws IOException {
        Path file = Files.write(tempDir.resolve("a.csv"), new byte[]{1});
        ExportJobEntity job = seed("job-l", "completed", "local", file.toString());

        assertThat(service.resolveDownload(job)).isEqualTo(file);
    }

    @Test
    void resolveDownload_deletedFile_isNotFound() {
        ExportJobEntity job = seed("job-d", "completed", "local", tempDir.resolve("gone.csv").toString());

        assertThatThrownBy(() -> service.resolveDownload(job)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void progressOf_followsStatus() {
        assertThat(ExportJobService.progressOf(seed("j1", "completed", "local", null))).isEqualTo(100);
        assertThat(ExportJobService.progressOf(seed("j2", "running", "local", null))).isEqualTo(50);
        assertThat(ExportJobService.progressOf(seed("j3", "pending", "local", null))).isZero();
        assertThat(ExportJobService.progressOf(seed("j4", "failed", "local", null))).isZero();
    }

    @Test
    void recoverInterruptedJobs_failsUnfinishedJobs() {
        seed("job-a", "pending", "local", null);
        seed("job-b", "running", "local", null);
        seed("job-c", "completed", "local", "/x.csv");

        service.recoverInterruptedJobs();

        assertThat(repository.findById("job-a").map(ExportJobEntity::getError)).contains("interrupted by restart");
        assertThat(repository.findById("job-b").map(ExportJobEntity::getStatus)).contains("failed");
        assertThat(repository.findById("job-c").map(ExportJobEntity::getStatus)).contains("completed");
        verify(fileDeliveryService).cleanupTempFiles(tempDir);
    }
}
