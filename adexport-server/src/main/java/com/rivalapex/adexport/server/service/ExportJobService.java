package com.rivalapex.adexport.server.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rivalapex.adexport.dao.ExportJobEntity;
import com.rivalapex.adexport.dao.ExportJobRepository;
import com.rivalapex.adexport.dao.ExportJobStatus;
import com.rivalapex.adexport.manager.id.JobIdGenerator;
import com.rivalapex.adexport.server.constants.DestinationType;
import com.rivalapex.adexport.server.dto.ExportConfig;
import com.rivalapex.adexport.server.dto.ExportExecutionContext;
import com.rivalapex.adexport.server.dto.ExportResult;
import com.rivalapex.adexport.server.exception.ExportValidationException;
import com.rivalapex.adexport.server.exception.NotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * 导出作业管理：创建时同步校验并落库 pending，执行提交到后台线程池后立即返回。
 * 作业状态只通过仓储读写。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExportJobService {

    public static final int DEFAULT_LIST_LIMIT = 50;

    static final String QUEUE_FULL_ERROR = "export queue is full";

    static final String INTERRUPTED_ERROR = "interrupted by restart";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final ExportJobRepository exportJobRepository;
    private final ExportJobStateMachine stateMachine;
    private final ExportRequestValidator requestValidator;
    private final ExportExecutor exportExecutor;
    private final ExportWorkerPool workerPool;
    private final GlobalConfigService globalConfigService;
    private final FileDeliveryService fileDeliveryService;
    private final JobIdGenerator jobIdGenerator;

    /**
     * 创建导出作业。
     *
     * @throws ExportValidationException 参数不合法，此时不落库
     */
    public ExportJobEntity createExportJob(String publisherId, String dataType, LocalDate startDate,
                                           LocalDate endDate, ExportConfig config) {
        ExportExecutionContext context = requestValidator.validate(publisherId, dataType, startDate, endDate, config);
        context.setJobId(jobIdGenerator.nextJobId());
        context.setGlobalConfig(globalConfigService.getGlobalConfig());

        ExportJobEntity job = new ExportJobEntity();
        job.setId(context.getJobId());
        job.setPublisherId(publisherId);
        job.setDataType(context.getDataType().value());
        job.setFormat(context.getFormat().value());
        job.setCompression(context.getCompression().value());
        job.setDestination(context.getDestinationType().value());
        job.setStatus(ExportJobStatus.PENDING.value());
        job.setStartDate(startDate);
        job.setEndDate(endDate);
        job.setConfig(toJson(config));
        job.setCreatedAt(LocalDateTime.now(ZoneOffset.UTC));
        exportJobRepository.create(job);
        log.info("导出作业已创建: jobId={}, publisherId={}, dataType={}, format={}, destination={}",
            job.getId(), publisherId, job.getDataType(), job.getFormat(), job.getDestination());

        // 返回提交前的 pending 快照，工作线程可能在提交后立即推进状态
        try {
            workerPool.submit(() -> executeExport(context.getJobId(), context));
        } catch (RejectedExecutionException e) {
            log.error("导出队列已满，作业直接失败: jobId={}", job.getId());
            stateMachine.markFailed(job.getId(), QUEUE_FULL_ERROR);
            return exportJobRepository.findById(job.getId()).orElse(job);
        }
        return job;
    }

    /**
     * 后台执行导出。任务边界捕获所有 Throwable 并记录为 failed，不做自动重试。
     */
    public void executeExport(String jobId, ExportExecutionContext context) {
        if (!stateMachine.markRunning(jobId)) {
            log.warn("导出作业无法进入 running，跳过执行: jobId={}", jobId);
            return;
        }
        try {
            ExportResult result = exportExecutor.execute(context);
            stateMachine.markCompleted(jobId, result);
            log.info("导出作业完成: jobId={}, rows={}, size={}, location={}",
                jobId, result.getRowsExported(), result.getFileSize(), result.getLocation());
        } catch (Throwable t) {
            log.error("导出作业失败: jobId={}", jobId, t);
            stateMachine.markFailed(jobId, messageOf(t));
        }
    }

    public Optional<ExportJobEntity> getExportJob(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return exportJobRepository.findById(jobId);
    }

    public List<ExportJobEntity> listExportJobs(String publisherId, Integer limit) {
        int effective = limit == null || limit <= 0 ? DEFAULT_LIST_LIMIT : limit;
        return exportJobRepository.findByPublisherId(publisherId, effective);
    }

    /**
     * 解析可下载的本地文件。
     *
     * @throws ExportValidationException 作业未完成或不是本地导出
     * @throws NotFoundException 文件已不存在
     */
    public Path resolveDownload(ExportJobEntity job) {
        if (!ExportJobStatus.COMPLETED.value().equals(job.getStatus())) {
            throw new ExportValidationException("Export job not completed");
        }
        if (!DestinationType.LOCAL.value().equals(job.getDestination()) || job.getLocation() == null) {
            throw new ExportValidationException("Export file not available for download");
        }
        Path path = Paths.get(job.getLocation());
        if (!Files.isRegularFile(path)) {
            throw new NotFoundException("Export file no longer exists: " + path.getFileName());
        }
        return path;
    }

    /**
     * 进度：completed 100，running 50，其余 0。
     */
    public static int progressOf(ExportJobEntity job) {
        if (ExportJobStatus.COMPLETED.value().equals(job.getStatus())) {
            return 100;
        }
        if (ExportJobStatus.RUNNING.value().equals(job.getStatus())) {
            return 50;
        }
        return 0;
    }

    /**
     * 启动恢复：上个进程遗留的 pending / running 作业标记为失败，并清理导出目录中的临时文件。
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverInterruptedJobs() {
        List<ExportJobEntity> interrupted = exportJobRepository.findByStatusIn(
            Arrays.asList(ExportJobStatus.PENDING.value(), ExportJobStatus.RUNNING.value()));
        for (ExportJobEntity job : interrupted) {
            stateMachine.markFailed(job.getId(), INTERRUPTED_ERROR);
        }
        if (!interrupted.isEmpty()) {
            log.warn("启动恢复: {} 个未完成的导出作业已标记为失败", interrupted.size());
        }
        Path exportDir = Paths.get(globalConfigService.getGlobalConfig().getExport().getExportDir());
        fileDeliveryService.cleanupTempFiles(exportDir);
    }

    static String messageOf(Throwable t) {
        String message = t.getMessage();
        return message != null && !message.isEmpty() ? message : t.getClass().getSimpleName();
    }

    private static String toJson(ExportConfig config) {
        try {
            return OBJECT_MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new ExportValidationException("config is not serializable: " + e.getOriginalMessage());
        }
    }
}
