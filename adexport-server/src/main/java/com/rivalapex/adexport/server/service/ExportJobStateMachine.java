package com.rivalapex.adexport.server.service;

import com.rivalapex.adexport.dao.ExportJobEntity;
import com.rivalapex.adexport.dao.ExportJobRepository;
import com.rivalapex.adexport.dao.ExportJobStatus;
import com.rivalapex.adexport.server.dto.ExportResult;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 导出作业状态机。状态只前进：pending → running → completed / failed，
 * pending 可直接失败（队列已满、重启中断）。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExportJobStateMachine {

    private final ExportJobRepository exportJobRepository;

    private enum StateTransition {
        PENDING_TO_RUNNING(ExportJobStatus.PENDING, ExportJobStatus.RUNNING),
        PENDING_TO_FAILED(ExportJobStatus.PENDING, ExportJobStatus.FAILED),
        RUNNING_TO_COMPLETED(ExportJobStatus.RUNNING, ExportJobStatus.COMPLETED),
        RUNNING_TO_FAILED(ExportJobStatus.RUNNING, ExportJobStatus.FAILED);

        private final ExportJobStatus from;
        private final ExportJobStatus to;

        StateTransition(ExportJobStatus from, ExportJobStatus to) {
            this.from = from;
            this.to = to;
        }

        boolean matches(ExportJobStatus current, ExportJobStatus target) {
            return from == current && to == target;
        }
    }

    public boolean markRunning(String jobId) {
        return transitionTo(jobId, ExportJobStatus.RUNNING, null);
    }

    public boolean markCompleted(String jobId, ExportResult result) {
        return transitionTo(jobId, ExportJobStatus.COMPLETED, job -> {
            job.setRowsExported(result.getRowsExported());
            job.setFileSize(result.getFileSize());
            job.setLocation(result.getLocation());
        });
    }

    public boolean markFailed(String jobId, String error) {
        return transitionTo(jobId, ExportJobStatus.FAILED, job -> job.setError(error));
    }

    private boolean transitionTo(String jobId, ExportJobStatus target, Consumer<ExportJobEntity> mutator) {
        ExportJobEntity job = exportJobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.error("导出作业不存在: jobId={}", jobId);
            return false;
        }
        ExportJobStatus current = ExportJobStatus.fromValue(job.getStatus());
        if (current == target) {
            log.debug("作业已是目标状态，跳过转换: jobId={}, status={}", jobId, current.value());
            return true;
        }
        if (!isValidTransition(current, target)) {
            log.error("非法的状态转换: jobId={}, from={}, to={}", jobId, current.value(), target.value());
            return false;
        }
        job.setStatus(target.value());
        if (mutator != null) {
            mutator.accept(job);
        }
        if (target.isTerminal()) {
            job.setCompletedAt(LocalDateTime.now(ZoneOffset.UTC));
        }
        exportJobRepository.update(job);
        log.info("导出作业状态转换: jobId={}, {} -> {}", jobId, current.value(), target.value());
        return true;
    }

    private boolean isValidTransition(ExportJobStatus current, ExportJobStatus target) {
        for (StateTransition transition : StateTransition.values()) {
            if (transition.matches(current, target)) {
                return true;
            }
        }
        return false;
    }
}
