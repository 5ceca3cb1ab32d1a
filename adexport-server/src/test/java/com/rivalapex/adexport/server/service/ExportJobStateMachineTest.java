package com.rivalapex.adexport.server.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.rivalapex.adexport.dao.ExportJobEntity;
import com.rivalapex.adexport.dao.InMemoryExportJobRepository;
import com.rivalapex.adexport.server.dto.ExportResult;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExportJobStateMachineTest {

    private InMemoryExportJobRepository repository;
    private ExportJobStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        repository = new InMemoryExportJobRepository();
        stateMachine = new ExportJobStateMachine(repository);
        ExportJobEntity job = new ExportJobEntity();
        job.setId("job-1");
        job.setPublisherId("pub-1");
        job.setDataType("impressions");
        job.setFormat("csv");
        job.setCompression("none");
        job.setDestination("local");
        job.setStatus("pending");
        job.setStartDate(LocalDate.of(2024, 3, 1));
        job.setEndDate(LocalDate.of(2024, 3, 1));
        job.setCreatedAt(LocalDateTime.now());
        repository.create(job);
    }

    @Test
    void markCompleted_afterRunning_recordsResult() {
        assertThat(stateMachine.markRunning("job-1")).isTrue();
        assertThat(stateMachine.markCompleted("job-1", new ExportResult(10, 123, "/tmp/x.csv"))).isTrue();

        ExportJobEntity job = repository.findById("job-1").orElseThrow(IllegalStateException::new);
        assertThat(job.getStatus()).isEqualTo("completed");
        assertThat(job.getRowsExported()).isEqualTo(10);
        assertThat(job.getFileSize()).isEqualTo(123);
        assertThat(job.getLocation()).isEqualTo("/tmp/x.csv");
        assertThat(job.getCompletedAt()).isNotNull();
    }

    @Test
    void markCompleted_fromPending_isRejected() {
        assertThat(stateMachine.markCompleted("job-1", new ExportResult(1, 1, "x"))).isFalse();
        assertThat(repository.findById("job-1").map(ExportJobEntity::getStatus)).contains("pending");
    }

    @Test
    void terminalState_neverMovesBackwards() {
        stateMachine.markFailed("job-1", "boom");

        assertThat(stateMachine.markRunning("job-1")).isFalse();
        ExportJobEntity job = repository.findById("job-1").orElseThrow(IllegalStateException::new);
        assertThat(job.getStatus()).isEqualTo("failed");
        assertThat(job.getError()).isEqualTo("boom");
    }

    @Test
    void sameState_isIdempotent() {
        stateMachine.markRunning("job-1");
        assertThat(stateMachine.markRunning("job-1")).isTrue();
    }

    @Test
    void unknownJob_returnsFalse() {
        assertThat(stateMachine.markRunning("missing")).isFalse();
    }
}
