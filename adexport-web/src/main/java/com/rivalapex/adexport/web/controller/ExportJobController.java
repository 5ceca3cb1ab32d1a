package com.rivalapex.adexport.web.controller;

import com.rivalapex.adexport.dao.ExportJobEntity;
import com.rivalapex.adexport.server.exception.ExportValidationException;
import com.rivalapex.adexport.server.exception.NotFoundException;
import com.rivalapex.adexport.server.service.ExportJobService;
import com.rivalapex.adexport.web.ApiResponses;
import com.rivalapex.adexport.web.TenantAccessException;
import com.rivalapex.adexport.web.dto.CreateExportJobRequest;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 导出作业 API。调用方发布者来自请求头 X-Publisher-Id。
 */
@Slf4j
@RestController
@RequestMapping("/api/export/jobs")
@RequiredArgsConstructor
public class ExportJobController {

    public static final String PUBLISHER_HEADER = "X-Publisher-Id";

    private final ExportJobService exportJobService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestHeader(PUBLISHER_HEADER) String publisherId,
                                                      @RequestBody CreateExportJobRequest request) {
        ExportJobEntity job = exportJobService.createExportJob(publisherId, request.getDataType(),
            parseDate("startDate", request.getStartDate()), parseDate("endDate", request.getEndDate()),
            request.getConfig());
        return ApiResponses.created(job, ApiResponses.meta(
            "message", "Export job created and started asynchronously",
            "statusEndpoint", "/api/export/jobs/" + job.getId()));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> list(@RequestHeader(PUBLISHER_HEADER) String publisherId,
                                                    @RequestParam(required = false) Integer limit) {
        List<ExportJobEntity> jobs = exportJobService.listExportJobs(publisherId, limit);
        return ApiResponses.ok(jobs, ApiResponses.meta("count", jobs.size()));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<Map<String, Object>> get(@RequestHeader(PUBLISHER_HEADER) String publisherId,
                                                   @PathVariable String jobId) {
        ExportJobEntity job = loadOwned(publisherId, jobId);
        return ApiResponses.ok(job, ApiResponses.meta("progress", ExportJobService.progressOf(job)));
    }

    /**
     * 下载本地导出文件，只对已完成的 local 作业开放。
     */
    @GetMapping("/{jobId}/download")
    public ResponseEntity<Resource> download(@RequestHeader(PUBLISHER_HEADER) String publisherId,
                                             @PathVariable String jobId) {
        ExportJobEntity job = loadOwned(publisherId, jobId);
        Path file = exportJobService.resolveDownload(job);
        log.info("下载导出文件: jobId={}, file={}", jobId, file.getFileName());
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.attachment().filename(file.getFileName().toString()).build().toString())
            .contentType(MediaType.APPLICATION_OCTET_STREAM)
            .body(new FileSystemResource(file));
    }

    private ExportJobEntity loadOwned(String publisherId, String jobId) {
        ExportJobEntity job = exportJobService.getExportJob(jobId)
            .orElseThrow(() -> new NotFoundException("Export job not found"));
        if (!job.getPublisherId().equals(publisherId)) {
            throw new TenantAccessException("publisher " + publisherId + " -> job " + jobId);
        }
        return job;
    }

    static LocalDate parseDate(String field, String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new ExportValidationException(field + " is required");
        }
        String text = value.trim();
        try {
            if (text.indexOf('T') > 0) {
                return OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDate();
            }
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new ExportValidationException("Invalid date format for " + field + ": " + value);
        }
    }
}
