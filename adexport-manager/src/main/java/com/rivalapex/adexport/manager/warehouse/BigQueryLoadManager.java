package com.rivalapex.adexport.manager.warehouse;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.BigQueryOptions;
import com.google.cloud.bigquery.CsvOptions;
import com.google.cloud.bigquery.FormatOptions;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobId;
import com.google.cloud.bigquery.JobInfo;
import com.google.cloud.bigquery.JobStatistics;
import com.google.cloud.bigquery.TableDataWriteChannel;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.WriteChannelConfiguration;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * BigQuery 加载实现：通过 TableDataWriteChannel 上传本地文件并等待 load job 结束。
 */
@Slf4j
@Component
public class BigQueryLoadManager implements WarehouseLoadManager {

    private final String projectId;

    private volatile BigQuery bigQuery;

    @Autowired
    public BigQueryLoadManager(@Value("${adexport.storage.gcp-project-id:}") String projectId) {
        this.projectId = projectId;
    }

    BigQueryLoadManager(BigQuery bigQuery) {
        this.projectId = null;
        this.bigQuery = bigQuery;
    }

    @Override
    public long load(String dataset, String table, Path file, LoadSourceFormat format) throws IOException {
        TableId tableId = TableId.of(dataset, table);
        WriteChannelConfiguration configuration = WriteChannelConfiguration.newBuilder(tableId)
            .setFormatOptions(toFormatOptions(format))
            .setAutodetect(format.isAutodetect())
            .setWriteDisposition(JobInfo.WriteDisposition.WRITE_APPEND)
            .build();
        JobId jobId = JobId.of("adexport_" + UUID.randomUUID().toString().replace("-", ""));

        log.info("提交 BigQuery 加载作业: jobId={}, table={}.{}, format={}, file={}",
            jobId.getJob(), dataset, table, format, file.getFileName());
        try {
            TableDataWriteChannel writer = client().writer(jobId, configuration);
            try (OutputStream stream = Channels.newOutputStream(writer)) {
                Files.copy(file, stream);
            }
            Job job = writer.getJob();
            if (job == null) {
                throw new IOException("BigQuery 加载作业未创建: table=" + dataset + "." + table);
            }
            job = job.waitFor();
            if (job == null) {
                throw new IOException("BigQuery 加载作业不存在: jobId=" + jobId.getJob());
            }
            if (job.getStatus().getError() != null) {
                throw new IOException("BigQuery 加载失败: table=" + dataset + "." + table
                    + ", " + job.getStatus().getError().getMessage());
            }
            JobStatistics.LoadStatistics statistics = job.getStatistics();
            Long outputRows = statistics != null ? statistics.getOutputRows() : null;
            log.info("BigQuery 加载完成: table={}.{}, rows={}", dataset, table, outputRows);
            return outputRows != null ? outputRows : -1L;
        } catch (BigQueryException e) {
            throw new IOException("BigQuery 加载失败: table=" + dataset + "." + table + ", " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("等待 BigQuery 加载作业被中断: jobId=" + jobId.getJob(), e);
        }
    }

    static FormatOptions toFormatOptions(LoadSourceFormat format) {
        switch (format) {
            case CSV:
                return CsvOptions.newBuilder().setSkipLeadingRows(1).build();
            case NEWLINE_DELIMITED_JSON:
                return FormatOptions.json();
            case PARQUET:
                return FormatOptions.parquet();
            default:
                throw new IllegalArgumentException("不支持的加载格式: " + format);
        }
    }

    private BigQuery client() {
        BigQuery current = bigQuery;
        if (current == null) {
            synchronized (this) {
                current = bigQuery;
                if (current == null) {
                    BigQueryOptions.Builder builder = BigQueryOptions.newBuilder();
                    if (projectId != null && !projectId.isEmpty()) {
                        builder.setProjectId(projectId);
                    }
                    current = builder.build().getService();
                    bigQuery = current;
                }
            }
        }
        return current;
    }
}
