package com.rivalapex.adexport.server.service;

import com.rivalapex.adexport.server.constants.Compression;
import com.rivalapex.adexport.server.constants.DataType;
import com.rivalapex.adexport.server.constants.DestinationType;
import com.rivalapex.adexport.server.constants.ExportFormat;
import com.rivalapex.adexport.server.dto.ExportConfig;
import com.rivalapex.adexport.server.dto.ExportExecutionContext;
import com.rivalapex.adexport.server.exception.ExportValidationException;
import java.time.LocalDate;
import org.springframework.stereotype.Component;

/**
 * 导出请求校验。校验在持久化之前完成，失败时抛出 ExportValidationException。
 */
@Component
public class ExportRequestValidator {

    /**
     * 校验并转换为执行上下文（不含 jobId 与全局配置）。
     */
    public ExportExecutionContext validate(String publisherId, String dataType, LocalDate startDate,
                                           LocalDate endDate, ExportConfig config) {
        if (isBlank(publisherId)) {
            throw new ExportValidationException("publisherId is required");
        }
        DataType type = DataType.fromValue(dataType);
        if (startDate == null || endDate == null) {
            throw new ExportValidationException("startDate and endDate are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new ExportValidationException("startDate must not be after endDate");
        }
        if (config == null) {
            throw new ExportValidationException("config is required");
        }
        ExportFormat format = ExportFormat.fromValue(config.getFormat());
        Compression compression = Compression.fromValue(config.getCompression());
        if (format == ExportFormat.PARQUET && compression != Compression.NONE) {
            throw new ExportValidationException("Parquet exports do not support " + compression.value() + " compression");
        }

        ExportConfig.Destination destination = config.getDestination() != null
            ? config.getDestination() : new ExportConfig.Destination();
        DestinationType destinationType = DestinationType.fromValue(destination.getType());
        validateDestination(destinationType, destination);

        ExportExecutionContext context = new ExportExecutionContext();
        context.setPublisherId(publisherId);
        context.setDataType(type);
        context.setStartDate(startDate);
        context.setEndDate(endDate);
        context.setFormat(format);
        context.setCompression(compression);
        context.setDestinationType(destinationType);
        context.setDestination(destination);
        context.setNewlineDelimitedJson(destinationType == DestinationType.BIGQUERY);
        return context;
    }

    private void validateDestination(DestinationType type, ExportConfig.Destination destination) {
        switch (type) {
            case S3:
            case GCS:
                if (isBlank(destination.getBucket())) {
                    throw new ExportValidationException("destination.bucket is required for " + type.value());
                }
                break;
            case BIGQUERY:
                if (isBlank(destination.getDataset()) || isBlank(destination.getTable())) {
                    throw new ExportValidationException("destination.dataset and destination.table are required for bigquery");
                }
                break;
            default:
                break;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
