package com.rivalapex.adexport.server.encoder;

import com.rivalapex.adexport.server.constants.ExportFormat;
import com.rivalapex.adexport.server.exception.EncodingException;
import com.rivalapex.adexport.server.exception.NoDataException;
import com.rivalapex.adexport.server.schema.ExportColumn;
import com.rivalapex.adexport.server.schema.ExportSchema;
import com.rivalapex.adexport.server.source.ExportRow;
import java.io.IOException;
import java.io.OutputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Type;
import org.apache.parquet.schema.Types;
import org.springframework.stereotype.Component;

/**
 * Parquet 编码：按数据类型预先声明的结构写出，每行写入前校验类型，不一致即失败。
 * 所有列为 optional，null 值不写入。
 */
@Slf4j
@Component
public class ParquetFormatEncoder implements FormatEncoder {

    @Override
    public ExportFormat format() {
        return ExportFormat.PARQUET;
    }

    @Override
    public long encode(Iterator<ExportRow> rows, OutputStream out, EncodeOptions options) throws IOException {
        ExportSchema schema = options.getSchema();
        if (schema == null) {
            throw new EncodingException("Parquet export requires a declared schema");
        }
        if (!rows.hasNext()) {
            throw new NoDataException("No data to export");
        }
        MessageType messageType = toMessageType(schema);
        SimpleGroupFactory groupFactory = new SimpleGroupFactory(messageType);

        long count = 0;
        try (ParquetWriter<Group> writer = ExampleParquetWriter.builder(new PositionTrackingOutputFile(out))
            .withType(messageType)
            .withCompressionCodec(CompressionCodecName.UNCOMPRESSED)
            .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
            .build()) {
            while (rows.hasNext()) {
                ExportRow row = rows.next();
                count++;
                schema.validate(row, count);
                writer.write(toGroup(groupFactory, schema, row));
            }
        }
        log.debug("Parquet 写出完成: schema={}, rows={}", schema.getName(), count);
        return count;
    }

    static MessageType toMessageType(ExportSchema schema) {
        List<Type> fields = new ArrayList<>();
        for (ExportColumn column : schema.getColumns()) {
            switch (column.getType()) {
                case STRING:
                    fields.add(Types.optional(PrimitiveTypeName.BINARY)
                        .as(LogicalTypeAnnotation.stringType())
                        .named(column.getName()));
                    break;
                case INT64:
                    fields.add(Types.optional(PrimitiveTypeName.INT64).named(column.getName()));
                    break;
                case DOUBLE:
                    fields.add(Types.optional(PrimitiveTypeName.DOUBLE).named(column.getName()));
                    break;
                case BOOLEAN:
                    fields.add(Types.optional(PrimitiveTypeName.BOOLEAN).named(column.getName()));
                    break;
                case TIMESTAMP:
                    fields.add(Types.optional(PrimitiveTypeName.INT64)
                        .as(LogicalTypeAnnotation.timestampType(true, LogicalTypeAnnotation.TimeUnit.MILLIS))
                        .named(column.getName()));
                    break;
                default:
                    throw new EncodingException("Unsupported column type: " + column.getType());
            }
        }
        return new MessageType(schema.getName(), fields);
    }

    private Group toGroup(SimpleGroupFactory groupFactory, ExportSchema schema, ExportRow row) {
        Group group = groupFactory.newGroup();
        for (ExportColumn column : schema.getColumns()) {
            Object value = row.get(column.getName());
            if (value == null) {
                continue;
            }
            String name = column.getName();
            switch (column.getType()) {
                case STRING:
                    group.append(name, value.toString());
                    break;
                case INT64:
                    group.append(name, ((Number) value).longValue());
                    break;
                case DOUBLE:
                    group.append(name, ((Number) value).doubleValue());
                    break;
                case BOOLEAN:
                    group.append(name, (Boolean) value);
                    break;
                case TIMESTAMP:
                    group.append(name, ((Instant) value).toEpochMilli());
                    break;
                default:
                    throw new EncodingException("Unsupported column type: " + column.getType());
            }
        }
        return group;
    }
}
