package com.rivalapex.adexport.server.encoder;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rivalapex.adexport.server.constants.ExportFormat;
import com.rivalapex.adexport.server.exception.NoDataException;
import com.rivalapex.adexport.server.source.ExportRow;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;
import org.springframework.stereotype.Component;

/**
 * JSON 编码：默认增量输出一个数组（"[" 逐个元素 "]"），
 * newlineDelimited 时每行一个对象，供数仓加载使用。
 */
@Component
public class JsonFormatEncoder implements FormatEncoder {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    @Override
    public ExportFormat format() {
        return ExportFormat.JSON;
    }

    @Override
    public long encode(Iterator<ExportRow> rows, OutputStream out, EncodeOptions options) throws IOException {
        if (!rows.hasNext()) {
            throw new NoDataException("No data to export");
        }
        long count = 0;
        try (JsonGenerator generator = objectMapper.createGenerator(out, JsonEncoding.UTF8)) {
            if (options.isNewlineDelimited()) {
                generator.setRootValueSeparator(null);
                while (rows.hasNext()) {
                    generator.writeObject(rows.next().asMap());
                    generator.writeRaw('\n');
                    count++;
                }
            } else {
                generator.writeStartArray();
                while (rows.hasNext()) {
                    generator.writeObject(rows.next().asMap());
                    count++;
                }
                generator.writeEndArray();
                generator.writeRaw('\n');
            }
            generator.flush();
        }
        return count;
    }
}
