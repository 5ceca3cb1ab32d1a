package com.rivalapex.adexport.server.encoder;

import com.rivalapex.adexport.server.constants.ExportFormat;
import com.rivalapex.adexport.server.exception.NoDataException;
import com.rivalapex.adexport.server.source.ExportRow;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * CSV 编码：表头取第一行的列名，之后各行按表头顺序输出。
 *
 * 字符串加双引号并将内部引号加倍；null 为空字段；时间为 ISO-8601；数字与布尔原样输出。
 */
@Component
public class CsvFormatEncoder implements FormatEncoder {

    private static final int BUFFER_SIZE = 64 * 1024;

    @Override
    public ExportFormat format() {
        return ExportFormat.CSV;
    }

    @Override
    public long encode(Iterator<ExportRow> rows, OutputStream out, EncodeOptions options) throws IOException {
        if (!rows.hasNext()) {
            throw new NoDataException("No data to export");
        }
        Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8), BUFFER_SIZE);
        ExportRow first = rows.next();
        List<String> header = new ArrayList<>(first.columns());
        writer.write(String.join(",", header));
        writer.write('\n');

        long count = 0;
        ExportRow row = first;
        while (row != null) {
            writeRow(writer, header, row);
            count++;
            row = rows.hasNext() ? rows.next() : null;
        }
        writer.flush();
        return count;
    }

    private void writeRow(Writer writer, List<String> header, ExportRow row) throws IOException {
        for (int i = 0; i < header.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(formatValue(row.get(header.get(i))));
        }
        writer.write('\n');
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof CharSequence) {
            return '"' + value.toString().replace("\"", "\"\"") + '"';
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return "";
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        return value.toString();
    }
}
