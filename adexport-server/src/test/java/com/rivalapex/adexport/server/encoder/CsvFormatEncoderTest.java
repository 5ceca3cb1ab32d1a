package com.rivalapex.adexport.server.encoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rivalapex.adexport.server.exception.NoDataException;
import com.rivalapex.adexport.server.source.ExportRow;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;

class CsvFormatEncoderTest {

    private final CsvFormatEncoder encoder = new CsvFormatEncoder();

    @Test
    void encode_writesHeaderFromFirstRowAndQuotesStringsOnly() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        long rows = encoder.encode(Arrays.asList(
            ExportRow.of("date", "2024-03-01", "publisher_id", "pub-csv", "impressions", 1L),
            ExportRow.of("date", "2024-03-01", "publisher_id", "pub-csv", "impressions", 2L)).iterator(),
            out, new EncodeOptions(null, false));

        assertThat(rows).isEqualTo(2);
        assertThat(out.toString(StandardCharsets.UTF_8.name())).isEqualTo(
            "date,publisher_id,impressions\n"
                + "\"2024-03-01\",\"pub-csv\",1\n"
                + "\"2024-03-01\",\"pub-csv\",2\n");
    }

    @Test
    void encode_emptyRows_throwsNoData() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertThatThrownBy(() -> encoder.encode(Collections.<ExportRow>emptyIterator(), out, new EncodeOptions(null, false)))
            .isInstanceOf(NoDataException.class)
            .hasMessage("No data to export");
        assertThat(out.size()).isZero();
    }

    @Test
    void encode_nullValue_writesEmptyField() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        encoder.encode(Arrays.asList(
            ExportRow.of("country", "US", "revenue", 1.5),
            ExportRow.of("country", null, "revenue", 2.0)).iterator(),
            out, new EncodeOptions(null, false));

        assertThat(out.toString(StandardCharsets.UTF_8.name())).isEqualTo(
            "country,revenue\n\"US\",1.5\n,2\n");
    }

    @Test
    void formatValue_coversValueKinds() {
        assertThat(CsvFormatEncoder.formatValue(null)).isEmpty();
        assertThat(CsvFormatEncoder.formatValue("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
        assertThat(CsvFormatEncoder.formatValue("a,b")).isEqualTo("\"a,b\"");
        assertThat(CsvFormatEncoder.formatValue(Instant.parse("2024-03-01T10:15:30Z"))).isEqualTo("2024-03-01T10:15:30Z");
        assertThat(CsvFormatEncoder.formatValue(LocalDate.of(2024, 3, 1))).isEqualTo("2024-03-01");
        assertThat(CsvFormatEncoder.formatValue(true)).isEqualTo("true");
        assertThat(CsvFormatEncoder.formatValue(42L)).isEqualTo("42");
        assertThat(CsvFormatEncoder.formatValue(0.00001)).isEqualTo("0.00001");
        assertThat(CsvFormatEncoder.formatValue(Double.NaN)).isEmpty();
        assertThat(CsvFormatEncoder.formatValue(new BigDecimal("1E+3"))).isEqualTo("1000");
    }
}
