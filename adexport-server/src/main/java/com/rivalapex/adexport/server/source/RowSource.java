package com.rivalapex.adexport.server.source;

import com.rivalapex.adexport.server.constants.DataType;
import java.time.LocalDate;
import java.util.stream.Stream;

/**
 * 分析库流式行源。
 *
 * 返回的流是惰性的、有限的、只能遍历一次；底层持有数据库连接，调用方必须关闭（try-with-resources）。
 */
public interface RowSource {

    /**
     * @param startDate 起始日期（含）
     * @param endDate 结束日期（含）
     */
    Stream<ExportRow> fetch(DataType dataType, String publisherId, LocalDate startDate, LocalDate endDate);
}
