package com.rivalapex.adexport.server.encoder;

import com.rivalapex.adexport.server.constants.ExportFormat;
import com.rivalapex.adexport.server.source.ExportRow;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;

/**
 * 流式格式编码器：逐行消费行迭代器并写出，不缓存整个结果集。
 *
 * 实现不负责关闭输出流，由调用方关闭。
 */
public interface FormatEncoder {

    ExportFormat format();

    /**
     * @return 写出的行数
     * @throws com.rivalapex.adexport.server.exception.NoDataException 行迭代器为空
     * @throws com.rivalapex.adexport.server.exception.EncodingException 行与结构不一致
     */
    long encode(Iterator<ExportRow> rows, OutputStream out, EncodeOptions options) throws IOException;
}
