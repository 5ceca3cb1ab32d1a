package com.rivalapex.adexport.server.encoder;

import com.rivalapex.adexport.server.schema.ExportSchema;
import lombok.Value;

/**
 * 编码参数。
 */
@Value
public class EncodeOptions {

    /**
     * 数据类型声明的导出结构。
     */
    ExportSchema schema;

    /**
     * JSON 是否每行一个对象（BigQuery NEWLINE_DELIMITED_JSON），否则输出单个数组。
     */
    boolean newlineDelimited;
}
