package com.rivalapex.adexport.server.exception;

/**
 * 查询结果为空，不生成只有表头的空文件。
 */
public class NoDataException extends EncodingException {

    public NoDataException(String message) {
        super(message);
    }
}
