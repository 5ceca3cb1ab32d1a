package com.rivalapex.adexport.server.exception;

/**
 * 编码失败，例如行结构与 Parquet schema 不一致。
 */
public class EncodingException extends ExportException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
