package com.rivalapex.adexport.server.exception;

/**
 * 导出流水线异常基类。
 */
public class ExportException extends RuntimeException {

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
