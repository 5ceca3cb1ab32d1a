package com.rivalapex.adexport.server.exception;

/**
 * 请求参数非法，在作业持久化之前同步抛出。
 */
public class ExportValidationException extends ExportException {

    public ExportValidationException(String message) {
        super(message);
    }

    public ExportValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
