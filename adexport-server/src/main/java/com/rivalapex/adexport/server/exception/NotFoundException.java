package com.rivalapex.adexport.server.exception;

/**
 * 作业或同步配置不存在。
 */
public class NotFoundException extends ExportException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
