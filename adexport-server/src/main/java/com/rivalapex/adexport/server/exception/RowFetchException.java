package com.rivalapex.adexport.server.exception;

/**
 * 分析库查询失败。
 */
public class RowFetchException extends ExportException {

    public RowFetchException(String message) {
        super(message);
    }

    public RowFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
