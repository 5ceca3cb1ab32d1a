package com.rivalapex.adexport.server.exception;

/**
 * 同一同步配置已有执行在进行中。
 */
public class SyncInProgressException extends ExportException {

    public SyncInProgressException(String message) {
        super(message);
    }

    public SyncInProgressException(String message, Throwable cause) {
        super(message, cause);
    }
}
