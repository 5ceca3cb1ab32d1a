package com.rivalapex.adexport.server.exception;

/**
 * 远端目的地上传失败。
 */
public class UploadException extends ExportException {

    public UploadException(String message) {
        super(message);
    }

    public UploadException(String message, Throwable cause) {
        super(message, cause);
    }
}
