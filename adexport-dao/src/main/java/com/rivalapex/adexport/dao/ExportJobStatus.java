package com.rivalapex.adexport.dao;

/**
 * 导出作业状态，单调推进：pending -> running -> completed | failed。
 */
public enum ExportJobStatus {

    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    ExportJobStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static ExportJobStatus fromValue(String value) {
        for (ExportJobStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("未知的导出作业状态: " + value);
    }
}
