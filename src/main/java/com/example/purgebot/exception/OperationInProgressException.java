package com.example.purgebot.exception;

/**
 * 已有清理或同步在执行：请求被立即拒绝，不排队。
 */
public class OperationInProgressException extends RuntimeException {

    private final String activeOperation;

    public OperationInProgressException(String activeOperation) {
        super("Cleanup or sync already running (" + activeOperation + ")");
        this.activeOperation = activeOperation;
    }

    public String getActiveOperation() {
        return activeOperation;
    }
}
