package com.gdin.inspection.cognify.exception;

import lombok.Getter;

@Getter
public class RetriesExhaustedException extends CognifyException {

    private final String operation;
    private final int attempts;

    public RetriesExhaustedException(String operation, int attempts, Throwable cause) {
        super("重试耗尽: " + operation + ", attempts=" + attempts
                + (cause == null ? "" : ", last=" + cause.getMessage()), cause);
        this.operation = operation;
        this.attempts = attempts;
    }
}
