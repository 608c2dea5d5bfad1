package com.gdin.inspection.cognify.models;

/**
 * Started → Running → Completed | Failed，终态不可再迁移。
 */
public enum PipelineRunStatus {
    STARTED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(PipelineRunStatus next) {
        return switch (this) {
            case STARTED -> next == RUNNING || next == FAILED;
            case RUNNING -> next == COMPLETED || next == FAILED;
            default -> false;
        };
    }
}
