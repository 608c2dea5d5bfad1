package com.gdin.inspection.cognify.models;

public enum TaskStatus {
    RUNNING,
    COMPLETED,
    /** 任务本身完成，但部分单元失败 */
    PARTIAL,
    FAILED,
    /** 上游失败或 run 被取消，未执行 */
    SKIPPED
}
