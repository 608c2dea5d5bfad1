package com.gdin.inspection.cognify.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 一次 pipeline 执行的状态记录。
 * <p>
 * 只有执行器修改它；每次状态迁移后执行器会把它写回关系库。
 * 查询方拿到的是 {@link #snapshot()} 的拷贝。
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineRun {

    @JsonProperty("id")
    private String id;

    @JsonProperty("dataset_id")
    private String datasetId;

    @JsonProperty("pipeline_name")
    private String pipelineName;

    @JsonProperty("status")
    private PipelineRunStatus status;

    @JsonProperty("current_task")
    private String currentTask;

    @JsonProperty("failed_task")
    private String failedTask;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("cancel_reason")
    private String cancelReason;

    @JsonProperty("total_units")
    private int totalUnits;

    @JsonProperty("completed_units")
    private int completedUnits;

    /** 增量加载时判定为已完成而跳过的文档数 */
    @JsonProperty("already_completed_units")
    private int alreadyCompletedUnits;

    /** unitId -> 失败原因 */
    @JsonProperty("failed_units")
    private Map<String, String> failedUnits = new LinkedHashMap<>();

    @JsonProperty("task_log")
    private List<TaskLogEntry> taskLog = new ArrayList<>();

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("finished_at")
    private Instant finishedAt;

    public PipelineRun(String id, String datasetId, String pipelineName) {
        this.id = id;
        this.datasetId = datasetId;
        this.pipelineName = pipelineName;
        this.status = PipelineRunStatus.STARTED;
        this.createdAt = Instant.now();
    }

    public synchronized void transitionTo(PipelineRunStatus next) {
        if (status == next) return;
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("非法的 run 状态迁移: " + status + " -> " + next + ", run=" + id);
        }
        status = next;
        if (next == PipelineRunStatus.RUNNING) {
            startedAt = Instant.now();
        }
        if (next.isTerminal()) {
            finishedAt = Instant.now();
            currentTask = null;
        }
    }

    public synchronized void taskStarted(String task) {
        currentTask = task;
        taskLog.add(TaskLogEntry.builder()
                .task(task)
                .status(TaskStatus.RUNNING)
                .startedAt(Instant.now())
                .build());
    }

    public synchronized void taskFinished(String task, TaskStatus taskStatus, int succeeded, int failed, String message) {
        TaskLogEntry entry = findOpenEntry(task).orElseGet(() -> {
            TaskLogEntry e = TaskLogEntry.builder().task(task).startedAt(Instant.now()).build();
            taskLog.add(e);
            return e;
        });
        entry.setStatus(taskStatus);
        entry.setFinishedAt(Instant.now());
        entry.setSeconds((entry.getFinishedAt().toEpochMilli() - entry.getStartedAt().toEpochMilli()) / 1000.0);
        entry.setSucceededUnits(succeeded);
        entry.setFailedUnits(failed);
        entry.setMessage(message);
    }

    public synchronized void taskSkipped(String task, String reason) {
        taskLog.add(TaskLogEntry.builder()
                .task(task)
                .status(TaskStatus.SKIPPED)
                .message(reason)
                .build());
    }

    public synchronized void unitFailed(String unitId, String reason) {
        failedUnits.putIfAbsent(unitId, reason);
    }

    public synchronized void fail(String task, String message) {
        failedTask = task;
        errorMessage = message;
        transitionTo(PipelineRunStatus.FAILED);
    }

    public synchronized void cancel(String reason) {
        cancelReason = reason;
        fail(currentTask, "cancelled: " + reason);
    }

    @JsonIgnore
    public synchronized boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public synchronized PipelineRun snapshot() {
        PipelineRun copy = new PipelineRun();
        copy.id = id;
        copy.datasetId = datasetId;
        copy.pipelineName = pipelineName;
        copy.status = status;
        copy.currentTask = currentTask;
        copy.failedTask = failedTask;
        copy.errorMessage = errorMessage;
        copy.cancelReason = cancelReason;
        copy.totalUnits = totalUnits;
        copy.completedUnits = completedUnits;
        copy.alreadyCompletedUnits = alreadyCompletedUnits;
        copy.failedUnits = new LinkedHashMap<>(failedUnits);
        List<TaskLogEntry> log = new ArrayList<>(taskLog.size());
        for (TaskLogEntry e : taskLog) {
            log.add(TaskLogEntry.builder()
                    .task(e.getTask())
                    .status(e.getStatus())
                    .startedAt(e.getStartedAt())
                    .finishedAt(e.getFinishedAt())
                    .seconds(e.getSeconds())
                    .succeededUnits(e.getSucceededUnits())
                    .failedUnits(e.getFailedUnits())
                    .message(e.getMessage())
                    .build());
        }
        copy.taskLog = log;
        copy.createdAt = createdAt;
        copy.startedAt = startedAt;
        copy.finishedAt = finishedAt;
        return copy;
    }

    private Optional<TaskLogEntry> findOpenEntry(String task) {
        for (int i = taskLog.size() - 1; i >= 0; i--) {
            TaskLogEntry e = taskLog.get(i);
            if (e.getTask().equals(task) && e.getStatus() == TaskStatus.RUNNING) return Optional.of(e);
        }
        return Optional.empty();
    }
}
