package com.gdin.inspection.cognify.index.pipeline.context;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.cognify.exception.UnitInputException;
import com.gdin.inspection.cognify.models.PipelineRun;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 一次 run 的上下文：任务之间传递的数据、单元失败记录、取消标记。
 * <p>
 * 输入错误的单元只被剔除；其它单元失败（抽取失败、重试耗尽）剔除后还会让 run 最终失败，
 * 但不影响其它单元继续写入。
 */
@Slf4j
@Getter
public class PipelineRunContext {

    private final PipelineRun run;
    private final PipelineRunStats stats = new PipelineRunStats();
    private final Map<String, Object> state = new ConcurrentHashMap<>();

    private final Set<String> failedUnitIds = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicInteger> failuresByTask = new ConcurrentHashMap<>();

    /** 第一个导致 run 失败的单元错误：task + message */
    private final AtomicReference<String[]> runFailure = new AtomicReference<>();

    private final AtomicReference<String> cancelReason = new AtomicReference<>();

    public PipelineRunContext(PipelineRun run) {
        this.run = run;
    }

    public String getDatasetId() {
        return run.getDatasetId();
    }

    public void put(String key, Object value) { state.put(key, value); }

    @SuppressWarnings("unchecked")
    public <T> T get(String key) { return (T) state.get(key); }

    public void unitFailed(String task, String unitId, Throwable cause) {
        String message = StrUtil.blankToDefault(cause.getMessage(), cause.getClass().getSimpleName());
        failedUnitIds.add(unitId);
        failuresByTask.computeIfAbsent(task, k -> new AtomicInteger()).incrementAndGet();
        run.unitFailed(unitId, task + ": " + message);
        if (cause instanceof UnitInputException) {
            log.warn("单元输入错误，跳过: run={}, task={}, unit={}, error={}", run.getId(), task, unitId, message);
        } else {
            log.error("单元执行失败: run={}, task={}, unit={}", run.getId(), task, unitId, cause);
            runFailure.compareAndSet(null, new String[]{task, "unit " + unitId + " failed: " + message});
        }
    }

    public boolean isUnitFailed(String unitId) {
        return failedUnitIds.contains(unitId);
    }

    public int failedUnits(String task) {
        AtomicInteger n = failuresByTask.get(task);
        return n == null ? 0 : n.get();
    }

    public boolean hasRunFailure() {
        return runFailure.get() != null;
    }

    public String runFailureTask() {
        String[] f = runFailure.get();
        return f == null ? null : f[0];
    }

    public String runFailureMessage() {
        String[] f = runFailure.get();
        return f == null ? null : f[1];
    }

    public void requestCancel(String reason) {
        cancelReason.compareAndSet(null, StrUtil.blankToDefault(reason, "cancelled by user"));
    }

    public boolean isCancelRequested() {
        return cancelReason.get() != null;
    }

    public String cancelReason() {
        return cancelReason.get();
    }
}
