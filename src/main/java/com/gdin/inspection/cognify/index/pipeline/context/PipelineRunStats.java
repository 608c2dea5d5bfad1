package com.gdin.inspection.cognify.index.pipeline.context;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单次 run 的耗时统计，按任务执行顺序记录。
 */
@Getter
public class PipelineRunStats {

    private final Map<String, Double> workflowSeconds = new LinkedHashMap<>();

    private final Map<String, Integer> failedUnits = new LinkedHashMap<>();

    private double totalSeconds;

    public synchronized void taskFinished(String task, double seconds, int failed) {
        workflowSeconds.put(task, seconds);
        if (failed > 0) failedUnits.put(task, failed);
    }

    public synchronized void finish(double seconds) {
        this.totalSeconds = seconds;
    }
}
