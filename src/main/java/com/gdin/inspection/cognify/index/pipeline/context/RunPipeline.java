package com.gdin.inspection.cognify.index.pipeline.context;

import com.gdin.inspection.cognify.exception.FatalPipelineException;
import com.gdin.inspection.cognify.index.pipeline.Pipeline;
import com.gdin.inspection.cognify.index.pipeline.WorkflowFunctionOutput;
import com.gdin.inspection.cognify.models.PipelineRun;
import com.gdin.inspection.cognify.models.PipelineRunStatus;
import com.gdin.inspection.cognify.models.TaskStatus;
import com.gdin.inspection.cognify.storage.TriStoreWriter;
import com.gdin.inspection.cognify.storage.relational.RelationalStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 按拓扑序执行 pipeline，维护 run 的状态机：Started → Running → Completed | Failed。
 * <ul>
 *     <li>任务产出的 flush 数据先写入关系库，下游任务才开始；</li>
 *     <li>任务整体失败时只跳过它的下游任务，已写入的数据保留；致命错误跳过全部剩余任务；</li>
 *     <li>取消只在任务边界生效，正在执行的任务会跑完；</li>
 *     <li>每次状态变化后 run 记录写回关系库。</li>
 * </ul>
 */
@Slf4j
public class RunPipeline<C> {

    private final TriStoreWriter writer;
    private final RelationalStore relationalStore;

    public RunPipeline(TriStoreWriter writer, RelationalStore relationalStore) {
        this.writer = writer;
        this.relationalStore = relationalStore;
    }

    public List<PipelineRunResult> run(Pipeline<C> pipeline, C config, PipelineRunContext context) {
        long start = System.nanoTime();
        PipelineRun run = context.getRun();
        List<PipelineRunResult> results = new ArrayList<>();

        List<Pipeline.Step<C>> steps;
        try {
            steps = pipeline.ordered();
        } catch (FatalPipelineException e) {
            log.error("pipeline {} 结构错误", pipeline.getName(), e);
            run.fail(null, e.getMessage());
            save(run);
            return results;
        }

        run.transitionTo(PipelineRunStatus.RUNNING);
        save(run);
        log.info("run {} 开始: pipeline={}, dataset={}, tasks={}", run.getId(), pipeline.getName(), run.getDatasetId(), steps.size());

        Set<String> blocked = new LinkedHashSet<>();
        String failedTask = null;
        String failedMessage = null;
        boolean halted = false;

        for (Pipeline.Step<C> step : steps) {
            String task = step.getName();
            if (halted) {
                run.taskSkipped(task, "pipeline halted");
                continue;
            }
            if (context.isCancelRequested()) {
                log.warn("run {} 在任务 {} 之前被取消: {}", run.getId(), task, context.cancelReason());
                run.cancel(context.cancelReason());
                run.taskSkipped(task, "cancelled");
                halted = true;
                continue;
            }
            if (blocked.contains(task)) {
                run.taskSkipped(task, "upstream task failed");
                results.add(PipelineRunResult.builder().workflow(task).status(TaskStatus.SKIPPED).build());
                continue;
            }

            run.taskStarted(task);
            save(run);
            long t0 = System.nanoTime();
            try {
                WorkflowFunctionOutput out = step.getFn().run(config, context);
                if (out != null && !out.getFlush().isEmpty()) {
                    writer.persistMetadata(out.getFlush());
                }
                double sec = (System.nanoTime() - t0) / 1_000_000_000.0;
                int failed = context.failedUnits(task);
                context.getStats().taskFinished(task, sec, failed);
                int succeeded = out == null ? 0 : out.getSucceededUnits();
                TaskStatus status = failed > 0 ? TaskStatus.PARTIAL : TaskStatus.COMPLETED;
                run.taskFinished(task, status, succeeded, failed, null);
                save(run);
                log.info("run {} 任务 {} 完成: status={}, succeeded={}, failed={}, {}s",
                        run.getId(), task, status, succeeded, failed, String.format("%.2f", sec));
                results.add(PipelineRunResult.builder()
                        .workflow(task)
                        .status(status)
                        .result(out == null ? null : out.getResult())
                        .build());

                if (out != null && out.isStop()) {
                    log.info("Pipeline halted by workflow request: {}", task);
                    halted = true;
                }
            } catch (Exception e) {
                log.error("error running workflow {}, run={}", task, run.getId(), e);
                run.taskFinished(task, TaskStatus.FAILED, 0, context.failedUnits(task), e.getMessage());
                save(run);
                results.add(PipelineRunResult.builder()
                        .workflow(task)
                        .status(TaskStatus.FAILED)
                        .errors(List.of(e))
                        .build());
                if (failedTask == null) {
                    failedTask = task;
                    failedMessage = e.getMessage();
                }
                if (e instanceof FatalPipelineException) {
                    halted = true;
                } else {
                    blocked.addAll(pipeline.downstreamOf(task));
                }
            }
        }

        if (!run.isTerminal()) {
            if (failedTask != null) {
                run.fail(failedTask, failedMessage);
            } else if (context.hasRunFailure()) {
                run.fail(context.runFailureTask(), context.runFailureMessage());
            } else {
                run.transitionTo(PipelineRunStatus.COMPLETED);
            }
        }
        context.getStats().finish((System.nanoTime() - start) / 1_000_000_000.0);
        save(run);
        log.info("run {} 结束: status={}, failedTask={}, failedUnits={}, {}s",
                run.getId(), run.getStatus(), run.getFailedTask(), run.getFailedUnits().size(),
                String.format("%.2f", context.getStats().getTotalSeconds()));
        return results;
    }

    private void save(PipelineRun run) {
        try {
            relationalStore.savePipelineRun(run.snapshot());
        } catch (RuntimeException e) {
            log.error("run 记录写入失败: run={}", run.getId(), e);
        }
    }
}
