package com.gdin.inspection.cognify.index.pipeline;

import com.gdin.inspection.cognify.index.pipeline.context.PipelineRunContext;

/**
 * pipeline 中的一个任务。
 * <p>
 * 抛出 {@link com.gdin.inspection.cognify.exception.FatalPipelineException} 时整个 run 停止；
 * 其它异常只让下游任务跳过。单元级失败应记到 context 上，而不是抛出。
 *
 * @param <C> run 级配置
 */
@FunctionalInterface
public interface WorkflowFunction<C> {
    WorkflowFunctionOutput run(C config, PipelineRunContext context) throws Exception;
}
