package com.gdin.inspection.cognify.index.pipeline;

import com.gdin.inspection.cognify.exception.FatalPipelineException;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class PipelineFactory<C> {

    private final Map<String, WorkflowFunction<C>> workflows = new HashMap<>();
    private final Map<String, Map<String, List<String>>> pipelines = new HashMap<>();

    public void register(String name, WorkflowFunction<C> workflow) {
        workflows.put(name, workflow);
    }

    /**
     * @param tasks 任务名 → 上游任务名，按声明顺序
     */
    public void registerPipeline(String name, Map<String, List<String>> tasks) {
        pipelines.put(name, new LinkedHashMap<>(tasks));
    }

    public boolean hasPipeline(String name) {
        return pipelines.containsKey(name);
    }

    public Set<String> pipelineNames() {
        return pipelines.keySet();
    }

    /**
     * @throws FatalPipelineException pipeline 或其中某个任务未注册，或依赖关系不合法
     */
    public Pipeline<C> createPipeline(String pipelineName) {
        Map<String, List<String>> tasks = pipelines.get(pipelineName);
        if (tasks == null) {
            throw new FatalPipelineException("Pipeline not registered: " + pipelineName);
        }
        Pipeline<C> pipeline = new Pipeline<>(pipelineName);
        tasks.forEach((n, upstreams) -> {
            WorkflowFunction<C> wf = workflows.get(n);
            if (wf == null) {
                throw new FatalPipelineException("Workflow not registered: " + n);
            }
            pipeline.add(n, upstreams, wf);
        });
        pipeline.ordered();
        return pipeline;
    }
}
