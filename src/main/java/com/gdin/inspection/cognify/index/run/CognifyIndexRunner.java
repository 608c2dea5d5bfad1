package com.gdin.inspection.cognify.index.run;

import cn.hutool.core.thread.ThreadFactoryBuilder;
import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.cognify.config.properties.CognifyProperties;
import com.gdin.inspection.cognify.exception.FatalPipelineException;
import com.gdin.inspection.cognify.index.pipeline.Pipeline;
import com.gdin.inspection.cognify.index.pipeline.PipelineFactory;
import com.gdin.inspection.cognify.index.pipeline.context.PipelineRunContext;
import com.gdin.inspection.cognify.index.pipeline.context.RunPipeline;
import com.gdin.inspection.cognify.index.update.DocumentDeletionService;
import com.gdin.inspection.cognify.models.PipelineRun;
import com.gdin.inspection.cognify.models.RawDocument;
import com.gdin.inspection.cognify.storage.DeletionReport;
import com.gdin.inspection.cognify.storage.TriStoreWriter;
import com.gdin.inspection.cognify.storage.relational.RelationalStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 认知化入口：提交数据集文档，创建 run 并执行 pipeline。
 * 同一时刻每个 run 只有一个执行线程修改其状态。
 */
@Slf4j
@Service
public class CognifyIndexRunner {

    @Resource
    private CognifyProperties cognifyProperties;

    @Resource
    private PipelineFactory<Object> factory;

    @Resource
    private TriStoreWriter triStoreWriter;

    @Resource
    private RelationalStore relationalStore;

    @Resource
    private DocumentDeletionService documentDeletionService;

    private final Map<String, PipelineRunContext> active = new ConcurrentHashMap<>();

    private ExecutorService runnerPool;

    @PostConstruct
    public void init() {
        int threads = Math.max(1, cognifyProperties.getPipeline().getRunnerThreads());
        runnerPool = Executors.newFixedThreadPool(threads,
                ThreadFactoryBuilder.create().setNamePrefix("cognify-run-").build());
    }

    @PreDestroy
    public void shutdown() {
        active.values().forEach(ctx -> ctx.requestCancel("application shutdown"));
        runnerPool.shutdown();
    }

    /**
     * 异步执行，立即返回 run id。
     */
    public String submit(String datasetId, String pipelineName, List<RawDocument> documents) {
        PipelineRunContext ctx = prepare(datasetId, pipelineName, documents);
        Pipeline<Object> pipeline = factory.createPipeline(ctx.getRun().getPipelineName());
        runnerPool.submit(() -> execute(pipeline, ctx));
        return ctx.getRun().getId();
    }

    public PipelineRun runSync(String datasetId, String pipelineName, List<RawDocument> documents) {
        PipelineRunContext ctx = prepare(datasetId, pipelineName, documents);
        execute(factory.createPipeline(ctx.getRun().getPipelineName()), ctx);
        return ctx.getRun().snapshot();
    }

    public Optional<PipelineRun> status(String runId) {
        PipelineRunContext ctx = active.get(runId);
        if (ctx != null) return Optional.of(ctx.getRun().snapshot());
        return relationalStore.findPipelineRun(runId);
    }

    public List<PipelineRun> listRuns(String datasetId) {
        return relationalStore.listPipelineRuns(datasetId);
    }

    /**
     * 请求取消。当前任务跑完后 run 转为 Failed 并记录取消原因。
     *
     * @return run 仍在执行且取消请求已登记
     */
    public boolean cancel(String runId, String reason) {
        PipelineRunContext ctx = active.get(runId);
        if (ctx == null || ctx.getRun().isTerminal()) return false;
        ctx.requestCancel(reason);
        log.info("run {} 收到取消请求: {}", runId, reason);
        return true;
    }

    /**
     * 从三库删除一个文档及只属于它的子图。
     *
     * @return 文档不存在时返回 empty
     */
    public Optional<DeletionReport> deleteDocument(String datasetId, String documentId) {
        if (StrUtil.isBlank(datasetId) || StrUtil.isBlank(documentId)) {
            throw new IllegalArgumentException("datasetId 与 documentId 不能为空");
        }
        return documentDeletionService.delete(datasetId, documentId);
    }

    private PipelineRunContext prepare(String datasetId, String pipelineName, List<RawDocument> documents) {
        if (StrUtil.isBlank(datasetId)) {
            throw new IllegalArgumentException("datasetId 不能为空");
        }
        String name = StrUtil.blankToDefault(pipelineName, cognifyProperties.getPipeline().getDefaultName());
        if (!factory.hasPipeline(name)) {
            throw new FatalPipelineException("Pipeline not registered: " + name);
        }
        PipelineRun run = new PipelineRun(IdUtil.fastSimpleUUID(), datasetId, name);
        PipelineRunContext ctx = new PipelineRunContext(run);
        ctx.put("raw_documents", documents == null ? List.of() : documents);
        relationalStore.savePipelineRun(run.snapshot());
        active.put(run.getId(), ctx);
        log.info("run {} 已创建: dataset={}, pipeline={}, documents={}",
                run.getId(), datasetId, name, documents == null ? 0 : documents.size());
        return ctx;
    }

    private void execute(Pipeline<Object> pipeline, PipelineRunContext ctx) {
        try {
            new RunPipeline<Object>(triStoreWriter, relationalStore).run(pipeline, null, ctx);
        } finally {
            active.remove(ctx.getRun().getId());
        }
    }
}
