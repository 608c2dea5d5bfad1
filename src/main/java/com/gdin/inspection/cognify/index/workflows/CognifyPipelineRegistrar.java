package com.gdin.inspection.cognify.index.workflows;

import com.gdin.inspection.cognify.index.pipeline.PipelineFactory;
import com.gdin.inspection.cognify.index.pipeline.WorkflowFunctionOutput;
import com.gdin.inspection.cognify.index.update.DeduplicationResult;
import com.gdin.inspection.cognify.index.update.EntityMergeService;
import com.gdin.inspection.cognify.models.DataPoint;
import com.gdin.inspection.cognify.models.Document;
import com.gdin.inspection.cognify.models.DocumentChunk;
import com.gdin.inspection.cognify.models.GraphEntity;
import com.gdin.inspection.cognify.models.RawDocument;
import com.gdin.inspection.cognify.storage.PersistBatch;
import com.gdin.inspection.cognify.storage.PersistReport;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.Resource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 注册 cognify pipeline：
 * <pre>
 * classify_documents → chunk_documents → extract_graph    ↘
 *                                      → summarize_chunks → persist_datapoints
 * </pre>
 */
@Component
public class CognifyPipelineRegistrar {

    public static final String COGNIFY = "cognify";

    public static final String CLASSIFY_DOCUMENTS = "classify_documents";
    public static final String CHUNK_DOCUMENTS = ChunkDocumentsWorkflow.TASK;
    public static final String EXTRACT_GRAPH = ExtractGraphWorkflow.TASK;
    public static final String SUMMARIZE_CHUNKS = SummarizeChunksWorkflow.TASK;
    public static final String PERSIST_DATAPOINTS = PersistDataPointsWorkflow.TASK;

    @Resource
    private PipelineFactory<Object> factory;
    @Resource
    private ClassifyDocumentsWorkflow classifyDocumentsWorkflow;
    @Resource
    private ChunkDocumentsWorkflow chunkDocumentsWorkflow;
    @Resource
    private ExtractGraphWorkflow extractGraphWorkflow;
    @Resource
    private SummarizeChunksWorkflow summarizeChunksWorkflow;
    @Resource
    private PersistDataPointsWorkflow persistDataPointsWorkflow;
    @Resource
    private EntityMergeService entityMergeService;

    @PostConstruct
    public void init() {

        // 1) classify_documents
        factory.register(CLASSIFY_DOCUMENTS, (cfg, ctx) -> {
            List<RawDocument> raw = ctx.get("raw_documents");
            List<Document> documents = classifyDocumentsWorkflow.run(raw, ctx.getRun());
            ctx.put("documents", documents);
            return WorkflowFunctionOutput.builder()
                    .result("classify_documents_done")
                    .succeededUnits(documents.size())
                    .flush(PersistBatch.builder().dataPoints(documents).build())
                    .stop(documents.isEmpty())
                    .build();
        });

        // 2) chunk_documents
        factory.register(CHUNK_DOCUMENTS, (cfg, ctx) -> {
            Map<String, List<DocumentChunk>> byDocument = chunkDocumentsWorkflow.run(ctx.get("documents"), ctx);
            List<DocumentChunk> chunks = new ArrayList<>();
            byDocument.values().forEach(chunks::addAll);
            ctx.put("chunks_by_document", byDocument);
            ctx.put("chunks", chunks);
            return WorkflowFunctionOutput.builder()
                    .result("chunk_documents_done")
                    .succeededUnits(byDocument.size())
                    .flush(PersistBatch.builder().dataPoints(chunks).build())
                    .build();
        });

        // 3) extract_graph
        factory.register(EXTRACT_GRAPH, (cfg, ctx) -> {
            Map<String, DeduplicationResult> graphs = extractGraphWorkflow.run(ctx.get("chunks"), ctx);
            ctx.put("graphs", graphs);

            List<GraphEntity> entities = new ArrayList<>();
            Map<String, DataPoint> types = new LinkedHashMap<>();
            for (DeduplicationResult r : graphs.values()) {
                entities.addAll(r.getEntities());
                r.getEntityTypes().forEach(t -> types.putIfAbsent(t.getId(), t));
            }
            // 跨文档合并后落选的类型不刷写
            List<GraphEntity> collapsed = entityMergeService.collapse(entities);
            Set<String> referenced = collapsed.stream().map(GraphEntity::getTypeId).collect(Collectors.toSet());
            types.keySet().retainAll(referenced);
            return WorkflowFunctionOutput.builder()
                    .result("extract_graph_done")
                    .succeededUnits(graphs.size())
                    .flush(PersistBatch.builder()
                            .dataPoints(types.values())
                            .dataPoints(collapsed)
                            .build())
                    .build();
        });

        // 4) summarize_chunks
        factory.register(SUMMARIZE_CHUNKS, (cfg, ctx) -> {
            Map<String, SummarizeChunksWorkflow.ChunkSummary> summaries =
                    summarizeChunksWorkflow.run(ctx.get("chunks"), ctx);
            ctx.put("summaries", summaries);
            List<DataPoint> summaryPoints = new ArrayList<>();
            for (SummarizeChunksWorkflow.ChunkSummary s : summaries.values()) {
                summaryPoints.add(s.getSummary());
            }
            return WorkflowFunctionOutput.builder()
                    .result("summarize_chunks_done")
                    .succeededUnits(summaries.size())
                    .flush(PersistBatch.builder().dataPoints(summaryPoints).build())
                    .build();
        });

        // 5) persist_datapoints
        factory.register(PERSIST_DATAPOINTS, (cfg, ctx) -> {
            Map<String, DeduplicationResult> graphs = ctx.get("graphs");
            Map<String, SummarizeChunksWorkflow.ChunkSummary> summaries = ctx.get("summaries");
            Map<String, List<DocumentChunk>> byDocument = ctx.get("chunks_by_document");
            PersistReport report = persistDataPointsWorkflow.run(
                    ctx.get("documents"),
                    byDocument,
                    graphs,
                    summaries,
                    ctx);
            ctx.put("persist_report", report);
            return WorkflowFunctionOutput.builder()
                    .result(report)
                    .succeededUnits(ctx.getRun().getCompletedUnits())
                    .build();
        });

        factory.registerPipeline(COGNIFY, tasks());
    }

    private static Map<String, List<String>> tasks() {
        Map<String, List<String>> tasks = new LinkedHashMap<>();
        tasks.put(CLASSIFY_DOCUMENTS, List.of());
        tasks.put(CHUNK_DOCUMENTS, List.of(CLASSIFY_DOCUMENTS));
        tasks.put(EXTRACT_GRAPH, List.of(CHUNK_DOCUMENTS));
        tasks.put(SUMMARIZE_CHUNKS, List.of(CHUNK_DOCUMENTS));
        tasks.put(PERSIST_DATAPOINTS, List.of(EXTRACT_GRAPH, SUMMARIZE_CHUNKS));
        return tasks;
    }
}
