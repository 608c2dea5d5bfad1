package com.gdin.inspection.cognify.index.workflows;

import com.gdin.inspection.cognify.index.embed.DataPointEmbedder;
import com.gdin.inspection.cognify.index.pipeline.UnitExecutor;
import com.gdin.inspection.cognify.index.pipeline.context.PipelineRunContext;
import com.gdin.inspection.cognify.index.update.DeduplicationResult;
import com.gdin.inspection.cognify.index.update.EntityMergeService;
import com.gdin.inspection.cognify.models.DataItemStatus;
import com.gdin.inspection.cognify.models.DataPoint;
import com.gdin.inspection.cognify.models.Document;
import com.gdin.inspection.cognify.models.DocumentChunk;
import com.gdin.inspection.cognify.models.Edge;
import com.gdin.inspection.cognify.models.GraphEntity;
import com.gdin.inspection.cognify.models.PipelineRun;
import com.gdin.inspection.cognify.models.Relations;
import com.gdin.inspection.cognify.storage.PersistBatch;
import com.gdin.inspection.cognify.storage.PersistReport;
import com.gdin.inspection.cognify.storage.TriStoreWriter;
import com.gdin.inspection.cognify.storage.relational.RelationalStore;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * persist_datapoints：按文档组批，向量化后交给写入器做三库写入。
 * 每个文档单独写入，写完即持久，其它文档失败不影响它。
 */
@Slf4j
@Service
public class PersistDataPointsWorkflow {

    public static final String TASK = "persist_datapoints";

    @Resource
    private TriStoreWriter triStoreWriter;

    @Resource
    private DataPointEmbedder dataPointEmbedder;

    @Resource
    private EntityMergeService entityMergeService;

    @Resource
    private RelationalStore relationalStore;

    @Resource
    private UnitExecutor unitExecutor;

    public PersistReport run(List<Document> documents,
                             Map<String, List<DocumentChunk>> chunksByDocument,
                             Map<String, DeduplicationResult> graphs,
                             Map<String, SummarizeChunksWorkflow.ChunkSummary> summaries,
                             PipelineRunContext context) {
        PipelineRun run = context.getRun();
        List<Document> ready = documents.stream()
                .filter(d -> chunksByDocument.containsKey(d.getId()))
                .toList();

        List<PersistReport> reports = unitExecutor.map(TASK, ready, Document::getId, doc -> {
            List<DocumentChunk> chunks = chunksByDocument.get(doc.getId()).stream()
                    .filter(c -> !context.isUnitFailed(c.getId()))
                    .toList();
            PersistBatch batch = documentBatch(doc, chunks, graphs, summaries);
            dataPointEmbedder.embed(batch.getDataPoints());
            PersistReport report = triStoreWriter.persist(batch);

            boolean complete = chunks.size() == chunksByDocument.get(doc.getId()).size();
            relationalStore.saveDataItemStatus(doc.getId(), run.getPipelineName(), run.getDatasetId(),
                    complete ? DataItemStatus.COMPLETED : DataItemStatus.FAILED);
            if (complete) {
                synchronized (run) {
                    run.setCompletedUnits(run.getCompletedUnits() + 1);
                }
            }
            return report;
        }, context);

        PersistReport total = new PersistReport();
        reports.forEach(total::add);

        // 切片阶段就失败的文档
        for (Document d : documents) {
            if (context.isUnitFailed(d.getId())) {
                relationalStore.saveDataItemStatus(d.getId(), run.getPipelineName(), run.getDatasetId(), DataItemStatus.FAILED);
            }
        }
        return total;
    }

    PersistBatch documentBatch(Document doc,
                               List<DocumentChunk> chunks,
                               Map<String, DeduplicationResult> graphs,
                               Map<String, SummarizeChunksWorkflow.ChunkSummary> summaries) {
        PersistBatch.PersistBatchBuilder batch = PersistBatch.builder().dataPoint(doc);
        List<GraphEntity> entities = new ArrayList<>();
        Map<String, DataPoint> types = new LinkedHashMap<>();
        List<Edge> edges = new ArrayList<>();

        for (DocumentChunk chunk : chunks) {
            batch.dataPoint(chunk);
            DeduplicationResult graph = graphs.get(chunk.getId());
            if (graph != null) {
                entities.addAll(graph.getEntities());
                graph.getEntityTypes().forEach(t -> types.putIfAbsent(t.getId(), t));
                edges.addAll(graph.getEdges());
            }
            SummarizeChunksWorkflow.ChunkSummary summary = summaries.get(chunk.getId());
            if (summary != null) {
                batch.dataPoint(summary.getSummary());
                edges.add(summary.getMadeFrom());
            }
        }

        // 同一文档内多个分片抽到同一实体时先合并，类型按固定规则挑选，与分片顺序无关
        List<GraphEntity> collapsed = entityMergeService.collapse(entities);
        Map<String, String> finalType = new HashMap<>();
        for (GraphEntity e : collapsed) {
            finalType.put(e.getId(), e.getTypeId());
        }
        List<Edge> kept = new ArrayList<>(edges.size());
        for (Edge e : edges) {
            if (Relations.IS_A.equals(e.getRelation()) && finalType.containsKey(e.getSourceId())
                    && !e.getTargetId().equals(finalType.get(e.getSourceId()))) {
                continue;
            }
            kept.add(e);
        }
        types.keySet().retainAll(finalType.values());

        // 节点在边之前：类型 → 实体 → 摘要已在上面加入
        types.values().forEach(batch::dataPoint);
        collapsed.forEach(batch::dataPoint);
        kept.forEach(batch::edge);
        return batch.build();
    }
}
