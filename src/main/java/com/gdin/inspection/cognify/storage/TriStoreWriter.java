package com.gdin.inspection.cognify.storage;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.cognify.exception.CognifyException;
import com.gdin.inspection.cognify.index.update.EntityMergeService;
import com.gdin.inspection.cognify.models.DataPoint;
import com.gdin.inspection.cognify.models.Edge;
import com.gdin.inspection.cognify.models.GraphEntity;
import com.gdin.inspection.cognify.models.GraphEntityType;
import com.gdin.inspection.cognify.models.Relations;
import com.gdin.inspection.cognify.storage.graph.GraphNodeMapper;
import com.gdin.inspection.cognify.storage.graph.GraphStore;
import com.gdin.inspection.cognify.storage.relational.EdgeFingerprints;
import com.gdin.inspection.cognify.storage.relational.EdgeSyncState;
import com.gdin.inspection.cognify.storage.relational.RelationalStore;
import com.gdin.inspection.cognify.storage.relational.RowSyncState;
import com.gdin.inspection.cognify.storage.vector.VectorRecord;
import com.gdin.inspection.cognify.storage.vector.VectorStore;
import com.gdin.inspection.cognify.util.RetryExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 三库写入。顺序固定：关系库 → 向量库 → 图节点 → 图边。
 * <p>
 * 关系库记录每行在向量库、图库的同步标记，指纹不变且已同步的数据点整体跳过，
 * 重复写入同一批数据不会改变任何库；上一次中途失败的批次重写时只补齐未同步的部分。
 * 每一步单独重试，某一步重试耗尽后抛出异常，后续步骤不执行。
 * <p>
 * 实体以关系库中已提交的行为准：批内实体先与已提交版本合并，类型冲突时保留已提交类型，
 * 同一批中指向落选类型的 is_a 边和不再被引用的类型一并丢弃。
 * 批内实体的锁从合并一直持有到图节点写完，同一实体的并发写入按提交顺序串行。
 */
@Slf4j
@Service
public class TriStoreWriter {

    private final RelationalStore relationalStore;
    private final VectorStore vectorStore;
    private final GraphStore graphStore;
    private final RetryExecutor retryExecutor;
    private final IdLockRegistry idLockRegistry;
    private final EntityMergeService entityMergeService;

    public TriStoreWriter(RelationalStore relationalStore,
                          VectorStore vectorStore,
                          GraphStore graphStore,
                          RetryExecutor retryExecutor,
                          IdLockRegistry idLockRegistry,
                          EntityMergeService entityMergeService) {
        this.relationalStore = relationalStore;
        this.vectorStore = vectorStore;
        this.graphStore = graphStore;
        this.retryExecutor = retryExecutor;
        this.idLockRegistry = idLockRegistry;
        this.entityMergeService = entityMergeService;
    }

    /**
     * 只执行第一步（关系库），供任务间刷写元数据。
     */
    public PersistReport persistMetadata(PersistBatch batch) {
        PersistReport report = new PersistReport();
        if (batch == null || batch.isEmpty()) return report;
        validate(batch);
        return idLockRegistry.withLocks(entityIds(batch), () -> {
            writeRelational(resolveEntities(batch, report), report);
            return report;
        });
    }

    public PersistReport persist(PersistBatch batch) {
        PersistReport report = new PersistReport();
        if (batch == null || batch.isEmpty()) return report;
        validate(batch);

        idLockRegistry.withLocks(entityIds(batch), () -> {
            // 0) 实体与已提交版本合并
            PersistBatch resolved = resolveEntities(batch, report);

            // 1) 关系库
            Step1 step1 = writeRelational(resolved, report);

            // 2) 向量库
            writeVectors(step1, report);

            // 3) 图节点
            writeNodes(step1, report);

            // 4) 图边（两端节点已在上一步或更早写入）
            writeEdges(step1, report);
            return null;
        });

        if (report.isNoop()) {
            log.debug("三库写入无变化: dataPoints={}, edges={}", batch.getDataPoints().size(), batch.getEdges().size());
        } else {
            log.info("三库写入完成: rowsChanged={}, vectors={}, nodes={}, edges={}, provenanceAdded={}, typeConflicts={}",
                    report.getRowsChanged(), report.getVectorsWritten(), report.getNodesWritten(),
                    report.getEdgesWritten(), report.getProvenanceAdded(), report.getTypeConflicts());
        }
        return report;
    }

    private record Step1(Map<String, DataPoint> byId,
                         List<RowSyncState> rows,
                         Map<String, Edge> edgesById,
                         List<EdgeSyncState> edges) {
    }

    private static List<String> entityIds(PersistBatch batch) {
        return batch.getDataPoints().stream()
                .filter(dp -> dp instanceof GraphEntity)
                .map(DataPoint::getId)
                .distinct()
                .toList();
    }

    /**
     * 调用方已持有批内全部实体的锁。
     */
    private PersistBatch resolveEntities(PersistBatch batch, PersistReport report) {
        List<GraphEntity> incoming = new ArrayList<>();
        for (DataPoint dp : batch.getDataPoints()) {
            if (dp instanceof GraphEntity e) incoming.add(e);
        }
        if (incoming.isEmpty()) return batch;

        List<GraphEntity> collapsed = entityMergeService.collapse(incoming);
        List<String> ids = collapsed.stream().map(GraphEntity::getId).toList();
        Map<String, GraphEntity> committed = retryExecutor.call("relational.findEntities",
                () -> relationalStore.findEntities(ids));

        Map<String, GraphEntity> resolved = new LinkedHashMap<>();
        Map<String, String> keptType = new HashMap<>();
        Set<String> losingTypes = new HashSet<>();
        for (GraphEntity e : collapsed) {
            EntityMergeService.MergeOutcome outcome = entityMergeService.merge(committed.get(e.getId()), e);
            if (outcome.isTypeConflict()) {
                report.setTypeConflicts(report.getTypeConflicts() + 1);
                losingTypes.add(e.getTypeId());
            }
            resolved.put(e.getId(), outcome.getEntity());
            keptType.put(e.getId(), outcome.getEntity().getTypeId());
        }
        losingTypes.removeAll(keptType.values());

        PersistBatch.PersistBatchBuilder out = PersistBatch.builder();
        Set<String> emitted = new HashSet<>();
        for (DataPoint dp : batch.getDataPoints()) {
            if (dp instanceof GraphEntity) {
                if (emitted.add(dp.getId())) out.dataPoint(resolved.get(dp.getId()));
            } else if (dp instanceof GraphEntityType && losingTypes.contains(dp.getId())) {
                log.debug("类型未被任何实体采用，跳过: type={}", ((GraphEntityType) dp).getName());
            } else {
                out.dataPoint(dp);
            }
        }
        int dropped = 0;
        for (Edge e : batch.getEdges()) {
            String kept = keptType.get(e.getSourceId());
            if (Relations.IS_A.equals(e.getRelation()) && kept != null && !kept.equals(e.getTargetId())) {
                dropped++;
                continue;
            }
            out.edge(e);
        }
        if (dropped > 0) {
            log.info("丢弃指向落选类型的 is_a 边 {} 条", dropped);
        }
        return out.build();
    }

    private Step1 writeRelational(PersistBatch batch, PersistReport report) {
        // 同一批内重复 id 只保留最后一个
        Map<String, DataPoint> byId = new LinkedHashMap<>();
        for (DataPoint dp : batch.getDataPoints()) {
            byId.put(dp.getId(), dp);
        }
        Map<String, Edge> edgesById = new LinkedHashMap<>();
        for (Edge e : batch.getEdges()) {
            edgesById.merge(e.getId(), e, (a, b) -> {
                a.getProvenance().addAll(b.getProvenance());
                return a;
            });
        }
        List<DataPoint> dps = new ArrayList<>(byId.values());
        List<Edge> edges = new ArrayList<>(edgesById.values());

        List<RowSyncState> rows = dps.isEmpty() ? List.of()
                : retryExecutor.call("relational.upsertRows", () -> relationalStore.upsertRows(dps));
        List<EdgeSyncState> edgeStates = edges.isEmpty() ? List.of()
                : retryExecutor.call("relational.upsertEdges", () -> relationalStore.upsertEdges(edges));

        for (RowSyncState r : rows) {
            if (r.isChanged()) report.setRowsChanged(report.getRowsChanged() + 1);
            else report.setRowsUnchanged(report.getRowsUnchanged() + 1);
        }
        for (EdgeSyncState s : edgeStates) {
            if (s.isChanged()) report.setRowsChanged(report.getRowsChanged() + 1);
            report.setProvenanceAdded(report.getProvenanceAdded() + s.getProvenanceAdded());
        }
        return new Step1(byId, rows, edgesById, edgeStates);
    }

    private void writeVectors(Step1 step1, PersistReport report) {
        List<RowSyncState> pending = new ArrayList<>();
        List<VectorRecord> records = new ArrayList<>();
        for (RowSyncState row : step1.rows()) {
            if (row.isVectorSynced()) continue;
            DataPoint dp = step1.byId().get(row.getId());
            if (!dp.isEmbeddable()) {
                pending.add(row);
                continue;
            }
            if (dp.getEmbedding() == null) {
                log.warn("数据点缺少向量，跳过向量库写入: id={}, type={}", dp.getId(), dp.getType());
                continue;
            }
            Map<String, Object> meta = new LinkedHashMap<>(dp.getMetadata());
            records.add(VectorRecord.builder()
                    .id(dp.getId())
                    .datasetId(dp.getDatasetId())
                    .type(dp.getType().name())
                    .text(dp.embeddableText())
                    .embedding(dp.getEmbedding())
                    .metadata(meta)
                    .build());
            pending.add(row);
        }
        if (!records.isEmpty()) {
            List<String> ids = records.stream().map(VectorRecord::getId).toList();
            idLockRegistry.withLocks(ids, () -> {
                retryExecutor.run("vector.upsertAll", () -> vectorStore.upsertAll(records));
                return null;
            });
            report.setVectorsWritten(report.getVectorsWritten() + records.size());
        }
        if (!pending.isEmpty()) {
            retryExecutor.run("relational.markVectorSynced", () -> relationalStore.markVectorSynced(pending));
        }
    }

    private void writeNodes(Step1 step1, PersistReport report) {
        List<RowSyncState> pending = new ArrayList<>();
        for (RowSyncState row : step1.rows()) {
            if (row.isGraphSynced()) continue;
            DataPoint dp = step1.byId().get(row.getId());
            idLockRegistry.withLock(dp.getId(), () -> {
                retryExecutor.run("graph.upsertNode", () -> graphStore.upsertNode(GraphNodeMapper.toNode(dp)));
                return null;
            });
            report.setNodesWritten(report.getNodesWritten() + 1);
            pending.add(row);
        }
        if (!pending.isEmpty()) {
            retryExecutor.run("relational.markGraphSynced", () -> relationalStore.markGraphSynced(pending));
        }
    }

    /**
     * 写图边前在边锁内重读关系库中的 provenance，写入的总是当前的并集；
     * 只有写入的指纹仍等于关系库当前指纹时才置同步标记。
     */
    private void writeEdges(Step1 step1, PersistReport report) {
        for (EdgeSyncState state : step1.edges()) {
            if (state.isGraphSynced()) continue;
            Edge edge = step1.edgesById().get(state.getId());
            EdgeSyncState written = idLockRegistry.withLock(edge.getId(), () -> {
                Set<String> current = retryExecutor.call("relational.findProvenance",
                        () -> relationalStore.findProvenance(edge.getId()));
                Set<String> provenance = current.isEmpty() ? new LinkedHashSet<>(state.getProvenance()) : current;
                retryExecutor.run("graph.upsertEdge",
                        () -> graphStore.upsertEdge(GraphNodeMapper.toEdge(edge, provenance)));
                EdgeSyncState synced = EdgeSyncState.builder()
                        .id(state.getId())
                        .key(state.getKey())
                        .fingerprint(EdgeFingerprints.of(edge.key(), provenance))
                        .provenance(provenance)
                        .changed(state.isChanged())
                        .graphSynced(true)
                        .build();
                retryExecutor.run("relational.markEdgesGraphSynced",
                        () -> relationalStore.markEdgesGraphSynced(List.of(synced)));
                return synced;
            });
            report.setEdgesWritten(report.getEdgesWritten() + 1);
            if (!written.getFingerprint().equals(state.getFingerprint())) {
                log.debug("边 {} 的 provenance 已被并发写入扩充: {} -> {}", edge.key(), state.getProvenance(), written.getProvenance());
            }
        }
    }

    /**
     * 按写入的逆序删除：图边 → 图节点 → 向量 → 关系库行 → 文档处理状态。
     * 调用方负责持有相关实体的锁。
     */
    public DeletionReport delete(DeletionPlan plan) {
        DeletionReport report = new DeletionReport();
        report.setDatasetId(plan.getDatasetId());
        report.setDocumentId(plan.getDocumentId());
        List<String> nodeIds = plan.nodeIds();

        // 1) 图边：整体删除，或改写为去掉被删分片后的 provenance
        if (!plan.getDeletedEdges().isEmpty()) {
            retryExecutor.run("graph.deleteEdges",
                    () -> graphStore.deleteEdges(plan.getDeletedEdges().stream().map(Edge::key).toList()));
        }
        for (Edge edge : plan.getTrimmedEdges()) {
            idLockRegistry.withLock(edge.getId(), () -> {
                retryExecutor.run("graph.upsertEdge",
                        () -> graphStore.upsertEdge(GraphNodeMapper.toEdge(edge, edge.getProvenance())));
                return null;
            });
        }

        // 2) 图节点
        for (GraphEntity entity : plan.getRewrittenEntities()) {
            retryExecutor.run("graph.upsertNode", () -> graphStore.upsertNode(GraphNodeMapper.toNode(entity)));
        }
        if (!nodeIds.isEmpty()) {
            retryExecutor.run("graph.deleteNodes", () -> graphStore.deleteNodes(nodeIds));
        }

        // 3) 向量
        if (!nodeIds.isEmpty()) {
            idLockRegistry.withLocks(nodeIds, () -> {
                retryExecutor.run("vector.deleteAll", () -> vectorStore.deleteAll(nodeIds));
                return null;
            });
        }

        // 4) 关系库
        if (!plan.getDeletedEdges().isEmpty()) {
            List<String> edgeIds = plan.getDeletedEdges().stream().map(Edge::getId).toList();
            retryExecutor.run("relational.deleteEdges", () -> relationalStore.deleteEdges(edgeIds));
        }
        if (!plan.getTrimmedEdges().isEmpty()) {
            List<EdgeSyncState> states = retryExecutor.call("relational.replaceEdgeProvenance",
                    () -> relationalStore.replaceEdgeProvenance(plan.getTrimmedEdges()));
            retryExecutor.run("relational.markEdgesGraphSynced", () -> relationalStore.markEdgesGraphSynced(states));
        }
        if (!plan.getRewrittenEntities().isEmpty()) {
            List<RowSyncState> rows = retryExecutor.call("relational.upsertRows",
                    () -> relationalStore.upsertRows(plan.getRewrittenEntities()));
            // 名称未变，向量库中的记录仍然有效
            retryExecutor.run("relational.markVectorSynced", () -> relationalStore.markVectorSynced(rows));
            retryExecutor.run("relational.markGraphSynced", () -> relationalStore.markGraphSynced(rows));
        }
        if (!nodeIds.isEmpty()) {
            retryExecutor.run("relational.deleteRows", () -> relationalStore.deleteRows(nodeIds));
        }

        // 5) 文档处理状态
        retryExecutor.run("relational.deleteDataItemStatus",
                () -> relationalStore.deleteDataItemStatus(plan.getDocumentId(), plan.getDatasetId()));

        report.setChunksDeleted(plan.getChunkIds().size());
        report.setSummariesDeleted(plan.getSummaryIds().size());
        report.setEntitiesDeleted(plan.getEntityIds().size());
        report.setEntityTypesDeleted(plan.getEntityTypeIds().size());
        report.setNodesDeleted(nodeIds.size());
        report.setEdgesDeleted(plan.getDeletedEdges().size());
        report.setEdgesTrimmed(plan.getTrimmedEdges().size());
        report.setEntitiesRewritten(plan.getRewrittenEntities().size());
        log.info("文档已从三库删除: dataset={}, document={}, nodes={}, edges={}, trimmedEdges={}",
                plan.getDatasetId(), plan.getDocumentId(), report.getNodesDeleted(),
                report.getEdgesDeleted(), report.getEdgesTrimmed());
        return report;
    }

    private static void validate(PersistBatch batch) {
        for (DataPoint dp : batch.getDataPoints()) {
            if (dp == null || dp.getId() == null || dp.getDatasetId() == null) {
                throw new CognifyException("数据点缺少 id 或 datasetId: " + dp);
            }
        }
        if (CollectionUtil.isNotEmpty(batch.getEdges())) {
            for (Edge e : batch.getEdges()) {
                if (e == null || e.getId() == null || e.getSourceId() == null || e.getTargetId() == null) {
                    throw new CognifyException("边缺少 id 或端点: " + e);
                }
            }
        }
    }
}
