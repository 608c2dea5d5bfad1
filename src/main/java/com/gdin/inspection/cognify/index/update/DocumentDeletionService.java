package com.gdin.inspection.cognify.index.update;

import com.gdin.inspection.cognify.models.DataPointType;
import com.gdin.inspection.cognify.models.Edge;
import com.gdin.inspection.cognify.models.EdgeKey;
import com.gdin.inspection.cognify.models.EntityRelation;
import com.gdin.inspection.cognify.models.GraphEntity;
import com.gdin.inspection.cognify.models.Relations;
import com.gdin.inspection.cognify.storage.DeletionPlan;
import com.gdin.inspection.cognify.storage.DeletionReport;
import com.gdin.inspection.cognify.storage.IdLockRegistry;
import com.gdin.inspection.cognify.storage.TriStoreWriter;
import com.gdin.inspection.cognify.storage.graph.GraphEdge;
import com.gdin.inspection.cognify.storage.graph.GraphNode;
import com.gdin.inspection.cognify.storage.graph.GraphNodeMapper;
import com.gdin.inspection.cognify.storage.graph.GraphStore;
import com.gdin.inspection.cognify.storage.relational.RelationalStore;
import com.gdin.inspection.cognify.util.DataPointIds;
import com.gdin.inspection.cognify.util.RetryExecutor;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 从三库中删除一个文档及其子图。
 * <ol>
 *     <li>文档节点、它的分片（is_part_of）以及分片的摘要（made_from）整体删除；</li>
 *     <li>其余边去掉来自被删分片的 provenance，provenance 为空的边删除；</li>
 *     <li>不再被任何分片 contains 的实体删除，不再被任何实体 is_a 的类型删除；</li>
 *     <li>存活实体的关系列表去掉已删除的关系边。</li>
 * </ol>
 * 实体描述是多段合并的文本，不按来源拆分，删除后保持不变。
 */
@Slf4j
@Service
public class DocumentDeletionService {

    private static final int MAX_CHUNKS_PER_DOCUMENT = 100_000;

    @Resource
    private GraphStore graphStore;

    @Resource
    private RelationalStore relationalStore;

    @Resource
    private TriStoreWriter triStoreWriter;

    @Resource
    private IdLockRegistry idLockRegistry;

    @Resource
    private RetryExecutor retryExecutor;

    /**
     * @return 文档在两个库中都不存在时返回 empty
     */
    public Optional<DeletionReport> delete(String datasetId, String documentId) {
        Optional<GraphNode> docNode = retryExecutor.call("graph.getNode", () -> graphStore.getNode(documentId))
                .filter(n -> datasetId.equals(n.getDatasetId()));
        boolean inRelational = retryExecutor.call("relational.findFingerprint",
                () -> relationalStore.findFingerprint(documentId)).isPresent();
        if (docNode.isEmpty() && !inRelational) {
            log.info("待删除的文档不存在: dataset={}, document={}", datasetId, documentId);
            return Optional.empty();
        }

        // 先找出涉及的实体并加锁，与同一实体的写入串行
        Set<String> entityIds = containedEntities(datasetId, chunkIds(datasetId, documentId));
        return Optional.of(idLockRegistry.withLocks(entityIds, () -> {
            DeletionPlan plan = plan(datasetId, documentId);
            return triStoreWriter.delete(plan);
        }));
    }

    DeletionPlan plan(String datasetId, String documentId) {
        Set<String> chunkIds = chunkIds(datasetId, documentId);
        Set<String> summaryIds = summaryIds(datasetId, chunkIds);

        Set<String> removedNodes = new LinkedHashSet<>();
        removedNodes.add(documentId);
        removedNodes.addAll(chunkIds);
        removedNodes.addAll(summaryIds);

        List<GraphEdge> around = retryExecutor.call("graph.neighbors",
                () -> graphStore.neighbors(new ArrayList<>(removedNodes), datasetId));
        Set<String> entityIds = new LinkedHashSet<>();
        for (GraphEdge e : around) {
            if (Relations.CONTAINS.equals(e.getRelation()) && chunkIds.contains(e.getSourceId())) {
                entityIds.add(e.getTargetId());
            }
        }

        Map<EdgeKey, GraphEdge> edges = new LinkedHashMap<>();
        for (GraphEdge e : around) edges.putIfAbsent(e.key(), e);
        if (!entityIds.isEmpty()) {
            for (GraphEdge e : retryExecutor.call("graph.neighbors", () -> graphStore.neighbors(entityIds, datasetId))) {
                edges.putIfAbsent(e.key(), e);
            }
        }

        // 孤立实体：没有来自其它分片的 contains 边
        Set<String> orphanEntities = new LinkedHashSet<>(entityIds);
        for (GraphEdge e : edges.values()) {
            if (Relations.CONTAINS.equals(e.getRelation()) && orphanEntities.contains(e.getTargetId())
                    && !chunkIds.contains(e.getSourceId())) {
                orphanEntities.remove(e.getTargetId());
            }
        }
        removedNodes.addAll(orphanEntities);

        Map<EdgeKey, Edge> deleted = new LinkedHashMap<>();
        Map<EdgeKey, Edge> trimmed = new LinkedHashMap<>();
        for (GraphEdge ge : edges.values()) {
            Edge edge = toEdge(datasetId, ge);
            if (removedNodes.contains(ge.getSourceId()) || removedNodes.contains(ge.getTargetId())) {
                deleted.put(ge.key(), edge);
                continue;
            }
            Set<String> provenance = retryExecutor.call("relational.findProvenance",
                    () -> relationalStore.findProvenance(edge.getId()));
            if (provenance.isEmpty()) provenance = GraphNodeMapper.provenance(ge);
            Set<String> remaining = new LinkedHashSet<>(provenance);
            remaining.removeAll(chunkIds);
            if (remaining.size() == provenance.size()) continue;
            if (remaining.isEmpty()) {
                deleted.put(ge.key(), edge);
            } else {
                edge.setProvenance(remaining);
                trimmed.put(ge.key(), edge);
            }
        }

        // 孤立类型：is_a 边全部被删除
        Set<String> typeIds = new LinkedHashSet<>();
        for (GraphEdge e : edges.values()) {
            if (Relations.IS_A.equals(e.getRelation()) && deleted.containsKey(e.key())) typeIds.add(e.getTargetId());
        }
        if (!typeIds.isEmpty()) {
            Set<String> stillTyped = new LinkedHashSet<>();
            for (GraphEdge e : retryExecutor.call("graph.neighbors", () -> graphStore.neighbors(typeIds, datasetId))) {
                if (Relations.IS_A.equals(e.getRelation()) && !deleted.containsKey(e.key())) stillTyped.add(e.getTargetId());
            }
            typeIds.removeAll(stillTyped);
        }

        DeletionPlan.DeletionPlanBuilder plan = DeletionPlan.builder()
                .datasetId(datasetId)
                .documentId(documentId)
                .chunkIds(chunkIds)
                .summaryIds(summaryIds)
                .entityIds(orphanEntities)
                .entityTypeIds(typeIds)
                .deletedEdges(deleted.values())
                .trimmedEdges(trimmed.values());
        rewrittenEntities(entityIds, orphanEntities, deleted.keySet()).forEach(plan::rewrittenEntity);
        return plan.build();
    }

    /**
     * 分片 id 由 (文档, 序号) 确定：图库中的 is_part_of 边与关系库中按序号逐个查到的行取并集。
     */
    private Set<String> chunkIds(String datasetId, String documentId) {
        Set<String> ids = new LinkedHashSet<>();
        for (GraphEdge e : retryExecutor.call("graph.neighbors", () -> graphStore.neighbors(List.of(documentId), datasetId))) {
            if (Relations.IS_PART_OF.equals(e.getRelation()) && documentId.equals(e.getTargetId())) ids.add(e.getSourceId());
        }
        for (int i = 0; i < MAX_CHUNKS_PER_DOCUMENT; i++) {
            String id = DataPointIds.chunkId(datasetId, documentId, i);
            if (retryExecutor.call("relational.findFingerprint", () -> relationalStore.findFingerprint(id)).isEmpty()) break;
            ids.add(id);
        }
        return ids;
    }

    private Set<String> summaryIds(String datasetId, Set<String> chunkIds) {
        Set<String> ids = new LinkedHashSet<>();
        if (chunkIds.isEmpty()) return ids;
        for (GraphEdge e : retryExecutor.call("graph.neighbors", () -> graphStore.neighbors(chunkIds, datasetId))) {
            if (Relations.MADE_FROM.equals(e.getRelation()) && chunkIds.contains(e.getTargetId())) ids.add(e.getSourceId());
        }
        for (String chunkId : chunkIds) {
            for (DataPointType type : List.of(DataPointType.TEXT_SUMMARY, DataPointType.CODE_SUMMARY)) {
                String id = DataPointIds.summaryId(datasetId, type, chunkId);
                if (retryExecutor.call("relational.findFingerprint", () -> relationalStore.findFingerprint(id)).isPresent()) {
                    ids.add(id);
                }
            }
        }
        return ids;
    }

    private Set<String> containedEntities(String datasetId, Set<String> chunkIds) {
        Set<String> ids = new LinkedHashSet<>();
        if (chunkIds.isEmpty()) return ids;
        for (GraphEdge e : retryExecutor.call("graph.neighbors", () -> graphStore.neighbors(chunkIds, datasetId))) {
            if (Relations.CONTAINS.equals(e.getRelation()) && chunkIds.contains(e.getSourceId())) ids.add(e.getTargetId());
        }
        return ids;
    }

    /**
     * 存活实体中，出边被删除的那部分关系从实体的关系列表中去掉。
     */
    private List<GraphEntity> rewrittenEntities(Set<String> entityIds, Set<String> orphans, Set<EdgeKey> deleted) {
        List<String> survivors = entityIds.stream().filter(id -> !orphans.contains(id)).toList();
        if (survivors.isEmpty()) return List.of();
        Map<String, GraphEntity> committed = retryExecutor.call("relational.findEntities",
                () -> relationalStore.findEntities(survivors));
        List<GraphEntity> out = new ArrayList<>();
        for (String id : survivors) {
            GraphEntity entity = committed.get(id);
            if (entity == null) {
                entity = retryExecutor.call("graph.getNode", () -> graphStore.getNode(id))
                        .map(GraphNodeMapper::toEntity)
                        .orElse(null);
            }
            if (entity == null) continue;
            List<EntityRelation> kept = new ArrayList<>();
            for (EntityRelation r : entity.getRelations()) {
                if (!deleted.contains(new EdgeKey(id, r.getLabel(), r.getTargetId()))) kept.add(r);
            }
            if (kept.size() == entity.getRelations().size()) continue;
            entity.setRelations(kept);
            out.add(entity);
        }
        return out;
    }

    private static Edge toEdge(String datasetId, GraphEdge ge) {
        Edge edge = Edge.builder()
                .id(DataPointIds.edgeId(datasetId, ge.key()))
                .datasetId(datasetId)
                .sourceId(ge.getSourceId())
                .relation(ge.getRelation())
                .targetId(ge.getTargetId())
                .build();
        for (Map.Entry<String, Object> p : ge.getProperties().entrySet()) {
            if (!GraphNodeMapper.PROVENANCE.equals(p.getKey()) && !GraphNodeMapper.EDGE_ID.equals(p.getKey())) {
                edge.getProperties().put(p.getKey(), p.getValue());
            }
        }
        edge.setProvenance(GraphNodeMapper.provenance(ge));
        return edge;
    }
}
