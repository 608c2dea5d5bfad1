package com.gdin.inspection.cognify.index.update;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.cognify.index.extract.CandidateEntity;
import com.gdin.inspection.cognify.index.extract.CandidateRelation;
import com.gdin.inspection.cognify.index.extract.ExtractedGraph;
import com.gdin.inspection.cognify.index.ontology.OntologyResolver;
import com.gdin.inspection.cognify.index.ontology.OntologySnapshot;
import com.gdin.inspection.cognify.index.ontology.ResolvedType;
import com.gdin.inspection.cognify.models.DocumentChunk;
import com.gdin.inspection.cognify.models.Edge;
import com.gdin.inspection.cognify.models.EdgeKey;
import com.gdin.inspection.cognify.models.EntityRelation;
import com.gdin.inspection.cognify.models.GraphEntity;
import com.gdin.inspection.cognify.models.GraphEntityType;
import com.gdin.inspection.cognify.models.Relations;
import com.gdin.inspection.cognify.storage.graph.GraphEdge;
import com.gdin.inspection.cognify.storage.graph.GraphNode;
import com.gdin.inspection.cognify.storage.graph.GraphNodeMapper;
import com.gdin.inspection.cognify.storage.graph.GraphStore;
import com.gdin.inspection.cognify.util.DataPointIds;
import com.gdin.inspection.cognify.util.RetryExecutor;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把一个分片的候选实体、候选关系与图库现状对齐。
 * <ol>
 *     <li>候选类型经本体映射，实体 id 由 (dataset, 规范化名称) 确定；</li>
 *     <li>按 id 精确查图库中已存在的实体（不扫全图），命中则合并，否则新建；</li>
 *     <li>关系按 (source, relation, target) 查已存在的边，命中只追加 provenance；</li>
 *     <li>补上结构边：分片 is_part_of 文档、分片 contains 实体、实体 is_a 类型。</li>
 * </ol>
 * 输出与候选顺序无关：同一批候选无论以什么顺序出现，合并结果相同。
 */
@Slf4j
@Service
public class GraphDeduplicator {

    public static final String DEFAULT_RELATION = "related_to";

    @Resource
    private GraphStore graphStore;

    @Resource
    private RetryExecutor retryExecutor;

    @Resource
    private OntologyResolver ontologyResolver;

    @Resource
    private EntityMergeService entityMergeService;

    @Resource
    private RelationshipMergeService relationshipMergeService;

    public DeduplicationResult deduplicate(DocumentChunk chunk, ExtractedGraph graph, OntologySnapshot snapshot) {
        String datasetId = chunk.getDatasetId();
        String chunkId = chunk.getId();

        // 1) 候选实体 → 实体 + 类型
        Map<String, GraphEntityType> types = new LinkedHashMap<>();
        List<GraphEntity> candidates = new ArrayList<>();
        for (CandidateEntity c : graph.getEntities()) {
            if (StrUtil.isBlank(DataPointIds.normalizeName(c.getName()))) continue;
            ResolvedType resolved = ontologyResolver.resolve(c.getName(), c.getType(), snapshot);
            String typeId = DataPointIds.entityTypeId(datasetId, resolved.getTypeName());
            types.putIfAbsent(typeId, GraphEntityType.builder()
                    .id(typeId)
                    .datasetId(datasetId)
                    .name(resolved.getTypeName())
                    .ontologyValid(resolved.isOntologyValid())
                    .build());
            candidates.add(GraphEntity.builder()
                    .id(DataPointIds.entityId(datasetId, c.getName()))
                    .datasetId(datasetId)
                    .name(c.getName().trim())
                    .typeId(typeId)
                    .typeName(resolved.getTypeName())
                    .ontologyValid(resolved.isOntologyValid())
                    .description(StrUtil.nullToEmpty(c.getDescription()).trim())
                    .build());
        }
        List<GraphEntity> collapsed = entityMergeService.collapse(candidates);
        Map<String, GraphEntity> byId = new LinkedHashMap<>();
        for (GraphEntity e : collapsed) {
            byId.put(e.getId(), e);
        }

        // 2) 候选关系：两端都必须是本分片抽出的实体
        List<Edge> extractedEdges = new ArrayList<>();
        int dropped = 0;
        for (CandidateRelation r : graph.getRelations()) {
            String sourceId = DataPointIds.entityId(datasetId, r.getSource());
            String targetId = DataPointIds.entityId(datasetId, r.getTarget());
            GraphEntity source = byId.get(sourceId);
            if (source == null || !byId.containsKey(targetId)) {
                log.debug("关系端点不在本分片的实体中，丢弃: chunk={}, {} -[{}]-> {}",
                        chunkId, r.getSource(), r.getLabel(), r.getTarget());
                dropped++;
                continue;
            }
            String label = StrUtil.blankToDefault(DataPointIds.normalizeRelation(r.getLabel()), DEFAULT_RELATION);
            EntityRelation relation = EntityRelation.builder().label(label).targetId(targetId).build();
            if (source.getRelations().stream().noneMatch(x -> x.asKey().equals(relation.asKey()))) {
                source.getRelations().add(relation);
            }
            Edge edge = edge(datasetId, sourceId, label, targetId, chunkId);
            if (StrUtil.isNotBlank(r.getDescription())) edge.getProperties().put("description", r.getDescription());
            if (r.getStrength() != null) edge.getProperties().put("strength", r.getStrength());
            extractedEdges.add(edge);
        }
        byId.values().forEach(e -> e.getRelations().sort(Comparator.comparing(EntityRelation::asKey)));

        // 3) 与图库现有实体合并（按 id 精确查询）
        Map<String, GraphNode> existingNodes = new HashMap<>();
        if (!byId.isEmpty()) {
            List<String> ids = new ArrayList<>(byId.keySet());
            for (GraphNode node : retryExecutor.call("graph.getNodes", () -> graphStore.getNodes(ids))) {
                if (GraphNodeMapper.isEntity(node)) existingNodes.put(node.getId(), node);
            }
        }
        List<GraphEntity> entities = new ArrayList<>();
        int newEntities = 0;
        int merged = 0;
        int conflicts = 0;
        for (GraphEntity incoming : byId.values()) {
            GraphNode node = existingNodes.get(incoming.getId());
            if (node == null) {
                entities.add(incoming);
                newEntities++;
                continue;
            }
            EntityMergeService.MergeOutcome outcome = entityMergeService.merge(GraphNodeMapper.toEntity(node), incoming);
            if (outcome.isTypeConflict()) conflicts++;
            entities.add(outcome.getEntity());
            merged++;
        }
        // 类型以先提交的为准：只保留最终仍被引用的类型节点，已提交的类型节点在图库中已存在
        Map<String, GraphEntityType> referencedTypes = new LinkedHashMap<>();
        for (GraphEntity e : entities) {
            GraphEntityType t = types.get(e.getTypeId());
            if (t != null) referencedTypes.putIfAbsent(t.getId(), t);
        }

        // 4) 结构边
        List<Edge> edges = new ArrayList<>(relationshipMergeService.collapse(extractedEdges));
        edges.add(edge(datasetId, chunkId, Relations.IS_PART_OF, chunk.getDocumentId(), chunkId));
        for (GraphEntity e : entities) {
            edges.add(edge(datasetId, chunkId, Relations.CONTAINS, e.getId(), chunkId));
            if (e.getTypeId() != null) {
                edges.add(edge(datasetId, e.getId(), Relations.IS_A, e.getTypeId(), chunkId));
            }
            chunk.addContains(e.getId());
        }
        edges = relationshipMergeService.collapse(edges);

        // 5) 边与图库现有边比对
        List<EdgeKey> keys = edges.stream().map(Edge::key).toList();
        Map<EdgeKey, GraphEdge> existingEdges = new HashMap<>();
        for (GraphEdge ge : retryExecutor.call("graph.getEdges", () -> graphStore.getEdges(keys))) {
            existingEdges.put(ge.key(), ge);
        }
        int newEdges = 0;
        int known = 0;
        for (Edge e : edges) {
            GraphEdge existing = existingEdges.get(e.key());
            if (existing == null) {
                newEdges++;
            } else {
                known++;
                Set<String> provenance = new LinkedHashSet<>(GraphNodeMapper.provenance(existing));
                provenance.addAll(e.getProvenance());
                e.setProvenance(provenance);
            }
        }

        if (conflicts > 0 || dropped > 0) {
            log.info("chunk {} 去重完成: 新实体 {}, 合并 {}, 新边 {}, 已有边 {}, 类型冲突 {}, 丢弃关系 {}",
                    chunkId, newEntities, merged, newEdges, known, conflicts, dropped);
        }
        return DeduplicationResult.builder()
                .chunkId(chunkId)
                .entities(entities)
                .entityTypes(new ArrayList<>(referencedTypes.values()))
                .edges(edges)
                .newEntities(newEntities)
                .mergedEntities(merged)
                .newEdges(newEdges)
                .existingEdges(known)
                .typeConflicts(conflicts)
                .droppedRelations(dropped)
                .build();
    }

    static Edge edge(String datasetId, String sourceId, String relation, String targetId, String chunkId) {
        EdgeKey key = new EdgeKey(sourceId, relation, targetId);
        Edge edge = Edge.builder()
                .id(DataPointIds.edgeId(datasetId, key))
                .datasetId(datasetId)
                .sourceId(sourceId)
                .relation(relation)
                .targetId(targetId)
                .build();
        edge.addProvenance(chunkId);
        return edge;
    }
}
