package com.gdin.inspection.cognify.storage.graph;

import com.gdin.inspection.cognify.models.EdgeKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * 图库。节点按 id MERGE，边按 (source, relation, target) MERGE。
 * 写边前两端节点必须已存在，否则抛出异常。
 */
public interface GraphStore {

    void upsertNode(GraphNode node);

    void upsertEdge(GraphEdge edge);

    /**
     * 删除节点及与之相连的所有边。不存在的 id 忽略。
     */
    void deleteNodes(Collection<String> ids);

    void deleteEdges(Collection<EdgeKey> keys);

    Optional<GraphNode> getNode(String id);

    List<GraphNode> getNodes(Collection<String> ids);

    List<GraphEdge> getEdges(Collection<EdgeKey> keys);

    /**
     * 按规范化名称查实体节点。
     */
    List<GraphNode> findNodesByName(String datasetId, Collection<String> normalizedNames);

    /**
     * 与给定节点相连的所有边（不分方向）。
     */
    List<GraphEdge> neighbors(Collection<String> nodeIds, String datasetId);

    int countNodes(String datasetId);

    int countEdges(String datasetId);

    default GraphQueryResult query(GraphTraversal traversal) {
        Map<String, Integer> hops = new LinkedHashMap<>();
        Map<EdgeKey, GraphEdge> edges = new LinkedHashMap<>();
        TreeSet<String> frontier = new TreeSet<>();
        for (GraphNode start : getNodes(traversal.getStartIds())) {
            hops.put(start.getId(), 0);
            frontier.add(start.getId());
        }
        for (int depth = 1; depth <= traversal.getMaxDepth() && !frontier.isEmpty() && hops.size() < traversal.getLimit(); depth++) {
            TreeSet<String> next = new TreeSet<>();
            List<GraphEdge> around = new ArrayList<>(neighbors(frontier, traversal.getDatasetId()));
            around.sort(Comparator.comparing((GraphEdge e) -> e.key().toString()));
            for (GraphEdge e : around) {
                for (String other : List.of(e.getSourceId(), e.getTargetId())) {
                    if (!hops.containsKey(other) && hops.size() < traversal.getLimit()) {
                        hops.put(other, depth);
                        next.add(other);
                    }
                }
                if (hops.containsKey(e.getSourceId()) && hops.containsKey(e.getTargetId())) {
                    edges.putIfAbsent(e.key(), e);
                }
            }
            frontier = next;
        }
        Map<String, GraphNode> byId = new HashMap<>();
        for (GraphNode n : getNodes(hops.keySet())) {
            byId.put(n.getId(), n);
        }
        List<GraphNode> nodes = hops.keySet().stream()
                .filter(byId::containsKey)
                .sorted(Comparator.comparing((String id) -> hops.get(id)).thenComparing(id -> id))
                .map(byId::get)
                .toList();
        return GraphQueryResult.builder()
                .nodes(nodes)
                .edges(new ArrayList<>(edges.values()))
                .hops(hops)
                .build();
    }
}
