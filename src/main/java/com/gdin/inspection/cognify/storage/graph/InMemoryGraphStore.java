package com.gdin.inspection.cognify.storage.graph;

import com.gdin.inspection.cognify.exception.CognifyException;
import com.gdin.inspection.cognify.models.EdgeKey;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(prefix = "gdin.ai.cognify.storage", name = "graph", havingValue = "memory", matchIfMissing = true)
public class InMemoryGraphStore implements GraphStore {

    private final Map<String, GraphNode> nodes = new ConcurrentHashMap<>();
    private final Map<EdgeKey, GraphEdge> edges = new ConcurrentHashMap<>();
    private final Map<String, Set<EdgeKey>> adjacency = new ConcurrentHashMap<>();

    @Override
    public void upsertNode(GraphNode node) {
        nodes.merge(node.getId(), node, (old, fresh) -> {
            Map<String, Object> props = new LinkedHashMap<>(old.getProperties());
            props.putAll(fresh.getProperties());
            return fresh.toBuilder().properties(props).build();
        });
    }

    @Override
    public synchronized void upsertEdge(GraphEdge edge) {
        if (!nodes.containsKey(edge.getSourceId()) || !nodes.containsKey(edge.getTargetId())) {
            throw new CognifyException("边的端点不存在: " + edge.key());
        }
        edges.put(edge.key(), edge);
        adjacency.computeIfAbsent(edge.getSourceId(), k -> ConcurrentHashMap.newKeySet()).add(edge.key());
        adjacency.computeIfAbsent(edge.getTargetId(), k -> ConcurrentHashMap.newKeySet()).add(edge.key());
    }

    @Override
    public synchronized void deleteNodes(Collection<String> ids) {
        for (String id : ids) {
            Set<EdgeKey> incident = adjacency.remove(id);
            if (incident != null) deleteEdges(new ArrayList<>(incident));
            nodes.remove(id);
        }
    }

    @Override
    public synchronized void deleteEdges(Collection<EdgeKey> keys) {
        for (EdgeKey key : keys) {
            if (edges.remove(key) == null) continue;
            for (String end : List.of(key.sourceId(), key.targetId())) {
                Set<EdgeKey> adj = adjacency.get(end);
                if (adj != null) adj.remove(key);
            }
        }
    }

    @Override
    public Optional<GraphNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    @Override
    public List<GraphNode> getNodes(Collection<String> ids) {
        return ids.stream().distinct().map(nodes::get).filter(Objects::nonNull).toList();
    }

    @Override
    public List<GraphEdge> getEdges(Collection<EdgeKey> keys) {
        return keys.stream().distinct().map(edges::get).filter(Objects::nonNull).toList();
    }

    @Override
    public List<GraphNode> findNodesByName(String datasetId, Collection<String> normalizedNames) {
        Set<String> wanted = new HashSet<>(normalizedNames);
        return nodes.values().stream()
                .filter(n -> datasetId == null || datasetId.equals(n.getDatasetId()))
                .filter(n -> wanted.contains(n.stringProperty(GraphNodeMapper.NORMALIZED_NAME)))
                .toList();
    }

    @Override
    public List<GraphEdge> neighbors(Collection<String> nodeIds, String datasetId) {
        Set<EdgeKey> keys = new LinkedHashSet<>();
        for (String id : nodeIds) {
            keys.addAll(adjacency.getOrDefault(id, Set.of()));
        }
        List<GraphEdge> out = new ArrayList<>();
        for (EdgeKey k : keys) {
            GraphEdge e = edges.get(k);
            if (e != null && (datasetId == null || datasetId.equals(e.getDatasetId()))) out.add(e);
        }
        return out;
    }

    @Override
    public int countNodes(String datasetId) {
        return (int) nodes.values().stream().filter(n -> datasetId == null || datasetId.equals(n.getDatasetId())).count();
    }

    @Override
    public int countEdges(String datasetId) {
        return (int) edges.values().stream().filter(e -> datasetId == null || datasetId.equals(e.getDatasetId())).count();
    }
}
