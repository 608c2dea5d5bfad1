package com.gdin.inspection.cognify.query;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.cognify.exception.RetrievalUnavailableException;
import com.gdin.inspection.cognify.storage.graph.GraphEdge;
import com.gdin.inspection.cognify.storage.graph.GraphNode;
import com.gdin.inspection.cognify.storage.graph.GraphNodeMapper;
import com.gdin.inspection.cognify.storage.graph.GraphQueryResult;
import com.gdin.inspection.cognify.storage.graph.GraphStore;
import com.gdin.inspection.cognify.storage.graph.GraphTraversal;
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
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 图检索：先确定锚点实体（显式给出，或查询文本中提到的实体名），再做广度优先遍历。
 * 节点得分 1 / (1 + 跳数)；实体的摘要是与它相连的三元组。
 */
@Slf4j
@Service
public class StructuralRetriever {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int MAX_NGRAM = 3;
    private static final int MAX_TRIPLETS = 5;

    @Resource
    private GraphStore graphStore;

    @Resource
    private RetryExecutor retryExecutor;

    /**
     * @throws RetrievalUnavailableException 图库不可用
     */
    public List<SearchHit> retrieve(String query, String anchorEntity, String datasetId, int depth, int topK) {
        try {
            List<GraphNode> anchors = findAnchors(query, anchorEntity, datasetId);
            if (anchors.isEmpty()) {
                log.debug("结构检索未找到锚点实体: query={}", query);
                return new ArrayList<>();
            }
            GraphTraversal traversal = GraphTraversal.builder()
                    .datasetId(datasetId)
                    .startIds(anchors.stream().map(GraphNode::getId).sorted().toList())
                    .maxDepth(depth)
                    .limit(Math.max(topK * 5, 50))
                    .build();
            GraphQueryResult result = retryExecutor.call("graph.query", () -> graphStore.query(traversal));
            return toHits(result, topK);
        } catch (RetrievalUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RetrievalUnavailableException(SearchMode.STRUCTURAL, "图检索不可用: " + e.getMessage(), e);
        }
    }

    List<GraphNode> findAnchors(String query, String anchorEntity, String datasetId) {
        Set<String> names = new LinkedHashSet<>();
        if (StrUtil.isNotBlank(anchorEntity)) {
            names.add(DataPointIds.normalizeName(anchorEntity));
        } else {
            names.addAll(ngrams(query));
        }
        if (names.isEmpty()) return List.of();
        List<GraphNode> nodes = retryExecutor.call("graph.findNodesByName",
                () -> graphStore.findNodesByName(datasetId, names));
        return nodes.stream()
                .filter(GraphNodeMapper::isEntity)
                .sorted(Comparator.comparing(GraphNode::getId))
                .toList();
    }

    static Set<String> ngrams(String query) {
        Set<String> out = new LinkedHashSet<>();
        if (StrUtil.isBlank(query)) return out;
        List<String> tokens = new ArrayList<>();
        for (String t : TOKEN_SPLIT.split(query.toLowerCase(Locale.ROOT))) {
            if (!t.isEmpty()) tokens.add(t);
        }
        for (int n = 1; n <= MAX_NGRAM; n++) {
            for (int i = 0; i + n <= tokens.size(); i++) {
                out.add(String.join("_", tokens.subList(i, i + n)));
            }
        }
        out.add(DataPointIds.normalizeName(query));
        return out;
    }

    private List<SearchHit> toHits(GraphQueryResult result, int topK) {
        Map<String, GraphNode> byId = new HashMap<>();
        for (GraphNode n : result.getNodes()) {
            byId.put(n.getId(), n);
        }
        Map<String, List<String>> triplets = new LinkedHashMap<>();
        for (GraphEdge e : result.getEdges()) {
            GraphNode s = byId.get(e.getSourceId());
            GraphNode t = byId.get(e.getTargetId());
            if (s == null || t == null) continue;
            String triplet = label(s) + " " + e.getRelation() + " " + label(t);
            triplets.computeIfAbsent(e.getSourceId(), k -> new ArrayList<>()).add(triplet);
            triplets.computeIfAbsent(e.getTargetId(), k -> new ArrayList<>()).add(triplet);
        }

        List<SearchHit> hits = new ArrayList<>();
        for (GraphNode n : result.getNodes()) {
            int hops = result.getHops().getOrDefault(n.getId(), 0);
            double score = 1.0 / (1 + hops);
            hits.add(SearchHit.builder()
                    .id(n.getId())
                    .type(n.getLabel())
                    .score(score)
                    .structuralScore(score)
                    .hops(hops)
                    .snippet(snippet(n, triplets.getOrDefault(n.getId(), List.of())))
                    .build());
        }
        hits.sort(Comparator.comparingDouble(SearchHit::getScore).reversed().thenComparing(SearchHit::getId));
        return hits.size() > topK ? new ArrayList<>(hits.subList(0, topK)) : hits;
    }

    private static String snippet(GraphNode n, List<String> triplets) {
        if (GraphNodeMapper.isEntity(n) && !triplets.isEmpty()) {
            List<String> sorted = triplets.stream().distinct().sorted().limit(MAX_TRIPLETS).toList();
            return String.join("; ", sorted);
        }
        String text = n.stringProperty(GraphNodeMapper.TEXT);
        return text != null ? StrUtil.brief(text, 300) : label(n);
    }

    private static String label(GraphNode n) {
        String name = n.stringProperty(GraphNodeMapper.NAME);
        return name != null ? name : n.getId();
    }
}
