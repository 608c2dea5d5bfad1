package com.gdin.inspection.cognify.index.update;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.cognify.models.Edge;
import com.gdin.inspection.cognify.models.EdgeKey;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 边按 (source, relation, target) 聚合：id 与属性取第一条，provenance 取并集。
 */
@Service
public class RelationshipMergeService {

    public List<Edge> collapse(List<Edge> edges) {
        if (CollectionUtil.isEmpty(edges)) return new ArrayList<>();

        Map<EdgeKey, List<Edge>> grouped = new LinkedHashMap<>();
        for (Edge e : edges) {
            if (e == null || e.getSourceId() == null || e.getTargetId() == null) continue;
            grouped.computeIfAbsent(e.key(), k -> new ArrayList<>()).add(e);
        }

        List<Edge> aggregated = new ArrayList<>(grouped.size());
        for (List<Edge> items : grouped.values()) {
            Edge first = items.get(0);
            LinkedHashSet<String> provenance = new LinkedHashSet<>();
            Map<String, Object> props = new LinkedHashMap<>();
            for (Edge e : items) {
                provenance.addAll(e.getProvenance());
                e.getProperties().forEach(props::putIfAbsent);
            }
            aggregated.add(Edge.builder()
                    .id(first.getId())
                    .datasetId(first.getDatasetId())
                    .sourceId(first.getSourceId())
                    .relation(first.getRelation())
                    .targetId(first.getTargetId())
                    .provenance(provenance)
                    .properties(props)
                    .build());
        }
        return aggregated;
    }
}
