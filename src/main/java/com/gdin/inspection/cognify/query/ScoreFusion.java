package com.gdin.inspection.cognify.query;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 两路结果的确定性融合。
 * <p>
 * 每一路分数先做 min-max 归一化到 [0,1]（只有一个结果或所有分数相同时记为 1.0），
 * fused = wSemantic * s + wStructural * g，缺失的一路按 0 计；
 * 排序：fused 降序，语义分数降序，id 升序。
 */
public final class ScoreFusion {

    private ScoreFusion() {
    }

    public static List<SearchHit> fuse(List<SearchHit> semantic,
                                       List<SearchHit> structural,
                                       double semanticWeight,
                                       double structuralWeight,
                                       int topK) {
        Map<String, Double> s = normalize(semantic);
        Map<String, Double> g = normalize(structural);

        Map<String, SearchHit> merged = new LinkedHashMap<>();
        Map<String, Double> rawSemantic = new HashMap<>();
        for (SearchHit h : semantic) {
            merged.putIfAbsent(h.getId(), h);
            rawSemantic.putIfAbsent(h.getId(), h.getScore());
        }
        Map<String, SearchHit> structuralById = new HashMap<>();
        for (SearchHit h : structural) {
            structuralById.putIfAbsent(h.getId(), h);
            merged.putIfAbsent(h.getId(), h);
        }

        List<SearchHit> out = new ArrayList<>(merged.size());
        for (SearchHit h : merged.values()) {
            double fused = semanticWeight * s.getOrDefault(h.getId(), 0.0)
                    + structuralWeight * g.getOrDefault(h.getId(), 0.0);
            SearchHit st = structuralById.get(h.getId());
            out.add(h.toBuilder()
                    .score(fused)
                    .semanticScore(rawSemantic.get(h.getId()))
                    .structuralScore(st == null ? null : st.getScore())
                    .hops(st == null ? h.getHops() : st.getHops())
                    .build());
        }
        out.sort(Comparator.comparingDouble(SearchHit::getScore).reversed()
                .thenComparing((SearchHit h) -> h.getSemanticScore() == null ? Double.NEGATIVE_INFINITY : h.getSemanticScore(),
                        Comparator.reverseOrder())
                .thenComparing(SearchHit::getId));
        return out.size() > topK ? new ArrayList<>(out.subList(0, topK)) : out;
    }

    static Map<String, Double> normalize(List<SearchHit> hits) {
        Map<String, Double> out = new HashMap<>();
        if (hits.isEmpty()) return out;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (SearchHit h : hits) {
            min = Math.min(min, h.getScore());
            max = Math.max(max, h.getScore());
        }
        double range = max - min;
        for (SearchHit h : hits) {
            double v = range == 0 ? 1.0 : (h.getScore() - min) / range;
            out.putIfAbsent(h.getId(), v);
        }
        return out;
    }
}
