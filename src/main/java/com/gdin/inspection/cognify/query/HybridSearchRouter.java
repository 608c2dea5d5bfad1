package com.gdin.inspection.cognify.query;

import com.gdin.inspection.cognify.config.properties.CognifyProperties;
import com.gdin.inspection.cognify.exception.RetrievalUnavailableException;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 按模式分发检索。
 * <ul>
 *     <li>SEMANTIC / STRUCTURAL：单路检索，后端不可用时抛出 {@link RetrievalUnavailableException}；</li>
 *     <li>HYBRID：两路都跑后融合；一路不可用时退化为另一路（状态 DEGRADED），两路都不可用才抛出。</li>
 * </ul>
 * 空结果是正常结果，状态为 EMPTY。
 */
@Slf4j
@Service
public class HybridSearchRouter {

    @Resource
    private SemanticRetriever semanticRetriever;

    @Resource
    private StructuralRetriever structuralRetriever;

    @Resource
    private CognifyProperties cognifyProperties;

    public SearchResponse search(SearchRequest request) {
        CognifyProperties.Search cfg = cognifyProperties.getSearch();
        SearchMode mode = request.getMode() == null ? SearchMode.HYBRID : request.getMode();
        // 非正数按 1 处理
        int topK = Math.max(1, Math.min(request.getTopK() == null ? cfg.getDefaultTopK() : request.getTopK(), cfg.getMaxTopK()));
        int depth = request.getDepth() == null ? cfg.getTraversalDepth() : request.getDepth();

        return switch (mode) {
            case SEMANTIC -> respond(mode, semanticRetriever.retrieve(request.getQuery(), request.getDatasetId(), topK), List.of());
            case STRUCTURAL -> respond(mode, structural(request, depth, topK), List.of());
            case HYBRID -> hybrid(request, depth, topK, cfg);
        };
    }

    private SearchResponse hybrid(SearchRequest request, int depth, int topK, CognifyProperties.Search cfg) {
        List<SearchMode> unavailable = new ArrayList<>();
        List<SearchHit> semantic = null;
        List<SearchHit> structural = null;
        RetrievalUnavailableException last = null;
        try {
            semantic = semanticRetriever.retrieve(request.getQuery(), request.getDatasetId(), topK);
        } catch (RetrievalUnavailableException e) {
            log.warn("混合检索中向量检索不可用，退化为图检索: {}", e.getMessage());
            unavailable.add(SearchMode.SEMANTIC);
            last = e;
        }
        try {
            structural = structural(request, depth, topK);
        } catch (RetrievalUnavailableException e) {
            log.warn("混合检索中图检索不可用，退化为向量检索: {}", e.getMessage());
            unavailable.add(SearchMode.STRUCTURAL);
            last = e;
        }
        if (semantic == null && structural == null) {
            throw new RetrievalUnavailableException(unavailable, "向量检索与图检索均不可用", last);
        }
        List<SearchHit> fused = ScoreFusion.fuse(
                semantic == null ? List.of() : semantic,
                structural == null ? List.of() : structural,
                cfg.getSemanticWeight(),
                cfg.getStructuralWeight(),
                topK);
        return respond(SearchMode.HYBRID, fused, unavailable);
    }

    private List<SearchHit> structural(SearchRequest request, int depth, int topK) {
        return structuralRetriever.retrieve(request.getQuery(), request.getAnchorEntity(), request.getDatasetId(), depth, topK);
    }

    private static SearchResponse respond(SearchMode mode, List<SearchHit> hits, List<SearchMode> unavailable) {
        SearchStatus status;
        if (!unavailable.isEmpty()) status = SearchStatus.DEGRADED;
        else if (hits.isEmpty()) status = SearchStatus.EMPTY;
        else status = SearchStatus.OK;
        return SearchResponse.builder()
                .status(status)
                .mode(mode)
                .hits(hits)
                .unavailableModes(unavailable)
                .build();
    }
}
