package com.gdin.inspection.cognify.query;

import com.gdin.inspection.cognify.exception.RetrievalUnavailableException;
import com.gdin.inspection.cognify.index.embed.DataPointEmbedder;
import com.gdin.inspection.cognify.storage.vector.VectorMatch;
import com.gdin.inspection.cognify.storage.vector.VectorStore;
import com.gdin.inspection.cognify.util.RetryExecutor;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 向量检索：查询向量化后在向量库做近邻检索，结果按相似度降序。
 */
@Slf4j
@Service
public class SemanticRetriever {

    @Resource
    private DataPointEmbedder dataPointEmbedder;

    @Resource
    private VectorStore vectorStore;

    @Resource
    private RetryExecutor retryExecutor;

    /**
     * @throws RetrievalUnavailableException 向量模型或向量库不可用
     */
    public List<SearchHit> retrieve(String query, String datasetId, int topK) {
        List<VectorMatch> matches;
        try {
            float[] vector = dataPointEmbedder.embedQuery(query);
            matches = retryExecutor.call("vector.search", () -> vectorStore.search(vector, topK, datasetId));
        } catch (RuntimeException e) {
            throw new RetrievalUnavailableException(SearchMode.SEMANTIC, "向量检索不可用: " + e.getMessage(), e);
        }
        List<SearchHit> hits = new ArrayList<>(matches.size());
        for (VectorMatch m : matches) {
            hits.add(SearchHit.builder()
                    .id(m.getId())
                    .type(m.getType())
                    .score(m.getScore())
                    .semanticScore(m.getScore())
                    .snippet(m.getText())
                    .metadata(m.getMetadata())
                    .build());
        }
        return hits;
    }
}
