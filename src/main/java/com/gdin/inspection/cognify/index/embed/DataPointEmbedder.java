package com.gdin.inspection.cognify.index.embed;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.exceptions.ExceptionUtil;
import com.gdin.inspection.cognify.exception.CognifyException;
import com.gdin.inspection.cognify.exception.TransientStoreException;
import com.gdin.inspection.cognify.models.DataPoint;
import com.gdin.inspection.cognify.util.RetryExecutor;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * 给可向量化的数据点批量生成向量，已有向量的数据点跳过。
 */
@Slf4j
@Service
public class DataPointEmbedder {

    private static final int BATCH_SIZE = 32;

    @Resource
    private EmbeddingModel embeddingModel;

    @Resource
    private RetryExecutor retryExecutor;

    public void embed(List<? extends DataPoint> dataPoints) {
        List<DataPoint> pending = dataPoints.stream()
                .filter(DataPoint::isEmbeddable)
                .filter(dp -> dp.getEmbedding() == null)
                .map(DataPoint.class::cast)
                .toList();
        for (List<DataPoint> batch : CollUtil.split(pending, BATCH_SIZE)) {
            List<TextSegment> segments = batch.stream()
                    .map(dp -> TextSegment.from(dp.embeddableText()))
                    .toList();
            List<Embedding> embeddings = retryExecutor.call("embedding.embedAll", () -> {
                try {
                    return embeddingModel.embedAll(segments).content();
                } catch (RuntimeException e) {
                    if (ExceptionUtil.isCausedBy(e, IOException.class)) {
                        throw new TransientStoreException("向量模型调用失败: " + e.getMessage(), e);
                    }
                    throw e;
                }
            });
            if (embeddings == null || embeddings.size() != batch.size()) {
                throw new CognifyException("向量模型返回数量不符: expected=" + batch.size()
                        + ", actual=" + (embeddings == null ? 0 : embeddings.size()));
            }
            for (int i = 0; i < batch.size(); i++) {
                batch.get(i).setEmbedding(embeddings.get(i).vector());
            }
        }
        log.debug("向量化完成: {} 个数据点", pending.size());
    }

    public float[] embedQuery(String query) {
        return retryExecutor.call("embedding.embed", () -> embeddingModel.embed(query).content().vector());
    }
}
