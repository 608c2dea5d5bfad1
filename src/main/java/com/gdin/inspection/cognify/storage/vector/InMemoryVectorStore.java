package com.gdin.inspection.cognify.storage.vector;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内向量库，余弦相似度暴力检索。
 */
@Repository
@ConditionalOnProperty(prefix = "gdin.ai.cognify.storage", name = "vector", havingValue = "memory", matchIfMissing = true)
public class InMemoryVectorStore implements VectorStore {

    private final Map<String, VectorRecord> records = new ConcurrentHashMap<>();

    @Override
    public void upsert(VectorRecord record) {
        records.put(record.getId(), record);
    }

    @Override
    public List<VectorMatch> search(float[] queryVector, int topK, String datasetId) {
        return records.values().stream()
                .filter(r -> datasetId == null || datasetId.equals(r.getDatasetId()))
                .map(r -> VectorMatch.builder()
                        .id(r.getId())
                        .datasetId(r.getDatasetId())
                        .type(r.getType())
                        .text(r.getText())
                        .metadata(r.getMetadata())
                        .score(cosine(queryVector, r.getEmbedding()))
                        .build())
                .sorted(Comparator.comparingDouble(VectorMatch::getScore).reversed()
                        .thenComparing(VectorMatch::getId))
                .limit(topK)
                .toList();
    }

    @Override
    public void delete(String id) {
        records.remove(id);
    }

    @Override
    public int count(String datasetId) {
        return (int) records.values().stream()
                .filter(r -> datasetId == null || datasetId.equals(r.getDatasetId()))
                .count();
    }

    static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) return 0.0;
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 0.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
