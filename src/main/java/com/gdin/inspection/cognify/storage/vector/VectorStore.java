package com.gdin.inspection.cognify.storage.vector;

import java.util.List;

/**
 * 向量库：按数据点 id upsert 向量，按相似度检索。
 */
public interface VectorStore {

    void upsert(VectorRecord record);

    default void upsertAll(List<VectorRecord> records) {
        for (VectorRecord r : records) {
            upsert(r);
        }
    }

    /**
     * 结果按分数降序，分数相同按 id 升序。
     */
    List<VectorMatch> search(float[] queryVector, int topK, String datasetId);

    void delete(String id);

    default void deleteAll(List<String> ids) {
        for (String id : ids) {
            delete(id);
        }
    }

    int count(String datasetId);
}
