package com.gdin.inspection.cognify.storage.vector;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.cognify.config.properties.MilvusProperties;
import com.gdin.inspection.cognify.exception.TransientStoreException;
import com.gdin.inspection.cognify.util.MilvusUtil;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.exception.MilvusClientException;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.SearchResp;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@Slf4j
@Repository
@ConditionalOnProperty(prefix = "gdin.ai.cognify.storage", name = "vector", havingValue = "milvus")
public class MilvusVectorStore implements VectorStore {

    private static final int MAX_TEXT_CHARS = 8000;
    private static final List<String> OUTPUT_FIELDS = List.of("id", "dataset_id", "type", "text", "metadata");

    private final Gson gson = new Gson();

    @Resource
    private MilvusClientV2 milvusClientV2;
    @Resource
    private MilvusUtil milvusUtil;
    @Resource
    private MilvusProperties milvusProperties;

    @Override
    public void upsert(VectorRecord record) {
        upsertAll(List.of(record));
    }

    @Override
    public void upsertAll(List<VectorRecord> records) {
        if (records.isEmpty()) return;
        List<JsonObject> rows = new ArrayList<>(records.size());
        for (VectorRecord r : records) {
            JsonObject row = new JsonObject();
            row.addProperty("id", r.getId());
            row.addProperty("dataset_id", r.getDatasetId());
            row.addProperty("type", r.getType());
            row.addProperty("text", StrUtil.sub(StrUtil.nullToEmpty(r.getText()), 0, MAX_TEXT_CHARS));
            row.add("metadata", gson.toJsonTree(r.getMetadata() == null ? Map.of() : r.getMetadata()));
            row.add("embedding", gson.toJsonTree(r.getEmbedding()));
            rows.add(row);
        }
        translate("upsert", () -> milvusUtil.upsertByBatch(milvusProperties.getCollectionName(), rows, milvusProperties.getUpsertBatchSize()));
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<VectorMatch> search(float[] queryVector, int topK, String datasetId) {
        SearchReq searchReq = SearchReq.builder()
                .collectionName(milvusProperties.getCollectionName())
                .annsField("embedding")
                .data(Collections.singletonList(new FloatVec(queryVector)))
                .filter(datasetId == null ? "" : "dataset_id == " + MilvusUtil.quote(datasetId))
                .outputFields(OUTPUT_FIELDS)
                .limit(topK)
                .build();

        SearchResp resp = translate("search", () -> milvusClientV2.search(searchReq));
        // 单 query 的结果放在 searchResults.get(0)
        List<SearchResp.SearchResult> results = resp.getSearchResults().isEmpty()
                ? List.of()
                : resp.getSearchResults().get(0);
        List<VectorMatch> out = new ArrayList<>(results.size());
        for (SearchResp.SearchResult r : results) {
            Map<String, Object> entity = r.getEntity();
            Object meta = entity.get("metadata");
            out.add(VectorMatch.builder()
                    .id(String.valueOf(r.getId()))
                    .datasetId((String) entity.get("dataset_id"))
                    .type((String) entity.get("type"))
                    .text((String) entity.get("text"))
                    .metadata(meta instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of())
                    .score(r.getScore())
                    .build());
        }
        out.sort(Comparator.comparingDouble(VectorMatch::getScore).reversed().thenComparing(VectorMatch::getId));
        return out;
    }

    @Override
    public void delete(String id) {
        translate("delete", () -> {
            milvusUtil.deleteByIds(milvusProperties.getCollectionName(), List.of(id));
            return null;
        });
    }

    @Override
    public void deleteAll(List<String> ids) {
        if (ids.isEmpty()) return;
        translate("delete", () -> {
            milvusUtil.deleteByIds(milvusProperties.getCollectionName(), new ArrayList<>(ids));
            return null;
        });
    }

    @Override
    public int count(String datasetId) {
        String filter = datasetId == null ? "id != \"\"" : "dataset_id == " + MilvusUtil.quote(datasetId);
        return (int) (long) translate("count", () -> milvusUtil.count(milvusProperties.getCollectionName(), filter));
    }

    private <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (MilvusClientException e) {
            log.warn("Milvus {} 失败: {}", operation, e.getMessage());
            throw new TransientStoreException("向量库暂时不可用: " + operation, e);
        }
    }
}
