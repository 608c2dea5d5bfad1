package com.gdin.inspection.cognify.util;

import cn.hutool.core.collection.CollectionUtil;
import com.google.gson.JsonObject;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.QueryReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.response.QueryResp;
import io.milvus.v2.service.vector.response.UpsertResp;
import jakarta.annotation.Resource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

@Component
@ConditionalOnProperty(prefix = "gdin.ai.cognify.storage", name = "vector", havingValue = "milvus")
public class MilvusUtil {
    @Resource
    private MilvusClientV2 milvusClientV2;

    public UpsertResp upsertByBatch(String collectionName, List<JsonObject> datas, int batchSize) {
        if (CollectionUtil.isEmpty(datas)) return UpsertResp.builder().upsertCnt(0L).build();

        UpsertResp lastResp = null;
        for (int i = 0; i < datas.size(); i += batchSize) {
            List<JsonObject> subList = datas.subList(i, Math.min(i + batchSize, datas.size()));

            lastResp = milvusClientV2.upsert(UpsertReq.builder()
                    .collectionName(collectionName)
                    .data(subList)
                    .build());
        }
        return lastResp == null ? UpsertResp.builder().upsertCnt(0L).build() : lastResp;
    }

    public void deleteByIds(String collectionName, List<Object> ids) {
        if (CollectionUtil.isEmpty(ids)) return;
        milvusClientV2.delete(DeleteReq.builder()
                .collectionName(collectionName)
                .ids(ids)
                .build());
    }

    public long count(String collectionName, String filter) {
        QueryResp resp = milvusClientV2.query(QueryReq.builder()
                .collectionName(collectionName)
                .filter(filter == null ? "" : filter)
                .outputFields(Collections.singletonList("count(*)"))
                .build());
        if (resp == null || CollectionUtil.isEmpty(resp.getQueryResults())) return 0L;
        Object n = resp.getQueryResults().get(0).getEntity().get("count(*)");
        return n instanceof Number num ? num.longValue() : 0L;
    }

    /**
     * 字符串字面量转义，用于拼接 filter 表达式。
     */
    public static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
