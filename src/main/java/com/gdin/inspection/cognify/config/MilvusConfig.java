package com.gdin.inspection.cognify.config;

import com.gdin.inspection.cognify.config.properties.MilvusProperties;
import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "gdin.ai.cognify.storage", name = "vector", havingValue = "milvus")
public class MilvusConfig {
    @Resource
    private MilvusProperties milvusProperties;

    @Bean
    public MilvusClientV2 milvusClientV2() {
        ConnectConfig connectConfig = ConnectConfig.builder()
                .uri(milvusProperties.getUri())
                .token(milvusProperties.getToken())
                .build();
        MilvusClientV2 client = new MilvusClientV2(connectConfig);
        initDataPointCollection(client);
        return client;
    }

    private void initDataPointCollection(MilvusClientV2 client) {
        String collectionName = milvusProperties.getCollectionName();
        if (Boolean.TRUE.equals(client.hasCollection(HasCollectionReq.builder()
                .collectionName(collectionName)
                .build()))) {
            return;
        }
        CreateCollectionReq.CollectionSchema schema = client.createSchema();
        // 主键：数据点 id
        schema.addField(AddFieldReq.builder()
                .fieldName("id")
                .dataType(DataType.VarChar)
                .isPrimaryKey(true)
                .autoID(false)
                .maxLength(64)
                .build());
        schema.addField(AddFieldReq.builder()
                .fieldName("dataset_id")
                .dataType(DataType.VarChar)
                .maxLength(255)
                .build());
        schema.addField(AddFieldReq.builder()
                .fieldName("type")
                .dataType(DataType.VarChar)
                .maxLength(32)
                .build());
        schema.addField(AddFieldReq.builder()
                .fieldName("text")
                .dataType(DataType.VarChar)
                .maxLength(65535)
                .build());
        schema.addField(AddFieldReq.builder()
                .fieldName("metadata")
                .dataType(DataType.JSON)
                .build());
        schema.addField(AddFieldReq.builder()
                .fieldName("embedding")
                .dataType(DataType.FloatVector)
                .dimension(milvusProperties.getDimension())
                .build());

        // 创建索引
        IndexParam vectorIndex = IndexParam.builder()
                .fieldName("embedding")
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.COSINE)
                .extraParams(Map.of("M", 8, "efConstruction", 64))
                .build();
        List<IndexParam> indexParams = new ArrayList<>();
        indexParams.add(vectorIndex);
        client.createCollection(CreateCollectionReq.builder()
                .collectionName(collectionName)
                .collectionSchema(schema)
                .indexParams(indexParams)
                .build());
        log.info("已创建 Milvus collection: {}", collectionName);
    }
}
