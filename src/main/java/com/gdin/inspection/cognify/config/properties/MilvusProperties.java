package com.gdin.inspection.cognify.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.ai.milvus")
@Component
public class MilvusProperties implements Serializable {
    private String uri = "http://localhost:19530";
    private String token;
    private String collectionName = "cognify_data_points";
    private Integer dimension = 1024;
    private Integer upsertBatchSize = 1000;
}
