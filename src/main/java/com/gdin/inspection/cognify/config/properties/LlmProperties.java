package com.gdin.inspection.cognify.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.ai.llm")
@Component
public class LlmProperties implements Serializable {

    private Chat chat = new Chat();

    private Embedding embedding = new Embedding();

    @Data
    public static class Chat implements Serializable {
        private String baseUrl = "http://localhost:11434/";
        private String modelName = "qwen3:32b";
        private Double temperature = 0.0;
        private Integer timeoutSeconds = 120;
    }

    @Data
    public static class Embedding implements Serializable {
        /** ollama / hashing */
        private String provider = "ollama";
        private String baseUrl = "http://localhost:11434/";
        private String modelName = "quentinz/bge-large-zh-v1.5:latest";
        /** hashing 向量维度，需与向量库维度一致 */
        private Integer dimension = 1024;
        private Integer timeoutSeconds = 60;
    }
}
