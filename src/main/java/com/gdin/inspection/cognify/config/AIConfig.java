package com.gdin.inspection.cognify.config;

import com.gdin.inspection.cognify.config.properties.LlmProperties;
import com.gdin.inspection.cognify.index.embed.HashingEmbeddingModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import jakarta.annotation.Resource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AIConfig {

    @Resource
    private LlmProperties llmProperties;

    @Bean
    public ChatModel chatModel() {
        LlmProperties.Chat chat = llmProperties.getChat();
        return OllamaChatModel.builder()
                .baseUrl(chat.getBaseUrl())
                .modelName(chat.getModelName())
                .temperature(chat.getTemperature())
                .timeout(Duration.ofSeconds(chat.getTimeoutSeconds()))
                .build();
    }

    @Bean
    public EmbeddingModel embeddingModel() {
        LlmProperties.Embedding embedding = llmProperties.getEmbedding();
        if ("hashing".equals(embedding.getProvider())) {
            return new HashingEmbeddingModel(embedding.getDimension());
        }
        return OllamaEmbeddingModel.builder()
                .baseUrl(embedding.getBaseUrl())
                .modelName(embedding.getModelName())
                .timeout(Duration.ofSeconds(embedding.getTimeoutSeconds()))
                .build();
    }
}
