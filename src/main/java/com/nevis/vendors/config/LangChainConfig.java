package com.nevis.vendors.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

// retries belong to the dispatchers; the models make one attempt bounded by the call timeout
@Configuration
public class LangChainConfig {

    @Value("${app.gemini.api-key}")
    private String apiKey;

    @Value("${app.gemini.chat-model:gemini-2.5-flash}")
    private String chatModelName;

    @Value("${app.gemini.embedding-model:gemini-embedding-001}")
    private String embeddingModelName;

    @Value("${app.embedding.dimensions:768}")
    private int dimensions;

    @PostConstruct
    void requireApiKey() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("app.gemini.api-key must be set");
        }
    }

    @Bean
    public ChatModel chatLanguageModel(DispatchProperties dispatch) {
        return GoogleAiGeminiChatModel.builder()
            .apiKey(apiKey)
            .modelName(chatModelName)
            .timeout(dispatch.queryGeneration().callTimeout())
            .maxRetries(0)
            .build();
    }

    @Bean
    public EmbeddingModel embeddingModel(DispatchProperties dispatch) {
        return GoogleAiEmbeddingModel.builder()
            .apiKey(apiKey)
            .modelName(embeddingModelName)
            .outputDimensionality(dimensions)
            .timeout(dispatch.embedding().callTimeout())
            .maxRetries(0)
            .build();
    }
}
