package com.filerepo.extraction.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Gemini clients for OCR and embeddings. Backoff retries live in the adapters, so client-level
 * retries default to a single attempt.
 */
@Configuration
public class LangChainConfig {

    @Value("${app.gemini.api-key}")
    private String apiKey;

    @Value("${app.gemini.timeout-seconds:60}")
    private long timeoutSeconds;

    @Value("${app.gemini.max-retries:1}")
    private int maxRetries;

    @Bean
    public ChatModel visionModel(@Value("${app.gemini.chat-model:gemini-2.5-flash}") String modelName) {
        return GoogleAiGeminiChatModel.builder()
            .apiKey(apiKey)
            .modelName(modelName)
            .temperature(0.0)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .maxRetries(maxRetries)
            .build();
    }

    @Bean
    public EmbeddingModel embeddingModel(
        @Value("${app.gemini.embedding-model:gemini-embedding-001}") String modelName,
        @Value("${app.embedding.dimension:768}") int dimension
    ) {
        return GoogleAiEmbeddingModel.builder()
            .apiKey(apiKey)
            .modelName(modelName)
            .outputDimensionality(dimension)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .maxRetries(maxRetries)
            .build();
    }
}
