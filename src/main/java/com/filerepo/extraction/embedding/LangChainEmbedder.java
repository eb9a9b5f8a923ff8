package com.filerepo.extraction.embedding;

import com.filerepo.extraction.exception.DimensionMismatchException;
import com.filerepo.extraction.exception.EmbedderUnavailableException;
import com.filerepo.extraction.exception.EmptyInputException;
import com.filerepo.extraction.infra.RateLimiter;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class LangChainEmbedder implements Embedder {

    public static final String EMBEDDING_LIMIT = "embedding_limit";

    private final EmbeddingModel embeddingModel;
    private final RateLimiter embeddingLimiter;
    private final int dimension;
    private final int maxChars;

    public LangChainEmbedder(
        EmbeddingModel embeddingModel,
        @Qualifier("embeddingLimiter") RateLimiter embeddingLimiter,
        @Value("${app.embedding.dimension:768}") int dimension,
        @Value("${app.embedding.max-chars:8000}") int maxChars
    ) {
        this.embeddingModel = embeddingModel;
        this.embeddingLimiter = embeddingLimiter;
        this.dimension = dimension;
        this.maxChars = maxChars;
    }

    @Override
    @Retryable(
        retryFor = EmbedderUnavailableException.class,
        maxAttemptsExpression = "${app.indexing.retry.max-attempts:3}",
        backoff = @Backoff(
            delayExpression = "${app.indexing.retry.backoff-ms:500}",
            multiplierExpression = "${app.indexing.retry.multiplier:2.0}"))
    public float[] embed(String inputText) {
        if (inputText == null || inputText.isBlank()) {
            throw new EmptyInputException("Text to embed cannot be empty");
        }

        String text = inputText.trim();
        if (text.length() > maxChars) {
            log.debug("Truncating text from {} to {} chars before embedding", text.length(), maxChars);
            text = text.substring(0, maxChars);
        }

        String input = text;
        int estimatedTokens = input.length() / 4;

        Response<Embedding> response;
        try {
            response = embeddingLimiter.execute(EMBEDDING_LIMIT, estimatedTokens, () -> embeddingModel.embed(input));
        } catch (RuntimeException e) {
            log.warn("Embedding call failed: {}", e.getMessage());
            throw new EmbedderUnavailableException("Embedding backend unavailable: " + e.getMessage(), e);
        }

        float[] vector = response == null || response.content() == null ? null : response.content().vector();
        if (vector == null || vector.length == 0) {
            throw new EmbedderUnavailableException("Embedding model returned an empty vector");
        }
        if (vector.length != dimension) {
            throw new DimensionMismatchException(dimension, vector.length);
        }
        if (isZero(vector)) {
            throw new EmbedderUnavailableException("Embedding model returned a zero vector");
        }
        return vector;
    }

    private static boolean isZero(float[] vector) {
        for (float component : vector) {
            if (component != 0f) {
                return false;
            }
        }
        return true;
    }
}
