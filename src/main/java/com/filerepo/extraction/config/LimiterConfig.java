package com.filerepo.extraction.config;

import com.filerepo.extraction.infra.InMemoryDualRateLimiter;
import com.filerepo.extraction.infra.InMemoryRpmRateLimiter;
import com.filerepo.extraction.infra.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LimiterConfig {

    @Value("${app.limits.max-wait-seconds:30}")
    private long maxWaitSeconds;

    @Bean("ocrLimiter")
    public RateLimiter ocrLimiter(@Value("${app.limits.ocr-rpm:60}") int rpm) {
        return new InMemoryRpmRateLimiter(rpm, Duration.ofSeconds(maxWaitSeconds));
    }

    @Bean("embeddingLimiter")
    public RateLimiter embeddingLimiter(
        @Value("${app.limits.embedding-rpm:300}") int rpm,
        @Value("${app.limits.embedding-tpm:1000000}") int tpm
    ) {
        return new InMemoryDualRateLimiter(rpm, tpm, Duration.ofSeconds(maxWaitSeconds));
    }
}
