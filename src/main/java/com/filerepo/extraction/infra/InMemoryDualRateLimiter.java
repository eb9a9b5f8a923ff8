package com.filerepo.extraction.infra;

import com.filerepo.extraction.exception.RateLimitExceededException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute plus tokens-per-minute buckets per key. Requests that would exceed
 * {@code tpmLimit} on their own are clamped to it so a single large page cannot wait forever.
 */
public class InMemoryDualRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> rpmBuckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> tpmBuckets = new ConcurrentHashMap<>();

    private final int rpmLimit;
    private final int tpmLimit;
    private final Duration maxWait;

    public InMemoryDualRateLimiter(int rpmLimit, int tpmLimit, Duration maxWait) {
        if (rpmLimit < 1 || tpmLimit < 1) {
            throw new IllegalArgumentException("Rate limits must be positive");
        }
        this.rpmLimit = rpmLimit;
        this.tpmLimit = tpmLimit;
        this.maxWait = maxWait;
    }

    private static Bucket perMinute(int limit) {
        return Bucket.builder()
            .addLimit(Bandwidth.builder().capacity(limit).refillGreedy(limit, Duration.ofMinutes(1)).build())
            .build();
    }

    @Override
    public void acquire(String key, int tokens) {
        Bucket rpmBucket = rpmBuckets.computeIfAbsent(key, k -> perMinute(rpmLimit));
        Bucket tpmBucket = tpmBuckets.computeIfAbsent(key, k -> perMinute(tpmLimit));

        int requested = Math.max(1, Math.min(tokens, tpmLimit));
        try {
            if (!rpmBucket.asBlocking().tryConsume(1, maxWait)) {
                throw new RateLimitExceededException("Request rate limit reached for " + key);
            }
            if (!tpmBucket.asBlocking().tryConsume(requested, maxWait)) {
                throw new RateLimitExceededException("Token rate limit reached for " + key);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RateLimitExceededException("Interrupted while waiting for " + key, e);
        }
    }
}
