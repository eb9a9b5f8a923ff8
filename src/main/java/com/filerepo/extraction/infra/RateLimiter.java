package com.filerepo.extraction.infra;

import java.util.function.Supplier;

public interface RateLimiter {

    /**
     * Blocks until {@code permits} are available under {@code key}.
     *
     * @throws com.filerepo.extraction.exception.RateLimitExceededException if they do not become available in time
     */
    void acquire(String key, int permits);

    default <T> T execute(String key, int permits, Supplier<T> task) {
        acquire(key, permits);
        return task.get();
    }
}
