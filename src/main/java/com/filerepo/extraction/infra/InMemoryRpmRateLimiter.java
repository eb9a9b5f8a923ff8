package com.filerepo.extraction.infra;

import java.time.Duration;

public class InMemoryRpmRateLimiter implements RateLimiter {

    private final InMemoryDualRateLimiter dualLimiter;

    public InMemoryRpmRateLimiter(int rpmLimit, Duration maxWait) {
        this.dualLimiter = new InMemoryDualRateLimiter(rpmLimit, Integer.MAX_VALUE, maxWait);
    }

    @Override
    public void acquire(String key, int permits) {
        this.dualLimiter.acquire(key, 1);
    }
}
