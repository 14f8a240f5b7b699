package com.contractdocs.rag.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import lombok.SneakyThrows;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute limiter keyed by call category. Callers over the limit
 * block until the bucket refills; nothing is rejected or retried.
 */
public class InMemoryRpmRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final int rpmLimit;

    public InMemoryRpmRateLimiter(int rpmLimit) {
        if (rpmLimit <= 0) {
            throw new IllegalArgumentException("rpmLimit must be positive");
        }
        this.rpmLimit = rpmLimit;
    }

    private Bucket createBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(rpmLimit)
                .refillGreedy(rpmLimit, Duration.ofMinutes(1))
                .build())
            .build();
    }

    @Override
    @SneakyThrows
    public void acquire(String key, int permits) {
        buckets.computeIfAbsent(key, k -> createBucket())
            .asBlocking()
            .consume(permits);
    }
}
