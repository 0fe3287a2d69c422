package com.nevis.hybrid.infra;

import com.nevis.hybrid.exception.StoreTimeoutException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute plus tokens-per-minute budget per key. A caller waits at most {@code maxWait}
 * for each budget before the acquisition fails; a failed acquisition consumes neither.
 */
@Slf4j
public class InMemoryDualRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> rpmBuckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> tpmBuckets = new ConcurrentHashMap<>();

    private final int rpmLimit;
    private final int tpmLimit;
    private final Duration maxWait;

    public InMemoryDualRateLimiter(int rpmLimit, int tpmLimit, Duration maxWait) {
        this.rpmLimit = rpmLimit;
        this.tpmLimit = tpmLimit;
        this.maxWait = maxWait;
    }

    private static Bucket createBucket(int limit) {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(limit, Refill.greedy(limit, Duration.ofMinutes(1))))
            .build();
    }

    @Override
    public void acquire(String key, int tokens) {
        Bucket rpmBucket = rpmBuckets.computeIfAbsent(key, k -> createBucket(rpmLimit));
        Bucket tpmBucket = tpmBuckets.computeIfAbsent(key, k -> createBucket(tpmLimit));

        // a single request larger than the whole budget still has to be admitted eventually
        int tpmTokens = Math.max(1, Math.min(tokens, tpmLimit));
        boolean requestTaken = false;
        boolean acquired = false;
        try {
            if (!rpmBucket.asBlocking().tryConsume(1, maxWait)) {
                throw timeout(key, "request budget exhausted");
            }
            requestTaken = true;
            if (!tpmBucket.asBlocking().tryConsume(tpmTokens, maxWait)) {
                throw timeout(key, "token budget exhausted");
            }
            acquired = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreTimeoutException("rateLimit:" + key, "interrupted while waiting", e);
        } finally {
            if (requestTaken && !acquired) {
                rpmBucket.addTokens(1);
            }
        }
    }

    private StoreTimeoutException timeout(String key, String reason) {
        log.warn("Rate limit '{}' not acquired within {}: {}", key, maxWait, reason);
        return new StoreTimeoutException("rateLimit:" + key, reason + " for " + maxWait, null);
    }

    @Override
    public void release(String key, int permits) {
    }
}
