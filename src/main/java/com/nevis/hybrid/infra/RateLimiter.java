package com.nevis.hybrid.infra;

import java.util.function.Supplier;

public interface RateLimiter {

    /**
     * Blocks until {@code permits} are available for {@code key}.
     *
     * @throws com.nevis.hybrid.exception.StoreTimeoutException when the wait would exceed the limiter's deadline
     */
    void acquire(String key, int permits);

    void release(String key, int permits);

    default <T> T execute(String key, int permits, Supplier<T> task) {
        acquire(key, permits);
        try {
            return task.get();
        } finally {
            release(key, permits);
        }
    }
}
