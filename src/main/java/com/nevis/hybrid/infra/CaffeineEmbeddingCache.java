package com.nevis.hybrid.infra;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

public class CaffeineEmbeddingCache implements EmbeddingCache {

    private record Key(String providerId, String text) {}

    private final Cache<Key, float[]> cache;

    public CaffeineEmbeddingCache(Duration ttl, long maxSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(maxSize)
            .ticker(ticker)
            .build();
    }

    @Override
    public Optional<float[]> get(String providerId, String text) {
        return Optional.ofNullable(cache.getIfPresent(new Key(providerId, text))).map(float[]::clone);
    }

    @Override
    public void put(String providerId, String text, float[] vector) {
        cache.put(new Key(providerId, text), vector.clone());
    }

    @Override
    public void evict(String providerId, String text) {
        cache.invalidate(new Key(providerId, text));
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }
}
