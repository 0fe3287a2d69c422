package com.nevis.hybrid.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.nevis.hybrid.infra.CaffeineEmbeddingCache;
import com.nevis.hybrid.infra.EmbeddingCache;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "app.store.embedding.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CacheConfig {

    @Bean
    public EmbeddingCache embeddingCache(HybridStoreProperties properties) {
        HybridStoreProperties.Cache cache = properties.embedding().cache();
        return new CaffeineEmbeddingCache(cache.ttl(), cache.maxSize(), Ticker.systemTicker());
    }
}
