package com.nevis.hybrid.config;

import com.nevis.hybrid.infra.InMemoryDualRateLimiter;
import com.nevis.hybrid.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("embeddingLimiter")
    public RateLimiter embeddingLimiter(HybridStoreProperties properties) {
        HybridStoreProperties.RateLimit limits = properties.embedding().rateLimit();
        return new InMemoryDualRateLimiter(
            limits.requestsPerMinute(),
            limits.tokensPerMinute(),
            properties.embedding().timeout()
        );
    }
}
