package com.nevis.hybrid.config;

import com.nevis.hybrid.model.DistanceMetric;
import com.nevis.hybrid.model.StoreConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.store")
public record HybridStoreProperties(
    @DefaultValue("768") @Min(1) int dimensions,
    @DefaultValue("COSINE") @NotNull DistanceMetric distanceMetric,
    @DefaultValue("jdbc") @Pattern(regexp = "jdbc|memory") String backend,
    @DefaultValue("true") boolean initializeSchema,
    @DefaultValue("english") @Pattern(regexp = "[a-z_]+") String textSearchConfig,
    @DefaultValue("documents") @Pattern(regexp = "[a-z_][a-z0-9_]{0,39}") String tableName,
    @DefaultValue @Valid Search search,
    @DefaultValue @Valid Embedding embedding
) {

    public StoreConfig storeConfig() {
        return new StoreConfig(dimensions, distanceMetric);
    }

    public record Search(
        @DefaultValue("10") @Min(1) int defaultLimit,
        @DefaultValue("1000") @Min(1) @Max(100_000) int maxLimit
    ) {}

    public record Embedding(
        @DefaultValue("30s") @NotNull Duration timeout,
        @DefaultValue("100") @Min(1) int maxBatchSize,
        @DefaultValue @Valid Cache cache,
        @DefaultValue @Valid RateLimit rateLimit
    ) {}

    public record Cache(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("30m") @NotNull Duration ttl,
        @DefaultValue("10000") @Min(1) long maxSize
    ) {}

    public record RateLimit(
        @DefaultValue("60") @Min(1) int requestsPerMinute,
        @DefaultValue("1000000") @Min(1) int tokensPerMinute
    ) {}
}
