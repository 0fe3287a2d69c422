package com.nevis.hybrid.service;

import com.nevis.hybrid.config.HybridStoreProperties;
import com.nevis.hybrid.exception.EmbeddingException;
import com.nevis.hybrid.exception.HybridStoreException;
import com.nevis.hybrid.exception.StoreTimeoutException;
import com.nevis.hybrid.exception.ValidationException;
import com.nevis.hybrid.infra.EmbeddingCache;
import com.nevis.hybrid.infra.EmbeddingProvider;
import com.nevis.hybrid.infra.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls the embedding provider in bounded batches, under the provider rate limit and a per-call deadline,
 * serving repeated texts from the cache when one is configured.
 */
@Slf4j
@Service
public class EmbeddingServiceImpl implements EmbeddingService {

    public static final String EMBEDDING_LIMIT = "embedding_limit";

    private final EmbeddingProvider provider;
    private final EmbeddingCache cache;
    private final RateLimiter embeddingLimiter;
    private final Executor executor;
    private final int dimensions;
    private final int maxBatchSize;
    private final Duration timeout;

    public EmbeddingServiceImpl(
        Optional<EmbeddingProvider> provider,
        Optional<EmbeddingCache> cache,
        @Qualifier("embeddingLimiter") RateLimiter embeddingLimiter,
        @Qualifier("embeddingTaskExecutor") Executor executor,
        HybridStoreProperties properties
    ) {
        this.provider = provider.orElse(null);
        this.cache = cache.orElse(null);
        this.embeddingLimiter = embeddingLimiter;
        this.executor = executor;
        this.dimensions = properties.dimensions();
        this.maxBatchSize = properties.embedding().maxBatchSize();
        this.timeout = properties.embedding().timeout();
    }

    @Override
    public boolean isAvailable() {
        return provider != null;
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        requireProvider();
        if (texts.isEmpty()) {
            return List.of();
        }

        Map<String, float[]> vectors = new LinkedHashMap<>();
        LinkedHashSet<String> missing = new LinkedHashSet<>();
        for (String text : texts) {
            Optional<float[]> cached = cache == null ? Optional.empty() : cache.get(provider.id(), text);
            if (cached.isPresent()) {
                vectors.put(text, cached.get());
            } else {
                missing.add(text);
            }
        }

        if (!missing.isEmpty()) {
            log.debug("Embedding {} texts ({} served from cache)", missing.size(), texts.size() - missing.size());
            List<String> pending = new ArrayList<>(missing);
            for (int from = 0; from < pending.size(); from += maxBatchSize) {
                List<String> batch = pending.subList(from, Math.min(from + maxBatchSize, pending.size()));
                List<float[]> embedded = callProvider(batch);
                for (int i = 0; i < batch.size(); i++) {
                    vectors.put(batch.get(i), embedded.get(i));
                }
            }
            if (cache != null) {
                missing.forEach(text -> cache.put(provider.id(), text, vectors.get(text)));
            }
        }

        return texts.stream().map(vectors::get).toList();
    }

    @Override
    public float[] embedQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Query cannot be empty");
        }
        return embedAll(List.of(query)).get(0);
    }

    private List<float[]> callProvider(List<String> batch) {
        int estimatedTokens = batch.stream().mapToInt(String::length).sum() / 4;
        List<String> input = List.copyOf(batch);

        // FutureTask so that cancel(true) interrupts the thread blocked in the limiter or the provider
        FutureTask<List<float[]>> call = new FutureTask<>(
            () -> embeddingLimiter.execute(EMBEDDING_LIMIT, estimatedTokens, () -> provider.embed(input)));
        try {
            executor.execute(call);
        } catch (RejectedExecutionException e) {
            throw new StoreTimeoutException("embed", "embedding executor is saturated", e);
        }

        List<float[]> vectors;
        try {
            vectors = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Embedding provider '{}' did not answer within {}", provider.id(), timeout);
            throw new StoreTimeoutException("embed", "no response within " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new EmbeddingException("Interrupted while waiting for embeddings", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HybridStoreException storeException) {
                throw storeException;
            }
            log.error("Embedding provider '{}' failed for a batch of {} texts", provider.id(), input.size(), cause);
            throw new EmbeddingException("Embedding provider failed: " + cause.getMessage(), cause);
        }

        if (vectors == null || vectors.size() != input.size()) {
            throw new EmbeddingException("Embedding provider returned " + (vectors == null ? 0 : vectors.size())
                + " vectors for " + input.size() + " texts");
        }
        for (float[] vector : vectors) {
            if (vector == null || vector.length != dimensions) {
                throw new EmbeddingException("Embedding provider returned a vector of "
                    + (vector == null ? 0 : vector.length) + " dimensions, expected " + dimensions);
            }
        }
        return vectors;
    }

    private void requireProvider() {
        if (provider == null) {
            throw new ValidationException("No embedding provider is configured; supply embeddings explicitly");
        }
    }
}
