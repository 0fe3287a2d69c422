package com.nevis.hybrid.service;

import com.nevis.hybrid.exception.HybridStoreException;
import com.nevis.hybrid.exception.ValidationException;
import com.nevis.hybrid.model.HybridSearchOptions;
import com.nevis.hybrid.model.ScoredDocument;
import com.nevis.hybrid.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class HybridSearchServiceImpl implements HybridSearchService {

    private final TextSearchService textSearchService;
    private final VectorSearchService vectorSearchService;
    private final EmbeddingService embeddingService;
    private final HybridFusionRanker fusionRanker;
    private final RequestValidator validator;
    private final Executor searchExecutor;

    public HybridSearchServiceImpl(
        TextSearchService textSearchService,
        VectorSearchService vectorSearchService,
        EmbeddingService embeddingService,
        HybridFusionRanker fusionRanker,
        RequestValidator validator,
        @Qualifier("searchTaskExecutor") Executor searchExecutor
    ) {
        this.textSearchService = textSearchService;
        this.vectorSearchService = vectorSearchService;
        this.embeddingService = embeddingService;
        this.fusionRanker = fusionRanker;
        this.validator = validator;
        this.searchExecutor = searchExecutor;
    }

    @Override
    public List<SearchResult> hybridSearch(String queryText, HybridSearchOptions options) {
        HybridSearchOptions resolved = options == null ? HybridSearchOptions.defaults() : options;
        validator.requireText("query", queryText);
        int limit = validator.resolveLimit(resolved.limit());
        double textWeight = resolved.effectiveTextWeight();
        double vectorWeight = resolved.effectiveVectorWeight();
        validator.checkWeight("textWeight", textWeight);
        validator.checkWeight("vectorWeight", vectorWeight);
        if (!embeddingService.isAvailable()) {
            throw new ValidationException("Hybrid search needs an embedding provider");
        }

        float[] queryVector = embeddingService.embedQuery(queryText);

        CompletableFuture<List<ScoredDocument>> textRanking = CompletableFuture.supplyAsync(
            () -> textSearchService.rank(queryText, limit, resolved.filter()), searchExecutor);
        CompletableFuture<List<ScoredDocument>> vectorRanking = CompletableFuture.supplyAsync(
            () -> vectorSearchService.rank(queryVector, limit, resolved.filter(), null), searchExecutor);

        List<ScoredDocument> textHits = await(textRanking, "text", resolved.degradeOnPartialFailure(), vectorRanking);
        List<ScoredDocument> vectorHits = await(vectorRanking, "vector", resolved.degradeOnPartialFailure(), textRanking);

        List<HybridFusionRanker.FusedHit> fused =
            fusionRanker.fuse(textHits, vectorHits, textWeight, vectorWeight, limit);
        log.debug("Hybrid search fused {} text and {} vector hits into {} results",
            textHits.size(), vectorHits.size(), fused.size());

        SearchResult.Projection projection = resolved.projection();
        return fused.stream()
            .map(hit -> SearchResult.fused(hit.document(), hit.textRank(), hit.vectorRank(), hit.fusedScore(), projection))
            .toList();
    }

    /**
     * Waits for one ranking. With degrading enabled a failed ranking counts as empty, provided the
     * other one succeeds; otherwise the failure is rethrown as-is.
     */
    private List<ScoredDocument> await(
        CompletableFuture<List<ScoredDocument>> ranking,
        String name,
        boolean degrade,
        CompletableFuture<List<ScoredDocument>> other
    ) {
        try {
            return ranking.join();
        } catch (CompletionException e) {
            RuntimeException failure = unwrap(e);
            if (!degrade || otherFailed(other)) {
                throw failure;
            }
            log.warn("Hybrid search degraded: {} ranking failed, fusing the other one alone", name, failure);
            return List.of();
        }
    }

    private static boolean otherFailed(CompletableFuture<List<ScoredDocument>> other) {
        try {
            other.join();
            return false;
        } catch (CompletionException e) {
            return true;
        }
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof HybridStoreException storeException) {
            return storeException;
        }
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return e;
    }
}
