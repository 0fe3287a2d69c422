package com.nevis.hybrid.service;

import com.nevis.hybrid.config.HybridStoreProperties;
import com.nevis.hybrid.model.DistanceMetric;
import com.nevis.hybrid.model.MetadataFilter;
import com.nevis.hybrid.model.ScoredDocument;
import com.nevis.hybrid.model.SearchOptions;
import com.nevis.hybrid.model.SearchResult;
import com.nevis.hybrid.repository.StorageBackend;
import com.nevis.hybrid.repository.VectorQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class VectorSearchServiceImpl implements VectorSearchService {

    private final StorageBackend storageBackend;
    private final EmbeddingService embeddingService;
    private final RequestValidator validator;
    private final DistanceMetric metric;

    public VectorSearchServiceImpl(
        StorageBackend storageBackend,
        EmbeddingService embeddingService,
        RequestValidator validator,
        HybridStoreProperties properties
    ) {
        this.storageBackend = storageBackend;
        this.embeddingService = embeddingService;
        this.validator = validator;
        this.metric = properties.distanceMetric();
    }

    @Override
    public List<SearchResult> search(String queryText, SearchOptions options) {
        SearchOptions resolved = options == null ? SearchOptions.defaults() : options;
        validator.requireText("query", queryText);
        int limit = validator.resolveLimit(resolved.limit());
        validator.checkThreshold(resolved.threshold());

        float[] queryVector = embeddingService.embedQuery(queryText);
        return toResults(rank(queryVector, limit, resolved.filter(), resolved.threshold()), resolved);
    }

    @Override
    public List<SearchResult> searchByEmbedding(float[] queryVector, SearchOptions options) {
        SearchOptions resolved = options == null ? SearchOptions.defaults() : options;
        validator.checkVector(queryVector);
        int limit = validator.resolveLimit(resolved.limit());
        validator.checkThreshold(resolved.threshold());

        return toResults(rank(queryVector, limit, resolved.filter(), resolved.threshold()), resolved);
    }

    @Override
    public List<ScoredDocument> rank(float[] queryVector, int limit, MetadataFilter filter, Double threshold) {
        log.debug("Vector search: metric={}, limit={}, threshold={}, filter={}", metric, limit, threshold, filter);
        return storageBackend.vectorTopK(new VectorQuery(queryVector, limit, filter, threshold, metric));
    }

    private static List<SearchResult> toResults(List<ScoredDocument> ranked, SearchOptions options) {
        SearchResult.Projection projection = options.projection();
        return ranked.stream()
            .map(hit -> SearchResult.similarity(hit.document(), hit.score(), projection))
            .toList();
    }
}
