package com.nevis.hybrid.service;

import com.nevis.hybrid.model.MetadataFilter;
import com.nevis.hybrid.model.ScoredDocument;
import com.nevis.hybrid.model.SearchOptions;
import com.nevis.hybrid.model.SearchResult;

import java.util.List;

public interface VectorSearchService {

    /**
     * Embeds {@code queryText} and ranks documents against the resulting vector.
     */
    List<SearchResult> search(String queryText, SearchOptions options);

    List<SearchResult> searchByEmbedding(float[] queryVector, SearchOptions options);

    /**
     * Raw similarity ranking with an already validated vector and limit.
     */
    List<ScoredDocument> rank(float[] queryVector, int limit, MetadataFilter filter, Double threshold);
}
