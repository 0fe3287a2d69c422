package com.nevis.hybrid.service;

import com.nevis.hybrid.model.HybridSearchOptions;
import com.nevis.hybrid.model.SearchResult;

import java.util.List;

public interface HybridSearchService {

    /**
     * Embeds the query, runs the lexical and the vector ranking over the same filter and fuses them.
     * A failure of either ranking fails the search unless
     * {@link HybridSearchOptions#degradeOnPartialFailure()} is set.
     */
    List<SearchResult> hybridSearch(String queryText, HybridSearchOptions options);
}
