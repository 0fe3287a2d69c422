package com.nevis.hybrid.service;

import com.nevis.hybrid.model.MetadataFilter;
import com.nevis.hybrid.model.ScoredDocument;
import com.nevis.hybrid.model.SearchOptions;
import com.nevis.hybrid.model.SearchResult;

import java.util.List;

/**
 * Lexical ranking over document content. {@link SearchOptions#threshold()} does not apply here.
 */
public interface TextSearchService {

    List<SearchResult> search(String queryText, SearchOptions options);

    List<ScoredDocument> rank(String queryText, int limit, MetadataFilter filter);
}
