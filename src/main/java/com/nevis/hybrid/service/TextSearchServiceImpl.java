package com.nevis.hybrid.service;

import com.nevis.hybrid.model.MetadataFilter;
import com.nevis.hybrid.model.ScoredDocument;
import com.nevis.hybrid.model.SearchOptions;
import com.nevis.hybrid.model.SearchResult;
import com.nevis.hybrid.repository.StorageBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class TextSearchServiceImpl implements TextSearchService {

    private final StorageBackend storageBackend;
    private final RequestValidator validator;

    @Override
    public List<SearchResult> search(String queryText, SearchOptions options) {
        SearchOptions resolved = options == null ? SearchOptions.defaults() : options;
        validator.requireText("query", queryText);
        int limit = validator.resolveLimit(resolved.limit());

        SearchResult.Projection projection = resolved.projection();
        return rank(queryText, limit, resolved.filter()).stream()
            .map(hit -> SearchResult.text(hit.document(), hit.score(), projection))
            .toList();
    }

    @Override
    public List<ScoredDocument> rank(String queryText, int limit, MetadataFilter filter) {
        log.debug("Text search: query='{}', limit={}, filter={}", queryText, limit, filter);
        return storageBackend.textTopK(queryText, limit, filter);
    }
}
