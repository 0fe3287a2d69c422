package com.nevis.hybrid.service;

import com.nevis.hybrid.model.Document;
import com.nevis.hybrid.model.DocumentUpdate;
import com.nevis.hybrid.model.HybridSearchOptions;
import com.nevis.hybrid.model.MetadataFilter;
import com.nevis.hybrid.model.NewDocument;
import com.nevis.hybrid.model.SearchOptions;
import com.nevis.hybrid.model.SearchResult;
import com.nevis.hybrid.model.StoreStats;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

@Service
public class HybridStoreImpl implements HybridStore {

    private final DocumentService documentService;
    private final VectorSearchService vectorSearchService;
    private final TextSearchService textSearchService;
    private final HybridSearchService hybridSearchService;
    private final Executor executor;

    public HybridStoreImpl(
        DocumentService documentService,
        VectorSearchService vectorSearchService,
        TextSearchService textSearchService,
        HybridSearchService hybridSearchService,
        @Qualifier("storeTaskExecutor") Executor executor
    ) {
        this.documentService = documentService;
        this.vectorSearchService = vectorSearchService;
        this.textSearchService = textSearchService;
        this.hybridSearchService = hybridSearchService;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<List<String>> insert(List<NewDocument> documents) {
        return async(() -> documentService.insert(documents));
    }

    @Override
    public CompletableFuture<Optional<Document>> get(String id) {
        return async(() -> documentService.get(id));
    }

    @Override
    public CompletableFuture<Document> update(String id, DocumentUpdate update) {
        return async(() -> documentService.update(id, update));
    }

    @Override
    public CompletableFuture<Void> delete(String id) {
        return CompletableFuture.runAsync(() -> documentService.delete(id), executor);
    }

    @Override
    public CompletableFuture<Integer> deleteByFilter(MetadataFilter filter) {
        return async(() -> documentService.deleteByFilter(filter));
    }

    @Override
    public CompletableFuture<Void> clear() {
        return CompletableFuture.runAsync(documentService::clear, executor);
    }

    @Override
    public CompletableFuture<List<SearchResult>> search(String queryText, SearchOptions options) {
        return async(() -> vectorSearchService.search(queryText, options));
    }

    @Override
    public CompletableFuture<List<SearchResult>> searchByEmbedding(float[] queryVector, SearchOptions options) {
        return async(() -> vectorSearchService.searchByEmbedding(queryVector, options));
    }

    @Override
    public CompletableFuture<List<SearchResult>> textSearch(String queryText, SearchOptions options) {
        return async(() -> textSearchService.search(queryText, options));
    }

    @Override
    public CompletableFuture<List<SearchResult>> hybridSearch(String queryText, HybridSearchOptions options) {
        return async(() -> hybridSearchService.hybridSearch(queryText, options));
    }

    @Override
    public CompletableFuture<StoreStats> stats() {
        return async(documentService::stats);
    }

    private <T> CompletableFuture<T> async(Supplier<T> operation) {
        return CompletableFuture.supplyAsync(operation, executor);
    }
}
