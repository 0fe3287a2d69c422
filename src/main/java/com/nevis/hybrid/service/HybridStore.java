package com.nevis.hybrid.service;

import com.nevis.hybrid.model.Document;
import com.nevis.hybrid.model.DocumentUpdate;
import com.nevis.hybrid.model.HybridSearchOptions;
import com.nevis.hybrid.model.MetadataFilter;
import com.nevis.hybrid.model.NewDocument;
import com.nevis.hybrid.model.SearchOptions;
import com.nevis.hybrid.model.SearchResult;
import com.nevis.hybrid.model.StoreStats;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous entry point of the store. Every operation runs off the caller's thread; a failed
 * operation completes its future exceptionally with a
 * {@link com.nevis.hybrid.exception.HybridStoreException}.
 */
public interface HybridStore {

    CompletableFuture<List<String>> insert(List<NewDocument> documents);

    /**
     * Completes with an empty optional when the id is absent; failures complete exceptionally.
     */
    CompletableFuture<Optional<Document>> get(String id);

    CompletableFuture<Document> update(String id, DocumentUpdate update);

    CompletableFuture<Void> delete(String id);

    CompletableFuture<Integer> deleteByFilter(MetadataFilter filter);

    CompletableFuture<Void> clear();

    CompletableFuture<List<SearchResult>> search(String queryText, SearchOptions options);

    CompletableFuture<List<SearchResult>> searchByEmbedding(float[] queryVector, SearchOptions options);

    CompletableFuture<List<SearchResult>> textSearch(String queryText, SearchOptions options);

    CompletableFuture<List<SearchResult>> hybridSearch(String queryText, HybridSearchOptions options);

    CompletableFuture<StoreStats> stats();
}
