package com.nevis.hybrid.repository;

import com.nevis.hybrid.model.Document;
import com.nevis.hybrid.model.DocumentUpdate;
import com.nevis.hybrid.model.MetadataFilter;
import com.nevis.hybrid.model.ScoredDocument;
import com.nevis.hybrid.model.StoreConfig;

import java.util.List;
import java.util.Optional;

/**
 * Persistence and ranking primitives the store is built on. Implementations own document state,
 * the vector ranking and the full-text ranking; every ranking orders ties by insertion sequence.
 */
public interface StorageBackend {

    String name();

    void createSchema(StoreConfig config);

    /**
     * Persists every document or none of them.
     */
    void insertAll(List<Document> documents);

    Optional<Document> findById(String id);

    /**
     * Applies the non-null parts of {@code update} and bumps {@code updatedAt}.
     *
     * @return the updated document, empty when {@code id} is absent
     */
    Optional<Document> update(String id, DocumentUpdate update);

    boolean deleteById(String id);

    int deleteWhere(MetadataFilter filter);

    void truncate();

    long count();

    /**
     * Documents passing {@code query.filter()}, scored by similarity ({@code 1 - distance}), best first.
     */
    List<ScoredDocument> vectorTopK(VectorQuery query);

    /**
     * Documents passing {@code filter} that match {@code queryText}, scored by a non-negative text rank,
     * best first.
     */
    List<ScoredDocument> textTopK(String queryText, int limit, MetadataFilter filter);
}
