package com.nevis.hybrid.service;

import com.nevis.hybrid.model.Document;
import com.nevis.hybrid.model.DocumentUpdate;
import com.nevis.hybrid.model.MetadataFilter;
import com.nevis.hybrid.model.NewDocument;
import com.nevis.hybrid.model.StoreStats;

import java.util.List;
import java.util.Optional;

public interface DocumentService {

    /**
     * Stores every document or none of them.
     *
     * @return the ids of the stored documents, in input order
     */
    List<String> insert(List<NewDocument> documents);

    Optional<Document> get(String id);

    Document update(String id, DocumentUpdate update);

    void delete(String id);

    int deleteByFilter(MetadataFilter filter);

    void clear();

    StoreStats stats();
}
