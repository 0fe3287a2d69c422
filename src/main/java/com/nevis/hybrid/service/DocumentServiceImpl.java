package com.nevis.hybrid.service;

import com.nevis.hybrid.config.HybridStoreProperties;
import com.nevis.hybrid.exception.DocumentNotFoundException;
import com.nevis.hybrid.exception.FilterException;
import com.nevis.hybrid.exception.ValidationException;
import com.nevis.hybrid.model.Document;
import com.nevis.hybrid.model.DocumentUpdate;
import com.nevis.hybrid.model.MetadataFilter;
import com.nevis.hybrid.model.NewDocument;
import com.nevis.hybrid.model.StoreConfig;
import com.nevis.hybrid.model.StoreStats;
import com.nevis.hybrid.repository.StorageBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
public class DocumentServiceImpl implements DocumentService {

    private final StorageBackend storageBackend;
    private final EmbeddingService embeddingService;
    private final RequestValidator validator;
    private final StoreConfig storeConfig;
    private final String tableName;

    public DocumentServiceImpl(
        StorageBackend storageBackend,
        EmbeddingService embeddingService,
        RequestValidator validator,
        HybridStoreProperties properties
    ) {
        this.storageBackend = storageBackend;
        this.embeddingService = embeddingService;
        this.validator = validator;
        this.storeConfig = properties.storeConfig();
        this.tableName = properties.tableName();
    }

    @Override
    public List<String> insert(List<NewDocument> documents) {
        if (documents == null) {
            throw new ValidationException("documents cannot be null");
        }
        if (documents.isEmpty()) {
            return List.of();
        }

        Set<String> seenIds = new HashSet<>();
        List<String> toEmbed = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            NewDocument document = documents.get(i);
            if (document == null) {
                throw new ValidationException("Document at index " + i + " is null");
            }
            validator.requireText("content of document at index " + i, document.content());
            if (document.id() != null) {
                validator.requireId(document.id());
                if (!seenIds.add(document.id())) {
                    throw new ValidationException("Duplicate document id in batch: " + document.id());
                }
            }
            if (document.hasEmbedding()) {
                validator.checkVector(document.embedding());
            } else {
                toEmbed.add(document.content());
            }
        }
        if (!toEmbed.isEmpty() && !embeddingService.isAvailable()) {
            throw new ValidationException(
                toEmbed.size() + " documents have no embedding and no embedding provider is configured");
        }

        log.debug("Inserting {} documents, {} need embeddings", documents.size(), toEmbed.size());
        List<float[]> generated = embeddingService.isAvailable() ? embeddingService.embedAll(toEmbed) : List.of();

        List<Document> rows = new ArrayList<>(documents.size());
        int next = 0;
        for (NewDocument document : documents) {
            float[] embedding = document.hasEmbedding() ? document.embedding() : generated.get(next++);
            String id = document.id() != null ? document.id() : UUID.randomUUID().toString();
            rows.add(new Document(id, document.content(), document.metadata(), embedding, null, null));
        }

        storageBackend.insertAll(rows);
        List<String> ids = rows.stream().map(Document::id).toList();
        log.info("Inserted {} documents", ids.size());
        return ids;
    }

    @Override
    public Optional<Document> get(String id) {
        validator.requireId(id);
        log.debug("Fetching document by id: {}", id);
        return storageBackend.findById(id);
    }

    @Override
    public Document update(String id, DocumentUpdate update) {
        validator.requireId(id);
        if (update == null || update.isEmpty()) {
            throw new ValidationException("Update must change content, metadata or embedding");
        }
        if (update.content() != null) {
            validator.requireText("content", update.content());
        }
        if (update.embedding() != null) {
            validator.checkVector(update.embedding());
        }
        boolean mayReembed = update.content() != null && update.embedding() == null;
        if (mayReembed && !embeddingService.isAvailable()) {
            throw new ValidationException("Content changes need an embedding and no embedding provider is configured");
        }

        Document current = storageBackend.findById(id).orElseThrow(() -> notFound(id));

        DocumentUpdate effective = update;
        if (mayReembed && !update.content().equals(current.content())) {
            log.debug("Content of document {} changed, re-embedding", id);
            float[] embedding = embeddingService.embedAll(List.of(update.content())).get(0);
            effective = new DocumentUpdate(update.content(), update.metadata(), embedding);
        }

        Document updated = storageBackend.update(id, effective).orElseThrow(() -> notFound(id));
        log.info("Updated document {}", id);
        return updated;
    }

    @Override
    public void delete(String id) {
        validator.requireId(id);
        if (!storageBackend.deleteById(id)) {
            throw notFound(id);
        }
        log.info("Deleted document {}", id);
    }

    @Override
    public int deleteByFilter(MetadataFilter filter) {
        if (filter == null || filter.isEmpty()) {
            throw new FilterException("deleteByFilter needs at least one condition; use clear() to remove everything");
        }
        int deleted = storageBackend.deleteWhere(filter);
        log.info("Deleted {} documents matching {}", deleted, filter);
        return deleted;
    }

    @Override
    public void clear() {
        storageBackend.truncate();
        log.info("Cleared all documents");
    }

    @Override
    public StoreStats stats() {
        return new StoreStats(
            storageBackend.count(),
            storeConfig.dimensions(),
            storeConfig.distanceMetric(),
            storageBackend.name(),
            tableName
        );
    }

    private static DocumentNotFoundException notFound(String id) {
        log.warn("Document not found with id: {}", id);
        return new DocumentNotFoundException(id);
    }
}
