package com.nevis.hybrid.repository;

import com.nevis.hybrid.exception.DuplicateDocumentException;
import com.nevis.hybrid.model.Document;
import com.nevis.hybrid.model.DocumentUpdate;
import com.nevis.hybrid.model.MetadataFilter;
import com.nevis.hybrid.model.ScoredDocument;
import com.nevis.hybrid.model.StoreConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Exact-scan backend keeping every document in process memory.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "app.store", name = "backend", havingValue = "memory")
public class InMemoryStorageBackend implements StorageBackend {

    private static final Comparator<ScoredDocument> BEST_FIRST = Comparator
        .comparingDouble(ScoredDocument::score).reversed()
        .thenComparingLong(ScoredDocument::sequence);

    private record Row(Document document, long sequence) {}

    private final Map<String, Row> rows = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private long nextSequence = 1;

    public InMemoryStorageBackend() {
        this(Clock.systemUTC());
    }

    public InMemoryStorageBackend(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public void createSchema(StoreConfig config) {
        log.info("In-memory store ready: dimensions={}, metric={}", config.dimensions(), config.distanceMetric());
    }

    @Override
    public void insertAll(List<Document> documents) {
        lock.writeLock().lock();
        try {
            for (Document document : documents) {
                if (rows.containsKey(document.id())) {
                    throw new DuplicateDocumentException(document.id(), null);
                }
            }
            OffsetDateTime now = OffsetDateTime.now(clock);
            for (Document document : documents) {
                Document stored = new Document(
                    document.id(),
                    document.content(),
                    document.metadata(),
                    document.embedding().clone(),
                    now,
                    now
                );
                rows.put(document.id(), new Row(stored, nextSequence++));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Document> findById(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(rows.get(id)).map(row -> copy(row.document()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Document> update(String id, DocumentUpdate update) {
        lock.writeLock().lock();
        try {
            Row row = rows.get(id);
            if (row == null) {
                return Optional.empty();
            }
            Document current = row.document();
            Document updated = new Document(
                id,
                update.content() != null ? update.content() : current.content(),
                update.metadata() != null ? update.metadata() : current.metadata(),
                update.embedding() != null ? update.embedding().clone() : current.embedding(),
                current.createdAt(),
                OffsetDateTime.now(clock)
            );
            rows.put(id, new Row(updated, row.sequence()));
            return Optional.of(copy(updated));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean deleteById(String id) {
        lock.writeLock().lock();
        try {
            return rows.remove(id) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int deleteWhere(MetadataFilter filter) {
        lock.writeLock().lock();
        try {
            int before = rows.size();
            rows.values().removeIf(row -> filter.matches(row.document().metadata()));
            return before - rows.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void truncate() {
        lock.writeLock().lock();
        try {
            rows.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public long count() {
        lock.readLock().lock();
        try {
            return rows.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ScoredDocument> vectorTopK(VectorQuery query) {
        lock.readLock().lock();
        try {
            List<ScoredDocument> scored = new ArrayList<>();
            for (Row row : rows.values()) {
                if (!query.filter().matches(row.document().metadata())) {
                    continue;
                }
                double similarity = query.metric().similarity(query.vector(), row.document().embedding());
                if (query.minSimilarity() != null && similarity < query.minSimilarity()) {
                    continue;
                }
                scored.add(new ScoredDocument(copy(row.document()), row.sequence(), similarity));
            }
            return top(scored, query.limit());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ScoredDocument> textTopK(String queryText, int limit, MetadataFilter filter) {
        Set<String> terms = TextRanker.queryTerms(queryText);
        if (terms.isEmpty()) {
            return List.of();
        }

        lock.readLock().lock();
        try {
            List<ScoredDocument> scored = new ArrayList<>();
            for (Row row : rows.values()) {
                if (!filter.matches(row.document().metadata())) {
                    continue;
                }
                double rank = TextRanker.rank(terms, row.document().content());
                if (rank >= 0) {
                    scored.add(new ScoredDocument(copy(row.document()), row.sequence(), rank));
                }
            }
            return top(scored, limit);
        } finally {
            lock.readLock().unlock();
        }
    }

    private static List<ScoredDocument> top(List<ScoredDocument> scored, int limit) {
        scored.sort(BEST_FIRST);
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : scored;
    }

    private static Document copy(Document document) {
        return new Document(
            document.id(),
            document.content(),
            document.metadata(),
            document.embedding().clone(),
            document.createdAt(),
            document.updatedAt()
        );
    }
}
