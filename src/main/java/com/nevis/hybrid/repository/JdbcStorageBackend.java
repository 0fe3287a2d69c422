package com.nevis.hybrid.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.hybrid.config.HybridStoreProperties;
import com.nevis.hybrid.exception.DuplicateDocumentException;
import com.nevis.hybrid.exception.StorageException;
import com.nevis.hybrid.exception.StoreTimeoutException;
import com.nevis.hybrid.model.DistanceMetric;
import com.nevis.hybrid.model.Document;
import com.nevis.hybrid.model.DocumentUpdate;
import com.nevis.hybrid.model.MetadataFilter;
import com.nevis.hybrid.model.MetadataValue;
import com.nevis.hybrid.model.ScoredDocument;
import com.nevis.hybrid.model.StoreConfig;
import com.pgvector.PGvector;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * PostgreSQL + pgvector backend over the table named by {@code app.store.table-name}. Vector ranking uses
 * pgvector's distance operators, text ranking uses {@code ts_rank} over a generated {@code tsvector} column.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "app.store", name = "backend", havingValue = "jdbc", matchIfMissing = true)
public class JdbcStorageBackend implements StorageBackend {

    private static final TypeReference<Map<String, MetadataValue>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final String textSearchConfig;
    private final String table;

    private final RowMapper<Document> documentRowMapper = (rs, rowNum) -> mapDocument(rs);

    private final RowMapper<ScoredDocument> scoredRowMapper = (rs, rowNum) -> new ScoredDocument(
        mapDocument(rs),
        rs.getLong("seq"),
        rs.getDouble("score")
    );

    public JdbcStorageBackend(
        JdbcClient jdbcClient,
        JdbcTemplate jdbcTemplate,
        ObjectMapper objectMapper,
        HybridStoreProperties properties
    ) {
        this.jdbcClient = jdbcClient;
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.textSearchConfig = properties.textSearchConfig();
        this.table = properties.tableName();
    }

    @Override
    public String name() {
        return "jdbc";
    }

    @Override
    public void createSchema(StoreConfig config) {
        execute("createSchema", List.of(), () -> {
            jdbcTemplate.execute("CREATE EXTENSION IF NOT EXISTS vector");
            jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS %s (
                    id          TEXT PRIMARY KEY,
                    seq         BIGSERIAL NOT NULL,
                    content     TEXT NOT NULL,
                    metadata    JSONB NOT NULL DEFAULT '{}'::jsonb,
                    embedding   VECTOR(%d) NOT NULL,
                    content_tsv TSVECTOR GENERATED ALWAYS AS (to_tsvector('%s'::regconfig, content)) STORED,
                    created_at  TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                    updated_at  TIMESTAMPTZ NOT NULL DEFAULT NOW()
                )
                """.formatted(table, config.dimensions(), textSearchConfig));
            jdbcTemplate.execute("CREATE UNIQUE INDEX IF NOT EXISTS %1$s_seq_idx ON %1$s (seq)".formatted(table));
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS %1$s_metadata_idx ON %1$s USING GIN (metadata)".formatted(table));
            jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS %1$s_content_tsv_idx ON %1$s USING GIN (content_tsv)".formatted(table));

            Integer existing = jdbcClient.sql("""
                    SELECT atttypmod FROM pg_attribute
                    WHERE attrelid = CAST(:table AS regclass) AND attname = 'embedding'
                    """)
                .param("table", table)
                .query(Integer.class)
                .single();
            if (existing != config.dimensions()) {
                throw new IllegalStateException(
                    "Table '" + table + "' stores vectors of " + existing + " dimensions, store is configured for "
                        + config.dimensions());
            }
            return null;
        });
        log.info("Schema ready: table={}, dimensions={}, metric={}, textSearchConfig={}",
            table, config.dimensions(), config.distanceMetric(), textSearchConfig);
    }

    @Override
    @Transactional
    public void insertAll(List<Document> documents) {
        if (documents.isEmpty()) {
            return;
        }

        String sql = """
            INSERT INTO %s (id, content, metadata, embedding)
            VALUES (?, ?, CAST(? AS jsonb), ?)
            """.formatted(table);

        List<String> ids = documents.stream().map(Document::id).toList();
        execute("insert", ids, () -> jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                Document document = documents.get(i);
                ps.setString(1, document.id());
                ps.setString(2, document.content());
                ps.setString(3, writeMetadata(document.metadata()));
                ps.setObject(4, new PGvector(document.embedding()));
            }

            @Override
            public int getBatchSize() {
                return documents.size();
            }
        }));
    }

    @Override
    public Optional<Document> findById(String id) {
        return execute("get", List.of(id), () -> jdbcClient.sql("SELECT * FROM " + table + " WHERE id = :id")
            .param("id", id)
            .query(documentRowMapper)
            .optional());
    }

    @Override
    @Transactional
    public Optional<Document> update(String id, DocumentUpdate update) {
        List<String> assignments = new ArrayList<>();
        if (update.content() != null) {
            assignments.add("content = :content");
        }
        if (update.metadata() != null) {
            assignments.add("metadata = CAST(:metadata AS jsonb)");
        }
        if (update.embedding() != null) {
            assignments.add("embedding = :embedding");
        }
        assignments.add("updated_at = NOW()");

        String sql = "UPDATE " + table + " SET " + String.join(", ", assignments) + " WHERE id = :id RETURNING *";

        return execute("update", List.of(id), () -> {
            var statement = jdbcClient.sql(sql).param("id", id);
            if (update.content() != null) {
                statement = statement.param("content", update.content());
            }
            if (update.metadata() != null) {
                statement = statement.param("metadata", writeMetadata(update.metadata()));
            }
            if (update.embedding() != null) {
                statement = statement.param("embedding", new PGvector(update.embedding()));
            }
            return statement.query(documentRowMapper).optional();
        });
    }

    @Override
    public boolean deleteById(String id) {
        return execute("delete", List.of(id), () -> jdbcClient.sql("DELETE FROM " + table + " WHERE id = :id")
            .param("id", id)
            .update() > 0);
    }

    @Override
    public int deleteWhere(MetadataFilter filter) {
        MetadataFilterSql where = MetadataFilterSql.of(filter, "d", objectMapper);
        return execute("deleteByFilter", List.of(), () -> jdbcClient
            .sql("DELETE FROM " + table + " AS d WHERE " + where.clause())
            .params(where.params())
            .update());
    }

    @Override
    public void truncate() {
        execute("clear", List.of(), () -> {
            jdbcTemplate.execute("TRUNCATE " + table);
            return null;
        });
    }

    @Override
    public long count() {
        return execute("count", List.of(), () -> jdbcClient.sql("SELECT COUNT(*) FROM " + table)
            .query(Long.class)
            .single());
    }

    @Override
    public List<ScoredDocument> vectorTopK(VectorQuery query) {
        MetadataFilterSql where = MetadataFilterSql.of(query.filter(), "d", objectMapper);

        String sql = """
            SELECT * FROM (
                SELECT d.*, 1 - %s AS score
                FROM %s d
                WHERE %s
            ) ranked
            WHERE %s
            ORDER BY score DESC, seq ASC
            LIMIT :limit
            """.formatted(
            distanceExpression(query.metric()),
            table,
            where.clause(),
            query.minSimilarity() == null ? "TRUE" : "score >= :threshold"
        );

        return execute("vectorSearch", List.of(), () -> {
            var statement = jdbcClient.sql(sql)
                .param("vector", new PGvector(query.vector()))
                .param("limit", query.limit())
                .params(where.params());
            if (query.minSimilarity() != null) {
                statement = statement.param("threshold", query.minSimilarity());
            }
            return statement.query(scoredRowMapper).list();
        });
    }

    @Override
    public List<ScoredDocument> textTopK(String queryText, int limit, MetadataFilter filter) {
        MetadataFilterSql where = MetadataFilterSql.of(filter, "d", objectMapper);

        String sql = """
            SELECT d.*, ts_rank(d.content_tsv, q.query) AS score
            FROM %s d,
                 plainto_tsquery(CAST(:config AS regconfig), :text) AS q(query)
            WHERE d.content_tsv @@ q.query
              AND %s
            ORDER BY score DESC, d.seq ASC
            LIMIT :limit
            """.formatted(table, where.clause());

        return execute("textSearch", List.of(), () -> jdbcClient.sql(sql)
            .param("config", textSearchConfig)
            .param("text", queryText)
            .param("limit", limit)
            .params(where.params())
            .query(scoredRowMapper)
            .list());
    }

    // pgvector returns NaN for cosine distance against a zero vector
    private static String distanceExpression(DistanceMetric metric) {
        return switch (metric) {
            case COSINE -> "COALESCE(NULLIF(d.embedding <=> :vector, 'NaN'::float8), 2.0)";
            case L2 -> "(d.embedding <-> :vector)";
            case INNER_PRODUCT -> "(d.embedding <#> :vector)";
        };
    }

    private Document mapDocument(ResultSet rs) throws SQLException {
        return new Document(
            rs.getString("id"),
            rs.getString("content"),
            readMetadata(rs.getString("metadata")),
            new PGvector(rs.getString("embedding")).toArray(),
            rs.getObject("created_at", OffsetDateTime.class),
            rs.getObject("updated_at", OffsetDateTime.class)
        );
    }

    private String writeMetadata(Map<String, MetadataValue> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable", e);
        }
    }

    private Map<String, MetadataValue> readMetadata(String json) throws SQLException {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Stored metadata is not valid JSON", e);
        }
    }

    private <T> T execute(String operation, List<String> ids, Supplier<T> action) {
        try {
            return action.get();
        } catch (QueryTimeoutException e) {
            log.warn("Storage operation '{}' timed out for {}", operation, ids);
            throw new StoreTimeoutException(operation, e.getMessage(), e);
        } catch (DuplicateKeyException e) {
            String id = ids.size() == 1 ? ids.get(0) : String.join(",", ids);
            throw new DuplicateDocumentException(id, e);
        } catch (DataAccessException e) {
            log.error("Storage operation '{}' failed for {}", operation, ids, e);
            throw new StorageException(operation, ids, e);
        }
    }
}
