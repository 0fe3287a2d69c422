package com.nevis.hybrid.repository;

import com.nevis.hybrid.exception.DuplicateDocumentException;
import com.nevis.hybrid.model.DistanceMetric;
import com.nevis.hybrid.model.Document;
import com.nevis.hybrid.model.DocumentUpdate;
import com.nevis.hybrid.model.MetadataFilter;
import com.nevis.hybrid.model.MetadataValue;
import com.nevis.hybrid.model.ScoredDocument;
import com.nevis.hybrid.model.StoreConfig;
import com.nevis.hybrid.service.DocumentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class JdbcStorageBackendTest extends BaseIntegrationTest {

    @Autowired
    private StorageBackend backend;

    @Autowired
    private DocumentService documentService;

    @Autowired
    private JdbcClient jdbcClient;

    @BeforeEach
    void cleanUp() {
        backend.truncate();
    }

    private static Document doc(String id, String content, float[] embedding, Map<String, MetadataValue> metadata) {
        return new Document(id, content, metadata, embedding, null, null);
    }

    private static List<String> ids(List<ScoredDocument> hits) {
        return hits.stream().map(ScoredDocument::id).toList();
    }

    @Test
    @DisplayName("The JDBC backend is wired by default")
    void jdbcBackendSelected() {
        assertThat(backend).isInstanceOf(JdbcStorageBackend.class);
        assertThat(backend.name()).isEqualTo("jdbc");
    }

    @Test
    @DisplayName("DDL, DML and stats use the configured table name")
    void configuredTableName() {
        backend.insertAll(List.of(doc("a", "hello", new float[]{1, 0, 0}, Map.of())));

        assertThat(jdbcClient.sql("SELECT COUNT(*) FROM hybrid_documents").query(Long.class).single()).isEqualTo(1);
        assertThat(jdbcClient.sql("SELECT indexname FROM pg_indexes WHERE tablename = 'hybrid_documents'")
            .query(String.class).list())
            .contains("hybrid_documents_seq_idx", "hybrid_documents_metadata_idx", "hybrid_documents_content_tsv_idx");
        assertThat(documentService.stats().tableName()).isEqualTo("hybrid_documents");
        assertThat(documentService.stats().totalDocuments()).isEqualTo(1);
    }

    @Test
    @DisplayName("Schema creation is idempotent and rejects a different dimension")
    void schemaDimensions() {
        backend.createSchema(new StoreConfig(3, DistanceMetric.COSINE));

        assertThatThrownBy(() -> backend.createSchema(new StoreConfig(4, DistanceMetric.COSINE)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("3 dimensions");
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        @DisplayName("Round trip keeps content, nested metadata and the exact vector")
        void roundTrip() {
            Map<String, MetadataValue> metadata = MetadataValue.fromMap(Map.of(
                "author", Map.of("name", "Ann"),
                "tags", List.of("a", "b"),
                "pages", 12
            ));
            float[] embedding = {0.125f, -0.5f, 0.333f};

            backend.insertAll(List.of(doc("a", "hello world", embedding, metadata)));
            Document found = backend.findById("a").orElseThrow();

            assertThat(found.content()).isEqualTo("hello world");
            assertThat(found.metadata()).isEqualTo(metadata);
            assertThat(found.embedding()).containsExactly(embedding);
            assertThat(found.createdAt()).isNotNull();
        }

        @Test
        @DisplayName("A colliding id rolls back the whole batch")
        void duplicateRollsBack() {
            backend.insertAll(List.of(doc("a", "first", new float[]{1, 0, 0}, Map.of())));

            assertThatThrownBy(() -> backend.insertAll(List.of(
                doc("b", "second", new float[]{0, 1, 0}, Map.of()),
                doc("a", "again", new float[]{0, 0, 1}, Map.of())
            ))).isInstanceOf(DuplicateDocumentException.class);

            assertThat(backend.count()).isEqualTo(1);
        }

        @Test
        void updatesAndDeletes() {
            backend.insertAll(List.of(
                doc("a", "first", new float[]{1, 0, 0}, Map.of("kind", MetadataValue.of("x"))),
                doc("b", "second", new float[]{0, 1, 0}, Map.of("kind", MetadataValue.of("y")))
            ));

            Document updated = backend.update("a", new DocumentUpdate("changed", null, new float[]{0, 0, 1}))
                .orElseThrow();
            assertThat(updated.content()).isEqualTo("changed");
            assertThat(updated.embedding()).containsExactly(0, 0, 1);
            assertThat(updated.metadata()).containsEntry("kind", MetadataValue.of("x"));
            assertThat(updated.updatedAt()).isAfterOrEqualTo(updated.createdAt());
            assertThat(backend.update("missing", DocumentUpdate.content("x"))).isEmpty();

            assertThat(backend.deleteWhere(MetadataFilter.builder().equalTo("kind", MetadataValue.of("y")).build()))
                .isEqualTo(1);
            assertThat(backend.deleteById("a")).isTrue();
            assertThat(backend.deleteById("a")).isFalse();
            assertThat(backend.count()).isZero();
        }
    }

    @Nested
    @DisplayName("Ranking")
    class Ranking {

        @BeforeEach
        void insert() {
            backend.insertAll(List.of(
                doc("a", "The cat sat on the mat", new float[]{1, 0, 0},
                    MetadataValue.fromMap(Map.of("tags", List.of("pet", "cat"), "author", Map.of("name", "Ann")))),
                doc("b", "A dog barked at the cat", new float[]{0, 1, 0},
                    MetadataValue.fromMap(Map.of("tags", List.of("pet", "dog"), "author", Map.of("name", "Bob")))),
                doc("c", "Cars and roads", new float[]{0, 0, 0},
                    MetadataValue.fromMap(Map.of("tags", List.of("vehicle"))))
            ));
        }

        @Test
        @DisplayName("Cosine similarity orders results and a zero vector scores -1")
        void vectorOrder() {
            List<ScoredDocument> hits = backend.vectorTopK(
                new VectorQuery(new float[]{1, 0, 0}, 10, MetadataFilter.none(), null, DistanceMetric.COSINE));

            assertThat(ids(hits)).containsExactly("a", "b", "c");
            assertThat(hits.get(0).score()).isCloseTo(1.0, within(1e-6));
            assertThat(hits.get(1).score()).isCloseTo(0.0, within(1e-6));
            assertThat(hits.get(2).score()).isCloseTo(-1.0, within(1e-6));
        }

        @Test
        void vectorThresholdAndFilter() {
            MetadataFilter pets = MetadataFilter.builder().contains("tags", MetadataValue.of("pet")).build();

            assertThat(ids(backend.vectorTopK(
                new VectorQuery(new float[]{1, 0, 0}, 10, pets, 0.5, DistanceMetric.COSINE))))
                .containsExactly("a");
            assertThat(ids(backend.vectorTopK(
                new VectorQuery(new float[]{0, 1, 0}, 10, pets, null, DistanceMetric.L2))))
                .containsExactly("b", "a");
        }

        @Test
        @DisplayName("Full-text ranking honours the metadata filter and dotted paths")
        void textRanking() {
            assertThat(ids(backend.textTopK("cat", 10, MetadataFilter.none()))).containsExactlyInAnyOrder("a", "b");
            assertThat(ids(backend.textTopK("cats", 10,
                MetadataFilter.builder().equalTo("author.name", MetadataValue.of("Bob")).build())))
                .containsExactly("b");
            assertThat(backend.textTopK("airplane", 10, MetadataFilter.none())).isEmpty();
        }

        @Test
        @DisplayName("Integer path segments index into lists")
        void listIndexPaths() {
            backend.insertAll(List.of(doc("d", "Reviews", new float[]{0, 0, 1},
                MetadataValue.fromMap(Map.of("reviewers", List.of(Map.of("name", "Cy"), Map.of("name", "Di")))))));

            assertThat(ids(backend.vectorTopK(query(filter("tags.0", "pet"))))).containsExactlyInAnyOrder("a", "b");
            assertThat(ids(backend.vectorTopK(query(filter("tags.1", "dog"))))).containsExactly("b");
            assertThat(ids(backend.vectorTopK(query(filter("tags.-1", "cat"))))).containsExactly("a");
            assertThat(ids(backend.vectorTopK(query(filter("reviewers.1.name", "Di"))))).containsExactly("d");
            assertThat(backend.vectorTopK(query(filter("tags.5", "pet")))).isEmpty();
            assertThat(backend.vectorTopK(query(filter("tags.first", "pet")))).isEmpty();
        }

        private VectorQuery query(MetadataFilter filter) {
            return new VectorQuery(new float[]{1, 1, 1}, 10, filter, null, DistanceMetric.L2);
        }

        private MetadataFilter filter(String path, String value) {
            return MetadataFilter.builder().equalTo(path, MetadataValue.of(value)).build();
        }
    }
}
