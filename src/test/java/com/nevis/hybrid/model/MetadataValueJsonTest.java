package com.nevis.hybrid.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataValueJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Plain JSON maps to tagged metadata values")
    void readsPlainJson() throws Exception {
        Map<String, MetadataValue> metadata = objectMapper.readValue(
            """
                {"title": "Intro", "pages": 12, "score": 0.5, "draft": false, "reviewer": null,
                 "tags": ["a", 1], "author": {"name": "Ann"}}
                """,
            new TypeReference<>() {}
        );

        assertThat(metadata)
            .containsEntry("title", MetadataValue.of("Intro"))
            .containsEntry("pages", MetadataValue.of(12))
            .containsEntry("score", MetadataValue.of(0.5))
            .containsEntry("draft", MetadataValue.of(false))
            .containsEntry("reviewer", MetadataValue.nullValue())
            .containsEntry("tags", MetadataValue.list(MetadataValue.of("a"), MetadataValue.of(1)))
            .containsEntry("author", new MetadataValue.MapValue(Map.of("name", MetadataValue.of("Ann"))));
    }

    @Test
    @DisplayName("Metadata values are written without type information")
    void writesPlainJson() throws Exception {
        Map<String, MetadataValue> metadata = MetadataValue.fromMap(Map.of("tags", List.of("x", 2)));

        assertThat(objectMapper.writeValueAsString(metadata)).isEqualTo("{\"tags\":[\"x\",2]}");
    }
}
