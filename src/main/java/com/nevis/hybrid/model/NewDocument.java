package com.nevis.hybrid.model;

import java.util.Map;

/**
 * Insert request for a single document. {@code id} and {@code embedding} are optional: a missing id
 * is generated, a missing embedding is requested from the embedding provider.
 */
public record NewDocument(
    String id,
    String content,
    Map<String, MetadataValue> metadata,
    float[] embedding
) {
    public NewDocument {
        metadata = MetadataValue.normalize(metadata);
    }

    public static NewDocument of(String content) {
        return new NewDocument(null, content, Map.of(), null);
    }

    public static NewDocument of(String content, Map<String, MetadataValue> metadata) {
        return new NewDocument(null, content, metadata, null);
    }

    public static NewDocument withEmbedding(String id, String content, float[] embedding) {
        return new NewDocument(id, content, Map.of(), embedding);
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }
}
