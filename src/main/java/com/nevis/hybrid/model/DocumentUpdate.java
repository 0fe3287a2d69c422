package com.nevis.hybrid.model;

import java.util.Map;

/**
 * Partial update. A {@code null} component is left unchanged.
 */
public record DocumentUpdate(
    String content,
    Map<String, MetadataValue> metadata,
    float[] embedding
) {
    public DocumentUpdate {
        metadata = metadata == null ? null : MetadataValue.normalize(metadata);
    }

    public static DocumentUpdate content(String content) {
        return new DocumentUpdate(content, null, null);
    }

    public static DocumentUpdate metadata(Map<String, MetadataValue> metadata) {
        return new DocumentUpdate(null, metadata, null);
    }

    public static DocumentUpdate embedding(float[] embedding) {
        return new DocumentUpdate(null, null, embedding);
    }

    public boolean isEmpty() {
        return content == null && metadata == null && embedding == null;
    }
}
