package com.nevis.hybrid.model;

import java.time.OffsetDateTime;
import java.util.Map;

public record Document(
    String id,
    String content,
    Map<String, MetadataValue> metadata,
    float[] embedding,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {
    public Document {
        metadata = MetadataValue.normalize(metadata);
    }
}
