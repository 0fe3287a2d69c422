package com.nevis.hybrid.controller;

import com.nevis.hybrid.model.Document;
import com.nevis.hybrid.model.MetadataValue;

import java.time.OffsetDateTime;
import java.util.Map;

public record DocumentResponse(
    String id,
    String content,
    Map<String, MetadataValue> metadata,
    float[] embedding,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {
    public static DocumentResponse from(Document document) {
        return new DocumentResponse(
            document.id(),
            document.content(),
            document.metadata(),
            document.embedding(),
            document.createdAt(),
            document.updatedAt()
        );
    }
}
