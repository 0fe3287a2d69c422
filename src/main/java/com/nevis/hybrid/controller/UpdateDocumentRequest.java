package com.nevis.hybrid.controller;

import com.nevis.hybrid.model.DocumentUpdate;
import com.nevis.hybrid.model.MetadataValue;

import java.util.Map;

public record UpdateDocumentRequest(
    String content,
    Map<String, MetadataValue> metadata,
    float[] embedding
) {
    public DocumentUpdate toUpdate() {
        return new DocumentUpdate(content, metadata, embedding);
    }
}
