package com.nevis.hybrid.controller;

import com.nevis.hybrid.model.MetadataValue;
import com.nevis.hybrid.model.NewDocument;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record DocumentRequest(
    String id,

    @NotBlank
    String content,

    Map<String, MetadataValue> metadata,

    float[] embedding
) {
    public NewDocument toNewDocument() {
        return new NewDocument(id, content, metadata, embedding);
    }
}
