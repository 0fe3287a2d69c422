package com.nevis.hybrid.controller;

import com.nevis.hybrid.model.SearchOptions;
import jakarta.validation.constraints.NotNull;

public record EmbeddingSearchRequest(
    @NotNull
    float[] embedding,
    Integer limit,
    Double threshold,
    FilterRequest filter,
    Boolean includeContent,
    Boolean includeMetadata,
    Boolean includeEmbedding
) {
    public SearchOptions toOptions() {
        return SearchOptions.builder()
            .limit(limit)
            .threshold(threshold)
            .filter(FilterRequest.toFilter(filter))
            .includeContent(includeContent)
            .includeMetadata(includeMetadata)
            .includeEmbedding(includeEmbedding)
            .build();
    }
}
