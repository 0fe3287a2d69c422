package com.nevis.hybrid.controller;

import com.nevis.hybrid.model.SearchOptions;
import jakarta.validation.constraints.NotBlank;

/**
 * Body of the text-query searches ({@code /search} and {@code /search/text}).
 */
public record SearchRequest(
    @NotBlank
    String query,
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
