package com.nevis.hybrid.controller;

import com.nevis.hybrid.model.HybridSearchOptions;
import jakarta.validation.constraints.NotBlank;

public record HybridSearchRequest(
    @NotBlank
    String query,
    Integer limit,
    Double textWeight,
    Double vectorWeight,
    FilterRequest filter,
    Boolean includeContent,
    Boolean includeMetadata,
    Boolean includeEmbedding,
    Boolean degradeOnPartialFailure
) {
    public HybridSearchOptions toOptions() {
        return HybridSearchOptions.builder()
            .limit(limit)
            .textWeight(textWeight)
            .vectorWeight(vectorWeight)
            .filter(FilterRequest.toFilter(filter))
            .includeContent(includeContent)
            .includeMetadata(includeMetadata)
            .includeEmbedding(includeEmbedding)
            .degradeOnPartialFailure(Boolean.TRUE.equals(degradeOnPartialFailure))
            .build();
    }
}
