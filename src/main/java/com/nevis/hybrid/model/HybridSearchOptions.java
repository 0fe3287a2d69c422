package com.nevis.hybrid.model;

import lombok.Builder;

/**
 * Options for {@code hybridSearch}. Weights default to {@value #DEFAULT_WEIGHT} each and are plain
 * scaling factors; they do not have to sum to one.
 */
@Builder(toBuilder = true)
public record HybridSearchOptions(
    Integer limit,
    Double textWeight,
    Double vectorWeight,
    MetadataFilter filter,
    Boolean includeContent,
    Boolean includeMetadata,
    Boolean includeEmbedding,
    boolean degradeOnPartialFailure
) {
    public static final double DEFAULT_WEIGHT = 0.5;

    public HybridSearchOptions {
        filter = filter == null ? MetadataFilter.none() : filter;
    }

    public static HybridSearchOptions defaults() {
        return builder().build();
    }

    public double effectiveTextWeight() {
        return textWeight == null ? DEFAULT_WEIGHT : textWeight;
    }

    public double effectiveVectorWeight() {
        return vectorWeight == null ? DEFAULT_WEIGHT : vectorWeight;
    }

    public SearchResult.Projection projection() {
        return new SearchResult.Projection(
            includeContent == null || includeContent,
            includeMetadata == null || includeMetadata,
            includeEmbedding != null && includeEmbedding
        );
    }
}
