package com.nevis.hybrid.model;

import lombok.Builder;

/**
 * Options for vector and text searches. Unset values fall back to the store defaults:
 * the configured default limit, no threshold, no filter, content and metadata included.
 */
@Builder(toBuilder = true)
public record SearchOptions(
    Integer limit,
    Double threshold,
    MetadataFilter filter,
    Boolean includeContent,
    Boolean includeMetadata,
    Boolean includeEmbedding
) {
    public SearchOptions {
        filter = filter == null ? MetadataFilter.none() : filter;
    }

    public static SearchOptions defaults() {
        return builder().build();
    }

    public static SearchOptions limit(int limit) {
        return builder().limit(limit).build();
    }

    public SearchResult.Projection projection() {
        return new SearchResult.Projection(
            includeContent == null || includeContent,
            includeMetadata == null || includeMetadata,
            includeEmbedding != null && includeEmbedding
        );
    }
}
