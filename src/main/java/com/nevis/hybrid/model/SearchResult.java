package com.nevis.hybrid.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * One ranked hit. Only the scores produced by the query that built it are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResult(
    String id,
    String content,
    Map<String, MetadataValue> metadata,
    float[] embedding,
    Double similarity,
    Double textRank,
    Double vectorRank,
    Double fusedScore
) {
    public static SearchResult similarity(Document document, double similarity, Projection projection) {
        return new SearchResult(
            document.id(),
            projection.includeContent() ? document.content() : null,
            projection.includeMetadata() ? document.metadata() : null,
            projection.includeEmbedding() ? document.embedding() : null,
            similarity,
            null,
            null,
            null
        );
    }

    public static SearchResult text(Document document, double textRank, Projection projection) {
        return new SearchResult(
            document.id(),
            projection.includeContent() ? document.content() : null,
            projection.includeMetadata() ? document.metadata() : null,
            projection.includeEmbedding() ? document.embedding() : null,
            null,
            textRank,
            null,
            null
        );
    }

    public static SearchResult fused(Document document, double textRank, double vectorRank, double fusedScore,
                                     Projection projection) {
        return new SearchResult(
            document.id(),
            projection.includeContent() ? document.content() : null,
            projection.includeMetadata() ? document.metadata() : null,
            projection.includeEmbedding() ? document.embedding() : null,
            vectorRank,
            textRank,
            vectorRank,
            fusedScore
        );
    }

    /**
     * Which document fields a search copies into its results.
     */
    public record Projection(boolean includeContent, boolean includeMetadata, boolean includeEmbedding) {

        public static final Projection DEFAULT = new Projection(true, true, false);
    }
}
