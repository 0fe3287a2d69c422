package com.nevis.hybrid.repository;

import com.nevis.hybrid.model.DistanceMetric;
import com.nevis.hybrid.model.MetadataFilter;

/**
 * @param minSimilarity inclusive lower bound on similarity, {@code null} for none; applied before {@code limit}
 */
public record VectorQuery(
    float[] vector,
    int limit,
    MetadataFilter filter,
    Double minSimilarity,
    DistanceMetric metric
) {}
