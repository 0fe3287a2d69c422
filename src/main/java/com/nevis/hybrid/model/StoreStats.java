package com.nevis.hybrid.model;

public record StoreStats(
    long totalDocuments,
    int dimensions,
    DistanceMetric distanceMetric,
    String backend,
    String tableName
) {}
