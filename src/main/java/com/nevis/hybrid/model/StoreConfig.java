package com.nevis.hybrid.model;

import java.util.Objects;

/**
 * Fixed per-store settings. Set once when the store is built.
 */
public record StoreConfig(int dimensions, DistanceMetric distanceMetric) {

    public StoreConfig {
        if (dimensions < 1) {
            throw new IllegalArgumentException("dimensions must be positive, got " + dimensions);
        }
        Objects.requireNonNull(distanceMetric, "distanceMetric");
    }
}
