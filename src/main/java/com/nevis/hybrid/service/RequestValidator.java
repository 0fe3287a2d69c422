package com.nevis.hybrid.service;

import com.nevis.hybrid.config.HybridStoreProperties;
import com.nevis.hybrid.exception.DimensionMismatchException;
import com.nevis.hybrid.exception.ValidationException;
import org.springframework.stereotype.Component;

/**
 * Argument checks shared by the store operations. Everything here runs before any external call.
 */
@Component
public class RequestValidator {

    private final int dimensions;
    private final int defaultLimit;
    private final int maxLimit;

    public RequestValidator(HybridStoreProperties properties) {
        this.dimensions = properties.dimensions();
        this.defaultLimit = properties.search().defaultLimit();
        this.maxLimit = properties.search().maxLimit();
    }

    public int dimensions() {
        return dimensions;
    }

    public int resolveLimit(Integer limit) {
        if (limit == null) {
            return defaultLimit;
        }
        if (limit < 1) {
            throw new ValidationException("limit must be at least 1, got " + limit);
        }
        if (limit > maxLimit) {
            throw new ValidationException("limit must be at most " + maxLimit + ", got " + limit);
        }
        return limit;
    }

    public void checkThreshold(Double threshold) {
        if (threshold != null && !Double.isFinite(threshold)) {
            throw new ValidationException("threshold must be a finite number");
        }
    }

    public void checkWeight(String name, double weight) {
        if (!Double.isFinite(weight) || weight < 0) {
            throw new ValidationException(name + " must be a finite number >= 0, got " + weight);
        }
    }

    public String requireText(String name, String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException(name + " cannot be blank");
        }
        return text;
    }

    public String requireId(String id) {
        return requireText("id", id);
    }

    public void checkVector(float[] vector) {
        if (vector == null) {
            throw new ValidationException("embedding cannot be null");
        }
        if (vector.length != dimensions) {
            throw new DimensionMismatchException(dimensions, vector.length);
        }
        for (float component : vector) {
            if (!Float.isFinite(component)) {
                throw new ValidationException("embedding contains a non-finite component");
            }
        }
    }
}
