package com.nevis.hybrid.model;

import java.util.Locale;

/**
 * Distance functions supported by the store.
 *
 * <p>Every metric reports a distance where lower means closer. Search results expose
 * {@code similarity = 1 - distance}, so callers always read higher as better whatever
 * metric the store was created with.
 */
public enum DistanceMetric {

    /**
     * {@code 1 - (a.b)/(|a||b|)}. A zero vector on either side yields {@link #MAX_COSINE_DISTANCE}.
     */
    COSINE {
        @Override
        public double distance(float[] a, float[] b) {
            checkLengths(a, b);
            double dot = 0;
            double normA = 0;
            double normB = 0;
            for (int i = 0; i < a.length; i++) {
                dot += (double) a[i] * b[i];
                normA += (double) a[i] * a[i];
                normB += (double) b[i] * b[i];
            }
            if (normA == 0 || normB == 0) {
                return MAX_COSINE_DISTANCE;
            }
            return 1.0 - dot / (Math.sqrt(normA) * Math.sqrt(normB));
        }
    },

    /**
     * Euclidean distance {@code sqrt(sum((a_i - b_i)^2))}.
     */
    L2 {
        @Override
        public double distance(float[] a, float[] b) {
            checkLengths(a, b);
            double sum = 0;
            for (int i = 0; i < a.length; i++) {
                double diff = (double) a[i] - b[i];
                sum += diff * diff;
            }
            return Math.sqrt(sum);
        }
    },

    /**
     * Negated dot product {@code -(a.b)}.
     */
    INNER_PRODUCT {
        @Override
        public double distance(float[] a, float[] b) {
            checkLengths(a, b);
            double dot = 0;
            for (int i = 0; i < a.length; i++) {
                dot += (double) a[i] * b[i];
            }
            return -dot;
        }
    };

    public static final double MAX_COSINE_DISTANCE = 2.0;

    /**
     * @throws IllegalArgumentException when the vectors differ in length; that is a caller bug,
     *                                  stored data is validated long before it gets here
     */
    public abstract double distance(float[] a, float[] b);

    public double similarity(float[] a, float[] b) {
        return toSimilarity(distance(a, b));
    }

    public static double toSimilarity(double distance) {
        return 1.0 - distance;
    }

    public static DistanceMetric parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Distance metric cannot be blank");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "cosine" -> COSINE;
            case "l2", "euclidean" -> L2;
            case "inner_product", "ip", "dot" -> INNER_PRODUCT;
            default -> throw new IllegalArgumentException("Unknown distance metric: " + value);
        };
    }

    private static void checkLengths(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                "Vectors must have the same length: " + a.length + " != " + b.length);
        }
    }
}
