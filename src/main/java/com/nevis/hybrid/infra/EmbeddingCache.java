package com.nevis.hybrid.infra;

import java.util.Optional;

/**
 * Optional cache of computed vectors keyed by provider id and input text. Entries expire after a
 * fixed time-to-live counted from the write.
 */
public interface EmbeddingCache {

    Optional<float[]> get(String providerId, String text);

    void put(String providerId, String text, float[] vector);

    void evict(String providerId, String text);

    void clear();
}
