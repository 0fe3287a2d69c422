package com.nevis.hybrid.service;

import java.util.List;

public interface EmbeddingService {

    /**
     * @return whether a provider is configured; without one every text operation is rejected
     */
    boolean isAvailable();

    /**
     * Embeds every text, one vector per input in input order. Either all vectors are returned or the call fails.
     */
    List<float[]> embedAll(List<String> texts);

    float[] embedQuery(String query);
}
