package com.nevis.hybrid.infra;

import java.util.List;

/**
 * Turns text into fixed-length vectors.
 */
public interface EmbeddingProvider {

    /**
     * Stable identifier of the model behind this provider, used to key cached vectors.
     */
    String id();

    int getDimensions();

    /**
     * @return one vector per input text, in input order
     */
    List<float[]> embed(List<String> texts);
}
