package com.insightpulse.kgengine.knowledge;

import java.util.List;

/**
 * External embedding model: fixed-length vectors for text.
 *
 * Implementations throw {@link com.insightpulse.kgengine.exception.EmbeddingException} on any failure
 * and never return placeholder vectors.
 */
public interface EmbeddingService {

    /**
     * Generate an embedding for arbitrary text (node content or a search query).
     *
     * @param text the text to embed, not blank
     * @return embedding vector
     */
    float[] embed(String text);

    /**
     * Generate embeddings for several texts.
     *
     * @return vectors in input order
     */
    List<float[]> embedAll(List<String> texts);
}
