package com.insightpulse.kgengine.search;

import java.util.Comparator;

/**
 * @param slug matched node
 * @param score cosine similarity between the query and the node's embedding
 */
public record SimilarityHit(String slug, double score) {

    /**
     * Descending score, then ascending slug.
     */
    public static final Comparator<SimilarityHit> RANKING = Comparator
            .comparingDouble(SimilarityHit::score).reversed()
            .thenComparing(SimilarityHit::slug);
}
