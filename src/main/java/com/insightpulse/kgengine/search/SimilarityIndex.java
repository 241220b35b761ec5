package com.insightpulse.kgengine.search;

import java.util.Collection;
import java.util.List;

/**
 * Top-K cosine similarity over node embeddings.
 *
 * <p>Results are ordered by descending score, ties broken by ascending slug, and hold at most
 * {@code limit} hits. Nodes without an embedding are never indexed and never returned.
 *
 * <p>Implementations are safe for concurrent searches; updates are exclusive.
 */
public interface SimilarityIndex {

    /**
     * Index search. May be approximate.
     *
     * @param query query vector of the configured dimensionality
     * @param nodeTypeFilter only nodes of this type, or all types when null
     * @param limit maximum number of hits, at least 1
     */
    List<SimilarityHit> search(float[] query, String nodeTypeFilter, int limit);

    /**
     * Brute-force scan of every indexed vector. Any hit returned by {@link #search} for the same
     * arguments is a candidate of this scan with the identical score.
     */
    List<SimilarityHit> exactSearch(float[] query, String nodeTypeFilter, int limit);

    void upsert(String slug, String nodeType, float[] vector);

    void remove(String slug);

    /**
     * Replace the whole index content.
     */
    void rebuild(Collection<IndexedVector> vectors);

    void clear();

    int size();

    boolean contains(String slug);
}
