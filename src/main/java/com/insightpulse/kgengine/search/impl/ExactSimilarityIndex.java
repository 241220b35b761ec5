package com.insightpulse.kgengine.search.impl;

import com.insightpulse.kgengine.search.SimilarityHit;

import java.util.List;

/**
 * Brute-force cosine scan over every embedded node. Full recall.
 */
public class ExactSimilarityIndex extends AbstractSimilarityIndex {

    public ExactSimilarityIndex(int dimensions) {
        super(dimensions);
    }

    @Override
    public List<SimilarityHit> search(float[] query, String nodeTypeFilter, int limit) {
        return exactSearch(query, nodeTypeFilter, limit);
    }

    @Override
    protected void onUpsert(Entry entry, Entry previous) {
    }

    @Override
    protected void onRemove(Entry removed) {
    }

    @Override
    protected void onRebuild() {
    }
}
