package com.insightpulse.kgengine.search.impl;

import com.insightpulse.kgengine.exception.ValidationException;
import com.insightpulse.kgengine.search.IndexedVector;
import com.insightpulse.kgengine.search.SimilarityHit;
import com.insightpulse.kgengine.search.SimilarityIndex;
import com.insightpulse.kgengine.util.GraphInputValidator;
import com.insightpulse.kgengine.util.VectorMath;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Entry storage, locking and ranking shared by the exact and clustered indexes.
 * Vectors are normalized on insert so scoring is a dot product.
 */
@Slf4j
abstract class AbstractSimilarityIndex implements SimilarityIndex {

    protected record Entry(String slug, String nodeType, float[] unit) {
    }

    protected final int dimensions;
    protected final Map<String, Entry> entries = new HashMap<>();
    protected final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    protected AbstractSimilarityIndex(int dimensions) {
        this.dimensions = dimensions;
    }

    @Override
    public List<SimilarityHit> exactSearch(float[] query, String nodeTypeFilter, int limit) {
        float[] unitQuery = prepareQuery(query, limit);
        lock.readLock().lock();
        try {
            return rank(entries.values(), unitQuery, nodeTypeFilter, limit);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void upsert(String slug, String nodeType, float[] vector) {
        GraphInputValidator.validateVector(vector, dimensions);
        Entry entry = new Entry(slug, nodeType, VectorMath.normalize(vector));
        lock.writeLock().lock();
        try {
            Entry previous = entries.put(slug, entry);
            onUpsert(entry, previous);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void remove(String slug) {
        lock.writeLock().lock();
        try {
            Entry removed = entries.remove(slug);
            if (removed != null) {
                onRemove(removed);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void rebuild(Collection<IndexedVector> vectors) {
        Map<String, Entry> fresh = new HashMap<>();
        for (IndexedVector vector : vectors) {
            if (vector.vector() == null || vector.vector().length != dimensions) {
                log.warn("Skipping {} during index rebuild: expected {} dimensions, found {}",
                        vector.slug(), dimensions, vector.vector() == null ? 0 : vector.vector().length);
                continue;
            }
            if (VectorMath.norm(vector.vector()) == 0.0) {
                log.warn("Skipping {} during index rebuild: zero vector", vector.slug());
                continue;
            }
            fresh.put(vector.slug(), new Entry(vector.slug(), vector.nodeType(), VectorMath.normalize(vector.vector())));
        }

        lock.writeLock().lock();
        try {
            entries.clear();
            entries.putAll(fresh);
            onRebuild();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Similarity index rebuilt with {} vector(s)", fresh.size());
    }

    @Override
    public void clear() {
        rebuild(List.of());
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean contains(String slug) {
        lock.readLock().lock();
        try {
            return entries.containsKey(slug);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Called under the write lock after {@code entries} changed. */
    protected abstract void onUpsert(Entry entry, Entry previous);

    /** Called under the write lock after {@code entries} changed. */
    protected abstract void onRemove(Entry removed);

    /** Called under the write lock after {@code entries} was replaced. */
    protected abstract void onRebuild();

    protected float[] prepareQuery(float[] query, int limit) {
        if (limit < 1) {
            throw new ValidationException("Search limit must be at least 1, got " + limit);
        }
        GraphInputValidator.validateVector(query, dimensions);
        return VectorMath.normalize(query);
    }

    /**
     * Keeps the best {@code limit} candidates in a bounded heap, then returns them in ranking order.
     */
    protected static List<SimilarityHit> rank(Iterable<Entry> candidates, float[] unitQuery,
                                              String nodeTypeFilter, int limit) {
        PriorityQueue<SimilarityHit> best = new PriorityQueue<>(SimilarityHit.RANKING.reversed());
        for (Entry entry : candidates) {
            if (nodeTypeFilter != null && !nodeTypeFilter.equals(entry.nodeType())) {
                continue;
            }
            best.offer(new SimilarityHit(entry.slug(), VectorMath.dot(unitQuery, entry.unit())));
            if (best.size() > limit) {
                best.poll();
            }
        }
        List<SimilarityHit> hits = new ArrayList<>(best);
        hits.sort(SimilarityHit.RANKING);
        return hits;
    }
}
