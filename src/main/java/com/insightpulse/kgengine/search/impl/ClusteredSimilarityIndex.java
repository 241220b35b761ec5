package com.insightpulse.kgengine.search.impl;

import com.insightpulse.kgengine.search.SimilarityHit;
import com.insightpulse.kgengine.util.VectorMath;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inverted-file index: vectors are bucketed under their closest k-means centroid and a query
 * scans only the {@code probeCount} buckets whose centroids are closest to it.
 *
 * <p>Until the index holds {@code trainThreshold} vectors it answers with exact scans. Training
 * is deterministic (centroids are seeded from slug-ordered entries) and is repeated once the
 * index has doubled since the last run. New vectors between trainings join their nearest bucket.
 */
@Slf4j
public class ClusteredSimilarityIndex extends AbstractSimilarityIndex {

    private final int clusterCount;
    private final int probeCount;
    private final int trainThreshold;
    private final int iterations;

    private float[][] centroids;
    private final List<Set<String>> buckets = new ArrayList<>();
    private final Map<String, Integer> assignments = new HashMap<>();
    private int sizeAtTraining;

    public ClusteredSimilarityIndex(int dimensions, int clusterCount, int probeCount,
                                    int trainThreshold, int iterations) {
        super(dimensions);
        this.clusterCount = clusterCount;
        this.probeCount = probeCount;
        this.trainThreshold = trainThreshold;
        this.iterations = iterations;
    }

    @Override
    public List<SimilarityHit> search(float[] query, String nodeTypeFilter, int limit) {
        float[] unitQuery = prepareQuery(query, limit);
        lock.readLock().lock();
        try {
            if (!isTrained()) {
                return rank(entries.values(), unitQuery, nodeTypeFilter, limit);
            }
            List<Entry> candidates = new ArrayList<>();
            for (int cluster : closestClusters(unitQuery)) {
                for (String slug : buckets.get(cluster)) {
                    candidates.add(entries.get(slug));
                }
            }
            return rank(candidates, unitQuery, nodeTypeFilter, limit);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isTrained() {
        return centroids != null;
    }

    @Override
    protected void onUpsert(Entry entry, Entry previous) {
        if (previous != null) {
            unassign(previous.slug());
        }
        if (shouldTrain()) {
            train();
        } else if (isTrained()) {
            assign(entry.slug(), nearestCentroid(entry.unit()));
        }
    }

    @Override
    protected void onRemove(Entry removed) {
        unassign(removed.slug());
    }

    @Override
    protected void onRebuild() {
        centroids = null;
        buckets.clear();
        assignments.clear();
        sizeAtTraining = 0;
        if (shouldTrain()) {
            train();
        }
    }

    private boolean shouldTrain() {
        if (entries.size() < trainThreshold) {
            return false;
        }
        return !isTrained() || entries.size() >= 2 * sizeAtTraining;
    }

    /**
     * Spherical k-means: assignment by highest dot product, centroids re-normalized after each step.
     */
    private void train() {
        List<Entry> ordered = new ArrayList<>(entries.values());
        ordered.sort(Comparator.comparing(Entry::slug));
        int k = Math.min(clusterCount, ordered.size());

        float[][] trained = new float[k][];
        for (int c = 0; c < k; c++) {
            trained[c] = ordered.get((int) ((long) c * ordered.size() / k)).unit().clone();
        }

        int[] assignment = new int[ordered.size()];
        for (int iteration = 0; iteration < iterations; iteration++) {
            boolean changed = false;
            for (int i = 0; i < ordered.size(); i++) {
                int nearest = nearest(trained, ordered.get(i).unit());
                if (iteration == 0 || nearest != assignment[i]) {
                    assignment[i] = nearest;
                    changed = true;
                }
            }
            if (!changed) {
                break;
            }
            recomputeCentroids(trained, ordered, assignment);
        }

        centroids = trained;
        buckets.clear();
        assignments.clear();
        for (int c = 0; c < k; c++) {
            buckets.add(new LinkedHashSet<>());
        }
        for (int i = 0; i < ordered.size(); i++) {
            assign(ordered.get(i).slug(), assignment[i]);
        }
        sizeAtTraining = ordered.size();
        log.info("Trained clustered similarity index: {} vector(s) in {} cluster(s)", sizeAtTraining, k);
    }

    private void recomputeCentroids(float[][] trained, List<Entry> ordered, int[] assignment) {
        double[][] sums = new double[trained.length][dimensions];
        int[] counts = new int[trained.length];
        for (int i = 0; i < ordered.size(); i++) {
            float[] unit = ordered.get(i).unit();
            double[] sum = sums[assignment[i]];
            for (int d = 0; d < dimensions; d++) {
                sum[d] += unit[d];
            }
            counts[assignment[i]]++;
        }
        for (int c = 0; c < trained.length; c++) {
            // an empty cluster keeps its previous centroid
            if (counts[c] == 0) {
                continue;
            }
            float[] mean = new float[dimensions];
            for (int d = 0; d < dimensions; d++) {
                mean[d] = (float) (sums[c][d] / counts[c]);
            }
            if (VectorMath.norm(mean) > 0.0) {
                trained[c] = VectorMath.normalize(mean);
            }
        }
    }

    private List<Integer> closestClusters(float[] unitQuery) {
        List<Integer> order = new ArrayList<>();
        for (int c = 0; c < centroids.length; c++) {
            order.add(c);
        }
        double[] scores = new double[centroids.length];
        for (int c = 0; c < centroids.length; c++) {
            scores[c] = VectorMath.dot(unitQuery, centroids[c]);
        }
        order.sort(Comparator.<Integer>comparingDouble(c -> scores[c]).reversed()
                .thenComparing(Comparator.naturalOrder()));
        return order.subList(0, Math.min(probeCount, order.size()));
    }

    private int nearestCentroid(float[] unit) {
        return nearest(centroids, unit);
    }

    private static int nearest(float[][] candidates, float[] unit) {
        int best = 0;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int c = 0; c < candidates.length; c++) {
            double score = VectorMath.dot(unit, candidates[c]);
            if (score > bestScore) {
                bestScore = score;
                best = c;
            }
        }
        return best;
    }

    private void assign(String slug, int cluster) {
        buckets.get(cluster).add(slug);
        assignments.put(slug, cluster);
    }

    private void unassign(String slug) {
        Integer cluster = assignments.remove(slug);
        if (cluster != null) {
            buckets.get(cluster).remove(slug);
        }
    }
}
