package com.insightpulse.kgengine.search.impl;

import com.insightpulse.kgengine.search.IndexedVector;
import com.insightpulse.kgengine.search.SimilarityHit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Clustered Similarity Index Tests")
class ClusteredSimilarityIndexTest {

    private static final int DIMENSIONS = 8;

    @Test
    @DisplayName("Should answer exactly while below the training threshold")
    void testUntrained_ShouldMatchExactSearch() {
        // Given
        ClusteredSimilarityIndex index = new ClusteredSimilarityIndex(DIMENSIONS, 4, 1, 100, 10);
        index.rebuild(randomVectors(50, 1L));
        float[] query = randomVector(new Random(99L));

        // When
        List<SimilarityHit> approximate = index.search(query, null, 10);
        List<SimilarityHit> exact = index.exactSearch(query, null, 10);

        // Then
        assertFalse(index.isTrained());
        assertEquals(exact, approximate);
    }

    @Test
    @DisplayName("Should only return exact candidates with identical scores once trained")
    void testTrained_HitsAreSubsetOfExactCandidates() {
        // Given: Enough vectors to train, one probed cluster
        ClusteredSimilarityIndex index = new ClusteredSimilarityIndex(DIMENSIONS, 8, 1, 100, 10);
        index.rebuild(randomVectors(400, 7L));
        assertTrue(index.isTrained());

        Random random = new Random(3L);
        for (int q = 0; q < 20; q++) {
            float[] query = randomVector(random);

            // When
            List<SimilarityHit> approximate = index.search(query, null, 10);
            Map<String, Double> exactScores = index.exactSearch(query, null, index.size()).stream()
                    .collect(Collectors.toMap(SimilarityHit::slug, SimilarityHit::score));

            // Then
            assertTrue(approximate.size() <= 10);
            for (int i = 0; i < approximate.size(); i++) {
                SimilarityHit hit = approximate.get(i);
                assertEquals(exactScores.get(hit.slug()), hit.score(), 1e-12, "Score must match the exact scan");
                if (i > 0) {
                    assertTrue(approximate.get(i - 1).score() >= hit.score());
                }
            }
        }
    }

    @Test
    @DisplayName("Should equal exact search when every cluster is probed")
    void testProbeAllClusters_ShouldMatchExactSearch() {
        ClusteredSimilarityIndex index = new ClusteredSimilarityIndex(DIMENSIONS, 6, 6, 50, 10);
        index.rebuild(randomVectors(300, 11L));
        float[] query = randomVector(new Random(5L));

        assertTrue(index.isTrained());
        assertEquals(index.exactSearch(query, null, 15), index.search(query, null, 15));
        assertEquals(index.exactSearch(query, "service", 15), index.search(query, "service", 15));
    }

    @Test
    @DisplayName("Should train identically for identical content")
    void testTraining_IsDeterministic() {
        List<IndexedVector> vectors = randomVectors(200, 21L);
        ClusteredSimilarityIndex first = new ClusteredSimilarityIndex(DIMENSIONS, 5, 2, 50, 10);
        ClusteredSimilarityIndex second = new ClusteredSimilarityIndex(DIMENSIONS, 5, 2, 50, 10);
        first.rebuild(vectors);
        List<IndexedVector> reversed = new ArrayList<>(vectors);
        Collections.reverse(reversed);
        second.rebuild(reversed);

        float[] query = randomVector(new Random(8L));
        assertEquals(first.search(query, null, 10), second.search(query, null, 10));
    }

    @Test
    @DisplayName("Should route upserts and removals through the trained buckets")
    void testIncrementalUpdates() {
        // Given
        ClusteredSimilarityIndex index = new ClusteredSimilarityIndex(DIMENSIONS, 4, 4, 50, 10);
        index.rebuild(randomVectors(100, 31L));
        float[] target = randomVector(new Random(77L));

        // When: A vector identical to the query is added
        index.upsert("module:target", "module", target);

        // Then: It ranks first with similarity 1
        SimilarityHit top = index.search(target, null, 1).get(0);
        assertEquals("module:target", top.slug());
        assertEquals(1.0, top.score(), 1e-6);

        // When: It is removed again
        index.remove("module:target");

        // Then
        assertTrue(index.search(target, null, 100).stream().noneMatch(hit -> hit.slug().equals("module:target")));
        assertEquals(100, index.size());
    }

    @Test
    @DisplayName("Should train once the threshold is reached by upserts")
    void testUpsert_TriggersTraining() {
        ClusteredSimilarityIndex index = new ClusteredSimilarityIndex(DIMENSIONS, 4, 2, 20, 10);
        List<IndexedVector> vectors = randomVectors(20, 41L);

        for (IndexedVector vector : vectors.subList(0, 19)) {
            index.upsert(vector.slug(), vector.nodeType(), vector.vector());
        }
        assertFalse(index.isTrained());

        IndexedVector last = vectors.get(19);
        index.upsert(last.slug(), last.nodeType(), last.vector());
        assertTrue(index.isTrained());
    }

    private static List<IndexedVector> randomVectors(int count, long seed) {
        Random random = new Random(seed);
        String[] types = {"service", "module", "schema"};
        List<IndexedVector> vectors = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            vectors.add(new IndexedVector(String.format("node:%04d", i), types[i % types.length], randomVector(random)));
        }
        return vectors;
    }

    private static float[] randomVector(Random random) {
        float[] vector = new float[DIMENSIONS];
        for (int d = 0; d < DIMENSIONS; d++) {
            vector[d] = (float) random.nextGaussian();
        }
        return vector;
    }
}
