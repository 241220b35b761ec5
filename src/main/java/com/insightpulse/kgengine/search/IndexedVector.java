package com.insightpulse.kgengine.search;

/**
 * One node embedding as handed to {@link SimilarityIndex#rebuild}.
 */
public record IndexedVector(String slug, String nodeType, float[] vector) {
}
