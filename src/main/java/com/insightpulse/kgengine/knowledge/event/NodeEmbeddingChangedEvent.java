package com.insightpulse.kgengine.knowledge.event;

/**
 * A node's embedding or type changed; the similarity index must reflect it.
 */
public record NodeEmbeddingChangedEvent(String slug, String nodeType, float[] embedding) {
}
