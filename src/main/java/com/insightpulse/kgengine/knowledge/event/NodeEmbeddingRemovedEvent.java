package com.insightpulse.kgengine.knowledge.event;

/**
 * A node was deleted or lost its embedding.
 */
public record NodeEmbeddingRemovedEvent(String slug) {
}
