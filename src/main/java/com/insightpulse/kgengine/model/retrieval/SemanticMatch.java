package com.insightpulse.kgengine.model.retrieval;

/**
 * Node returned by semantic search, with its cosine similarity to the query.
 */
public record SemanticMatch(
        String slug,
        String nodeType,
        String title,
        String description,
        double similarity
) {
}
