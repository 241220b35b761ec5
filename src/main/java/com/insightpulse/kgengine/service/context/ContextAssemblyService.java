package com.insightpulse.kgengine.service.context;

import com.insightpulse.kgengine.model.retrieval.ContextItem;

import java.util.List;

/**
 * Builds the context bundle an agent receives for a task: the semantically closest nodes,
 * each with its immediate neighborhood.
 */
public interface ContextAssemblyService {

    /**
     * Uses the configured default number of nodes.
     */
    List<ContextItem> contextFor(String taskDescription);

    /**
     * @param taskDescription natural-language task, embedded as the query
     * @param maxNodes number of semantic matches to return
     * @return matches by descending relevance (ties by slug), each with its one-hop neighbors
     * @throws com.insightpulse.kgengine.exception.ValidationException if the task text is blank
     * @throws com.insightpulse.kgengine.exception.EmbeddingException if the task cannot be embedded
     */
    List<ContextItem> contextFor(String taskDescription, int maxNodes);

    /**
     * Same as {@link #contextFor(String, int)} for a caller that already holds the query vector.
     */
    List<ContextItem> contextForVector(float[] queryVector, int maxNodes);
}
