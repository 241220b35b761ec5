package com.insightpulse.kgengine.model.retrieval;

import java.util.List;

/**
 * One entry of an assembled agent context.
 *
 * @param slug semantically matched node
 * @param nodeType its type tag
 * @param title display title
 * @param description display description (may be null)
 * @param relevanceScore cosine similarity between the task and the node
 * @param connectedNodes one-hop neighbors in either direction, supplementary and unranked
 */
public record ContextItem(
        String slug,
        String nodeType,
        String title,
        String description,
        double relevanceScore,
        List<ConnectedNode> connectedNodes
) {

    public ContextItem {
        connectedNodes = List.copyOf(connectedNodes);
    }
}
