package com.insightpulse.kgengine.model.graph;

/**
 * A node reached by neighbor expansion.
 *
 * @param slug reached node
 * @param nodeType type tag of the reached node
 * @param title display title of the reached node
 * @param edgeType type of the edge through which the node was first discovered
 * @param hopDistance minimum number of matching edges from the start node
 */
public record NeighborResult(
        String slug,
        String nodeType,
        String title,
        String edgeType,
        int hopDistance
) {
}
