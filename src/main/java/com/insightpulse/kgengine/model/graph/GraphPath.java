package com.insightpulse.kgengine.model.graph;

import java.util.List;

/**
 * Minimum-hop path between two nodes. {@code pathEdges.get(i)} connects
 * {@code pathNodes.get(i)} and {@code pathNodes.get(i + 1)}.
 */
public record GraphPath(
        List<String> pathNodes,
        List<KgEdge> pathEdges,
        int pathLength
) {

    public GraphPath {
        pathNodes = List.copyOf(pathNodes);
        pathEdges = List.copyOf(pathEdges);
    }

    public List<String> edgeTypes() {
        return pathEdges.stream().map(KgEdge::getEdgeType).toList();
    }
}
