package com.insightpulse.kgengine.service.graph;

import com.insightpulse.kgengine.model.graph.GraphPath;
import com.insightpulse.kgengine.model.graph.NeighborQuery;
import com.insightpulse.kgengine.model.graph.NeighborResult;

import java.util.List;
import java.util.Optional;

/**
 * Bounded traversal over the node/edge graph.
 * Both operations are breadth-first, so hop counts are always minimal.
 */
public interface GraphTraversalService {

    /**
     * Find every node reachable from the start node within {@code maxDepth} hops.
     *
     * Each reached node appears once, with its minimum hop distance and the type of the edge
     * it was first discovered through. The start node is never part of the result.
     * Ordered by hop distance, then slug.
     *
     * @param query start slug, optional edge type filter, direction and depth
     * @return reached nodes, empty if the start node has no matching edges
     * @throws com.insightpulse.kgengine.exception.NodeNotFoundException if the start node does not exist
     * @throws com.insightpulse.kgengine.exception.DepthLimitExceededException if maxDepth is above the configured ceiling
     */
    List<NeighborResult> neighbors(NeighborQuery query);

    /**
     * Find a minimum-hop path between two nodes. Edge weights are not considered.
     * The direction followed is fixed by {@code app.traversal.path-direction}.
     *
     * @param srcSlug Starting node
     * @param dstSlug Target node
     * @param maxDepth Maximum path length to search
     * @return the path, a zero-length path when src equals dst, or empty when either node
     *         is unknown or no path exists within maxDepth
     */
    Optional<GraphPath> shortestPath(String srcSlug, String dstSlug, int maxDepth);
}
