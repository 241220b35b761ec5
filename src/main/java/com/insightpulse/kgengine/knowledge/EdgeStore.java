package com.insightpulse.kgengine.knowledge;

import com.insightpulse.kgengine.model.graph.EdgeCreate;
import com.insightpulse.kgengine.model.graph.KgEdge;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Directed, typed, weighted relationships. No self loops; (src, dst, type) is unique.
 */
public interface EdgeStore {

    /**
     * @throws com.insightpulse.kgengine.exception.SelfLoopException if src equals dst
     * @throws com.insightpulse.kgengine.exception.DanglingReferenceException if an endpoint is missing
     *         and soft references are disabled
     * @throws com.insightpulse.kgengine.exception.DuplicateEdgeException if the triple exists and the
     *         duplicate policy is FAIL; with IGNORE the existing edge is returned
     */
    KgEdge createEdge(EdgeCreate request);

    /**
     * @throws com.insightpulse.kgengine.exception.EdgeNotFoundException if the triple does not exist
     */
    void deleteEdge(String srcSlug, String dstSlug, String edgeType);

    Optional<KgEdge> findEdge(String srcSlug, String dstSlug, String edgeType);

    /**
     * Direct lookup of the edges touching one node. No traversal.
     */
    List<KgEdge> neighborsOf(String slug, RelationshipDirection direction);

    /**
     * Edges touching any node of a frontier, used for level-by-level expansion.
     */
    List<KgEdge> edgesOf(Collection<String> slugs, RelationshipDirection direction);
}
