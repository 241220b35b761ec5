package com.insightpulse.kgengine.knowledge;

import com.insightpulse.kgengine.model.graph.KgNode;
import com.insightpulse.kgengine.model.graph.NodeUpsert;

import java.util.List;
import java.util.Optional;

/**
 * Canonical node storage. Every mutation is mirrored into the {@link MutationLog}.
 */
public interface NodeStore {

    /**
     * Create the node if its slug is new, otherwise overwrite only the supplied fields.
     * Refreshes {@code updatedAt} in both cases.
     *
     * @param request slug is required; nodeType and title are required on create
     * @return the stored node
     * @throws com.insightpulse.kgengine.exception.ValidationException on malformed input
     */
    KgNode upsertNode(NodeUpsert request);

    /**
     * @throws com.insightpulse.kgengine.exception.NodeNotFoundException if no node has this slug
     */
    KgNode getNode(String slug);

    Optional<KgNode> findNode(String slug);

    List<KgNode> findNodesByType(String nodeType);

    boolean exists(String slug);

    /**
     * Store a computed embedding and notify the similarity index.
     *
     * @throws com.insightpulse.kgengine.exception.DimensionMismatchException if the length is not the configured one
     */
    void setEmbedding(String slug, float[] vector);

    /**
     * Drop a node's embedding; the node leaves all similarity results.
     */
    void clearEmbedding(String slug);

    /**
     * Delete the node and every incident edge in one transaction.
     *
     * @return number of edges removed with the node
     * @throws com.insightpulse.kgengine.exception.NodeNotFoundException if no node has this slug
     */
    int deleteNode(String slug);
}
