package com.insightpulse.kgengine.service;

import com.insightpulse.kgengine.model.graph.EdgeCreate;
import com.insightpulse.kgengine.model.graph.GraphPath;
import com.insightpulse.kgengine.model.graph.KgEdge;
import com.insightpulse.kgengine.model.graph.KgNode;
import com.insightpulse.kgengine.model.graph.NeighborQuery;
import com.insightpulse.kgengine.model.graph.NeighborResult;
import com.insightpulse.kgengine.model.graph.NodeUpsert;
import com.insightpulse.kgengine.model.retrieval.ContextItem;
import com.insightpulse.kgengine.model.retrieval.SemanticMatch;

import java.util.List;
import java.util.Optional;

/**
 * Single entry point for agents and ingestion jobs.
 *
 * Mutations go to the node and edge stores, queries to the similarity index, the traversal
 * engine and the context assembler. Every failure is a
 * {@link com.insightpulse.kgengine.exception.KnowledgeGraphException}.
 */
public interface KnowledgeGraphService {

    /**
     * Create or update a node. With {@code app.embedding.auto-embed} enabled, a node left without
     * an embedding is embedded once the upsert has committed; an embedding failure is logged and
     * does not fail the upsert.
     */
    KgNode upsertNode(NodeUpsert request);

    KgNode getNode(String slug);

    Optional<KgNode> findNode(String slug);

    List<KgNode> findNodesByType(String nodeType);

    /**
     * @return number of incident edges removed with the node
     */
    int deleteNode(String slug);

    KgEdge createEdge(EdgeCreate request);

    void deleteEdge(String srcSlug, String dstSlug, String edgeType);

    void setEmbedding(String slug, float[] vector);

    void clearEmbedding(String slug);

    /**
     * Recompute a node's embedding from its title and description.
     *
     * @throws com.insightpulse.kgengine.exception.EmbeddingException if the model call fails
     */
    void refreshEmbedding(String slug);

    /**
     * Embed every node that has no embedding yet. Failures are logged per node.
     *
     * @return number of embeddings stored
     */
    int embedMissing();

    /**
     * Top-K nodes by cosine similarity to the query text.
     *
     * @param queryText natural-language query
     * @param nodeType only nodes of this type, or null for all
     * @param limit maximum number of matches
     */
    List<SemanticMatch> semanticSearch(String queryText, String nodeType, int limit);

    List<SemanticMatch> semanticSearch(float[] queryVector, String nodeType, int limit);

    List<NeighborResult> neighbors(NeighborQuery query);

    Optional<GraphPath> shortestPath(String srcSlug, String dstSlug, int maxDepth);

    /**
     * Shortest path searched up to the configured depth ceiling.
     */
    Optional<GraphPath> shortestPath(String srcSlug, String dstSlug);

    List<ContextItem> contextFor(String taskDescription);

    List<ContextItem> contextFor(String taskDescription, int maxNodes);
}
