package com.insightpulse.kgengine.service.impl;

import com.insightpulse.kgengine.configuration.AppProperties;
import com.insightpulse.kgengine.exception.EmbeddingException;
import com.insightpulse.kgengine.exception.KnowledgeGraphException;
import com.insightpulse.kgengine.exception.ValidationException;
import com.insightpulse.kgengine.knowledge.EdgeStore;
import com.insightpulse.kgengine.knowledge.EmbeddingService;
import com.insightpulse.kgengine.knowledge.GraphTaxonomy;
import com.insightpulse.kgengine.knowledge.MutationLog;
import com.insightpulse.kgengine.knowledge.NodeStore;
import com.insightpulse.kgengine.model.audit.MutationOperation;
import com.insightpulse.kgengine.model.audit.MutationRecord;
import com.insightpulse.kgengine.model.graph.EdgeCreate;
import com.insightpulse.kgengine.model.graph.GraphPath;
import com.insightpulse.kgengine.model.graph.KgEdge;
import com.insightpulse.kgengine.model.graph.KgNode;
import com.insightpulse.kgengine.model.graph.NeighborQuery;
import com.insightpulse.kgengine.model.graph.NeighborResult;
import com.insightpulse.kgengine.model.graph.NodeUpsert;
import com.insightpulse.kgengine.model.retrieval.ContextItem;
import com.insightpulse.kgengine.model.retrieval.SemanticMatch;
import com.insightpulse.kgengine.repository.KgNodeRepository;
import com.insightpulse.kgengine.search.SimilarityHit;
import com.insightpulse.kgengine.search.SimilarityIndex;
import com.insightpulse.kgengine.service.KnowledgeGraphService;
import com.insightpulse.kgengine.service.context.ContextAssemblyService;
import com.insightpulse.kgengine.service.graph.GraphTraversalService;
import com.insightpulse.kgengine.util.StoreCalls;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeGraphServiceImpl implements KnowledgeGraphService {

    private final NodeStore nodeStore;
    private final EdgeStore edgeStore;
    private final MutationLog mutationLog;
    private final EmbeddingService embeddingService;
    private final SimilarityIndex similarityIndex;
    private final GraphTraversalService traversalService;
    private final ContextAssemblyService contextAssemblyService;
    private final KgNodeRepository nodeRepository;
    private final GraphTaxonomy taxonomy;
    private final AppProperties appProperties;
    private final PlatformTransactionManager transactionManager;

    @Override
    public KgNode upsertNode(NodeUpsert request) {
        KgNode node = nodeStore.upsertNode(request);
        if (appProperties.getEmbedding().isAutoEmbed() && !node.hasEmbedding()) {
            afterCommit(() -> autoEmbed(node.getSlug()));
        }
        return node;
    }

    @Override
    public KgNode getNode(String slug) {
        return nodeStore.getNode(slug);
    }

    @Override
    public Optional<KgNode> findNode(String slug) {
        return nodeStore.findNode(slug);
    }

    @Override
    public List<KgNode> findNodesByType(String nodeType) {
        return nodeStore.findNodesByType(nodeType);
    }

    @Override
    public int deleteNode(String slug) {
        return nodeStore.deleteNode(slug);
    }

    @Override
    public KgEdge createEdge(EdgeCreate request) {
        return edgeStore.createEdge(request);
    }

    @Override
    public void deleteEdge(String srcSlug, String dstSlug, String edgeType) {
        edgeStore.deleteEdge(srcSlug, dstSlug, edgeType);
    }

    @Override
    public void setEmbedding(String slug, float[] vector) {
        nodeStore.setEmbedding(slug, vector);
    }

    @Override
    public void clearEmbedding(String slug) {
        nodeStore.clearEmbedding(slug);
    }

    @Override
    public void refreshEmbedding(String slug) {
        KgNode node = nodeStore.getNode(slug);
        nodeStore.setEmbedding(slug, embedOrLogFailure(node));
    }

    @Override
    public int embedMissing() {
        List<KgNode> pending = StoreCalls.read("nodes without embedding", nodeRepository::findAllWithoutEmbedding);
        int stored = 0;
        for (KgNode node : pending) {
            try {
                nodeStore.setEmbedding(node.getSlug(), embedOrLogFailure(node));
                stored++;
            } catch (KnowledgeGraphException e) {
                log.warn("Could not embed {}: {}", node.getSlug(), e.getMessage());
            }
        }
        if (!pending.isEmpty()) {
            log.info("Embedded {} of {} node(s) without embedding", stored, pending.size());
        }
        return stored;
    }

    @Override
    public List<SemanticMatch> semanticSearch(String queryText, String nodeType, int limit) {
        if (queryText == null || queryText.isBlank()) {
            throw new ValidationException("Query text cannot be blank");
        }
        validateSearch(nodeType, limit);
        return semanticSearch(embeddingService.embed(queryText), nodeType, limit);
    }

    @Override
    public List<SemanticMatch> semanticSearch(float[] queryVector, String nodeType, int limit) {
        validateSearch(nodeType, limit);
        List<SimilarityHit> hits = similarityIndex.search(queryVector, nodeType, limit);
        if (hits.isEmpty()) {
            return List.of();
        }

        Map<String, KgNode> nodes = StoreCalls.read("load search results",
                        () -> nodeRepository.findBySlugIn(hits.stream().map(SimilarityHit::slug).toList()))
                .stream()
                .collect(Collectors.toMap(KgNode::getSlug, Function.identity()));

        List<SemanticMatch> matches = new ArrayList<>(hits.size());
        for (SimilarityHit hit : hits) {
            KgNode node = nodes.get(hit.slug());
            if (node != null) {
                matches.add(new SemanticMatch(node.getSlug(), node.getNodeType(), node.getTitle(),
                        node.getDescription(), hit.score()));
            }
        }
        return matches;
    }

    @Override
    public List<NeighborResult> neighbors(NeighborQuery query) {
        return traversalService.neighbors(query);
    }

    @Override
    public Optional<GraphPath> shortestPath(String srcSlug, String dstSlug, int maxDepth) {
        return traversalService.shortestPath(srcSlug, dstSlug, maxDepth);
    }

    @Override
    public Optional<GraphPath> shortestPath(String srcSlug, String dstSlug) {
        return traversalService.shortestPath(srcSlug, dstSlug, appProperties.getTraversal().getMaxDepth());
    }

    @Override
    public List<ContextItem> contextFor(String taskDescription) {
        return contextAssemblyService.contextFor(taskDescription);
    }

    @Override
    public List<ContextItem> contextFor(String taskDescription, int maxNodes) {
        return contextAssemblyService.contextFor(taskDescription, maxNodes);
    }

    private void validateSearch(String nodeType, int limit) {
        if (nodeType != null) {
            taxonomy.requireNodeType(nodeType);
        }
        if (limit < 1) {
            throw new ValidationException("Search limit must be at least 1, got " + limit);
        }
    }

    /**
     * Runs in its own transaction: when called from afterCommit the finished transaction's
     * resources are still bound to the thread.
     */
    private void autoEmbed(String slug) {
        TransactionTemplate requiresNew = new TransactionTemplate(transactionManager);
        requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        try {
            requiresNew.executeWithoutResult(status -> refreshEmbedding(slug));
        } catch (KnowledgeGraphException e) {
            log.warn("Auto-embedding of {} failed, node keeps no embedding: {}", slug, e.getMessage());
        }
    }

    /**
     * Model failures are not mutations of the store, so they are recorded here.
     */
    private float[] embedOrLogFailure(KgNode node) {
        try {
            return embeddingService.embed(node.embeddingText());
        } catch (EmbeddingException e) {
            mutationLog.recordIsolated(MutationRecord.failure(MutationOperation.EMBEDDING_SET, node.getSlug(),
                    appProperties.getGraph().getMutationSource(), e, null));
            throw e;
        }
    }

    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }
}
