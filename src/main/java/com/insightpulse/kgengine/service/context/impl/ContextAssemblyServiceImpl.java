package com.insightpulse.kgengine.service.context.impl;

import com.insightpulse.kgengine.configuration.AppProperties;
import com.insightpulse.kgengine.exception.ValidationException;
import com.insightpulse.kgengine.knowledge.EdgeStore;
import com.insightpulse.kgengine.knowledge.EmbeddingService;
import com.insightpulse.kgengine.knowledge.RelationshipDirection;
import com.insightpulse.kgengine.model.graph.KgEdge;
import com.insightpulse.kgengine.model.graph.KgNode;
import com.insightpulse.kgengine.model.retrieval.ConnectedNode;
import com.insightpulse.kgengine.model.retrieval.ContextItem;
import com.insightpulse.kgengine.repository.KgNodeRepository;
import com.insightpulse.kgengine.search.SimilarityHit;
import com.insightpulse.kgengine.search.SimilarityIndex;
import com.insightpulse.kgengine.service.context.ContextAssemblyService;
import com.insightpulse.kgengine.util.StoreCalls;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ContextAssemblyServiceImpl implements ContextAssemblyService {

    private static final Comparator<ConnectedNode> CONNECTED_ORDER = Comparator
            .comparing(ConnectedNode::slug)
            .thenComparing(ConnectedNode::edgeType);

    private final EmbeddingService embeddingService;
    private final SimilarityIndex similarityIndex;
    private final EdgeStore edgeStore;
    private final KgNodeRepository nodeRepository;
    private final AppProperties appProperties;
    private final PlatformTransactionManager transactionManager;

    @Override
    public List<ContextItem> contextFor(String taskDescription) {
        return contextFor(taskDescription, appProperties.getContext().getDefaultMaxNodes());
    }

    @Override
    public List<ContextItem> contextFor(String taskDescription, int maxNodes) {
        if (taskDescription == null || taskDescription.isBlank()) {
            throw new ValidationException("Task description cannot be blank");
        }
        validateMaxNodes(maxNodes);
        float[] queryVector = embeddingService.embed(taskDescription);

        // embedding stays outside the transaction; the store reads share one read-only snapshot
        TransactionTemplate readOnly = new TransactionTemplate(transactionManager);
        readOnly.setReadOnly(true);
        return readOnly.execute(status -> assemble(queryVector, maxNodes));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ContextItem> contextForVector(float[] queryVector, int maxNodes) {
        validateMaxNodes(maxNodes);
        return assemble(queryVector, maxNodes);
    }

    private List<ContextItem> assemble(float[] queryVector, int maxNodes) {
        List<SimilarityHit> hits = similarityIndex.search(queryVector, null, maxNodes);
        if (hits.isEmpty()) {
            return List.of();
        }

        List<String> matchedSlugs = hits.stream().map(SimilarityHit::slug).toList();
        List<KgEdge> edges = edgeStore.edgesOf(matchedSlugs, RelationshipDirection.BOTH);

        Set<String> wanted = new HashSet<>(matchedSlugs);
        edges.forEach(edge -> {
            wanted.add(edge.getSrcSlug());
            wanted.add(edge.getDstSlug());
        });
        Map<String, KgNode> nodes = StoreCalls.read("load context nodes", () -> nodeRepository.findBySlugIn(wanted))
                .stream()
                .collect(Collectors.toMap(KgNode::getSlug, Function.identity()));

        Set<String> matched = new HashSet<>(matchedSlugs);
        Map<String, Set<ConnectedNode>> connected = new HashMap<>();
        for (KgEdge edge : edges) {
            if (matched.contains(edge.getSrcSlug())) {
                attach(connected, nodes, edge, edge.getSrcSlug(), edge.getDstSlug());
            }
            if (matched.contains(edge.getDstSlug())) {
                attach(connected, nodes, edge, edge.getDstSlug(), edge.getSrcSlug());
            }
        }

        List<ContextItem> items = new ArrayList<>();
        for (SimilarityHit hit : hits) {
            KgNode node = nodes.get(hit.slug());
            if (node == null) {
                log.warn("Similarity index returned {} which is no longer in the store", hit.slug());
                continue;
            }
            List<ConnectedNode> neighbors = new ArrayList<>(connected.getOrDefault(hit.slug(), Set.of()));
            neighbors.sort(CONNECTED_ORDER);
            items.add(new ContextItem(node.getSlug(), node.getNodeType(), node.getTitle(), node.getDescription(),
                    hit.score(), neighbors));
        }

        log.debug("Assembled context: {} node(s), {} edge(s) in neighborhood", items.size(), edges.size());
        return items;
    }

    /**
     * Dangling endpoints are left out of the neighborhood.
     */
    private static void attach(Map<String, Set<ConnectedNode>> connected, Map<String, KgNode> nodes,
                               KgEdge edge, String from, String to) {
        KgNode neighbor = nodes.get(to);
        if (neighbor == null) {
            return;
        }
        connected.computeIfAbsent(from, key -> new LinkedHashSet<>())
                .add(new ConnectedNode(neighbor.getSlug(), neighbor.getNodeType(), neighbor.getTitle(), edge.getEdgeType()));
    }

    private void validateMaxNodes(int maxNodes) {
        int limit = appProperties.getContext().getMaxNodesLimit();
        if (maxNodes < 1 || maxNodes > limit) {
            throw new ValidationException("maxNodes must be between 1 and " + limit + ", got " + maxNodes);
        }
    }
}
