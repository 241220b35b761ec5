package com.insightpulse.kgengine.service.graph.impl;

import com.insightpulse.kgengine.configuration.AppProperties;
import com.insightpulse.kgengine.exception.DepthLimitExceededException;
import com.insightpulse.kgengine.exception.NodeNotFoundException;
import com.insightpulse.kgengine.exception.ValidationException;
import com.insightpulse.kgengine.knowledge.EdgeStore;
import com.insightpulse.kgengine.knowledge.GraphTaxonomy;
import com.insightpulse.kgengine.knowledge.RelationshipDirection;
import com.insightpulse.kgengine.model.graph.GraphPath;
import com.insightpulse.kgengine.model.graph.KgEdge;
import com.insightpulse.kgengine.model.graph.KgNode;
import com.insightpulse.kgengine.model.graph.NeighborQuery;
import com.insightpulse.kgengine.model.graph.NeighborResult;
import com.insightpulse.kgengine.repository.KgNodeRepository;
import com.insightpulse.kgengine.service.graph.GraphTraversalService;
import com.insightpulse.kgengine.util.StoreCalls;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Level-synchronous BFS. Each level costs one edge query for the whole frontier and one node
 * query for the newly discovered slugs.
 *
 * Determinism: the frontier is expanded in slug order, and each parent's edges in
 * (edge type, neighbor slug) order, so the discovering edge of a node is stable across runs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphTraversalServiceImpl implements GraphTraversalService {

    private static final Comparator<Step> STEP_ORDER = Comparator
            .comparing(Step::parent)
            .thenComparing(step -> step.edge().getEdgeType())
            .thenComparing(Step::child)
            .thenComparing(step -> step.edge().getId());

    private final EdgeStore edgeStore;
    private final KgNodeRepository nodeRepository;
    private final GraphTaxonomy taxonomy;
    private final AppProperties appProperties;

    /**
     * One candidate expansion: {@code parent} reaches {@code child} over {@code edge}.
     */
    private record Step(String parent, String child, KgEdge edge) {
    }

    @Override
    @Transactional(readOnly = true)
    public List<NeighborResult> neighbors(NeighborQuery query) {
        if (query == null || query.getStartSlug() == null || query.getStartSlug().isBlank()) {
            throw new ValidationException("Neighbor query requires a start slug");
        }
        RelationshipDirection direction = query.getDirection() == null
                ? RelationshipDirection.OUTGOING : query.getDirection();
        validateDepth(query.getMaxDepth());
        if (query.getEdgeType() != null) {
            taxonomy.requireEdgeType(query.getEdgeType());
        }

        String start = query.getStartSlug();
        if (!StoreCalls.read("exists " + start, () -> nodeRepository.existsById(start))) {
            throw new NodeNotFoundException(start);
        }

        Set<String> visited = new HashSet<>();
        visited.add(start);
        List<String> frontier = List.of(start);
        List<NeighborResult> results = new ArrayList<>();

        for (int hop = 1; hop <= query.getMaxDepth() && !frontier.isEmpty(); hop++) {
            List<Step> steps = expand(frontier, direction, query.getEdgeType());

            Map<String, String> discoveredVia = new LinkedHashMap<>();
            for (Step step : steps) {
                if (!visited.contains(step.child())) {
                    discoveredVia.putIfAbsent(step.child(), step.edge().getEdgeType());
                }
            }

            Map<String, KgNode> nodes = loadNodes(discoveredVia.keySet());
            List<String> next = new ArrayList<>();
            for (Map.Entry<String, String> found : discoveredVia.entrySet()) {
                KgNode node = nodes.get(found.getKey());
                if (node == null) {
                    // dangling endpoint
                    continue;
                }
                visited.add(node.getSlug());
                next.add(node.getSlug());
                results.add(new NeighborResult(node.getSlug(), node.getNodeType(), node.getTitle(), found.getValue(), hop));
            }
            Collections.sort(next);
            frontier = next;
        }

        results.sort(Comparator.comparingInt(NeighborResult::hopDistance).thenComparing(NeighborResult::slug));
        log.debug("Neighbors of {} ({}, type={}, depth={}): {} node(s)",
                start, direction, query.getEdgeType(), query.getMaxDepth(), results.size());
        return results;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<GraphPath> shortestPath(String srcSlug, String dstSlug, int maxDepth) {
        validateDepth(maxDepth);
        if (srcSlug == null || dstSlug == null) {
            return Optional.empty();
        }
        Map<String, KgNode> endpoints = loadNodes(Set.of(srcSlug, dstSlug));
        if (!endpoints.containsKey(srcSlug) || !endpoints.containsKey(dstSlug)) {
            log.debug("No path {} -> {}: unknown endpoint", srcSlug, dstSlug);
            return Optional.empty();
        }
        if (srcSlug.equals(dstSlug)) {
            return Optional.of(new GraphPath(List.of(srcSlug), List.of(), 0));
        }

        RelationshipDirection direction = appProperties.getTraversal().getPathDirection();
        Map<String, Step> parents = new HashMap<>();
        Set<String> visited = new HashSet<>();
        visited.add(srcSlug);
        List<String> frontier = List.of(srcSlug);

        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            List<Step> steps = expand(frontier, direction, null);

            Map<String, Step> discovered = new LinkedHashMap<>();
            for (Step step : steps) {
                if (!visited.contains(step.child())) {
                    discovered.putIfAbsent(step.child(), step);
                }
            }

            Set<String> existing = loadNodes(discovered.keySet()).keySet();
            List<String> next = new ArrayList<>();
            for (Step step : discovered.values()) {
                if (!existing.contains(step.child())) {
                    continue;
                }
                visited.add(step.child());
                parents.put(step.child(), step);
                next.add(step.child());
            }

            if (parents.containsKey(dstSlug)) {
                GraphPath path = reconstruct(srcSlug, dstSlug, parents);
                log.debug("Found path {} -> {} of length {}", srcSlug, dstSlug, path.pathLength());
                return Optional.of(path);
            }
            Collections.sort(next);
            frontier = next;
        }

        log.debug("No path {} -> {} within {} hop(s)", srcSlug, dstSlug, maxDepth);
        return Optional.empty();
    }

    private void validateDepth(int maxDepth) {
        if (maxDepth < 1) {
            throw new ValidationException("maxDepth must be at least 1, got " + maxDepth);
        }
        int ceiling = appProperties.getTraversal().getMaxDepth();
        if (maxDepth > ceiling) {
            throw new DepthLimitExceededException(maxDepth, ceiling);
        }
    }

    /**
     * All steps out of the frontier in the given direction, in deterministic order.
     */
    private List<Step> expand(List<String> frontier, RelationshipDirection direction, String edgeType) {
        Set<String> frontierSet = new HashSet<>(frontier);
        List<Step> steps = new ArrayList<>();
        for (KgEdge edge : edgeStore.edgesOf(frontier, direction)) {
            if (edgeType != null && !edgeType.equals(edge.getEdgeType())) {
                continue;
            }
            if (direction != RelationshipDirection.INCOMING && frontierSet.contains(edge.getSrcSlug())) {
                steps.add(new Step(edge.getSrcSlug(), edge.getDstSlug(), edge));
            }
            if (direction != RelationshipDirection.OUTGOING && frontierSet.contains(edge.getDstSlug())) {
                steps.add(new Step(edge.getDstSlug(), edge.getSrcSlug(), edge));
            }
        }
        steps.sort(STEP_ORDER);
        return steps;
    }

    private Map<String, KgNode> loadNodes(Collection<String> slugs) {
        if (slugs.isEmpty()) {
            return Map.of();
        }
        return StoreCalls.read("load " + slugs.size() + " node(s)", () -> nodeRepository.findBySlugIn(slugs))
                .stream()
                .collect(Collectors.toMap(KgNode::getSlug, Function.identity()));
    }

    private static GraphPath reconstruct(String srcSlug, String dstSlug, Map<String, Step> parents) {
        LinkedList<String> nodes = new LinkedList<>();
        LinkedList<KgEdge> edges = new LinkedList<>();
        String current = dstSlug;
        nodes.addFirst(current);
        while (!current.equals(srcSlug)) {
            Step step = parents.get(current);
            edges.addFirst(step.edge());
            current = step.parent();
            nodes.addFirst(current);
        }
        return new GraphPath(nodes, edges, edges.size());
    }
}
