package com.insightpulse.kgengine.service.graph.impl;

import com.insightpulse.kgengine.KnowledgeGraphTestSupport;
import com.insightpulse.kgengine.exception.DepthLimitExceededException;
import com.insightpulse.kgengine.exception.NodeNotFoundException;
import com.insightpulse.kgengine.exception.ValidationException;
import com.insightpulse.kgengine.knowledge.RelationshipDirection;
import com.insightpulse.kgengine.model.graph.GraphPath;
import com.insightpulse.kgengine.model.graph.NeighborQuery;
import com.insightpulse.kgengine.model.graph.NeighborResult;
import com.insightpulse.kgengine.service.graph.GraphTraversalService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph Traversal Service Tests")
class GraphTraversalServiceImplTest extends KnowledgeGraphTestSupport {

    @Autowired
    private GraphTraversalService traversalService;

    @AfterEach
    void restoreTraversalSettings() {
        appProperties.getGraph().setAllowDanglingEdges(false);
        appProperties.getTraversal().setPathDirection(RelationshipDirection.OUTGOING);
    }

    @Test
    @DisplayName("Should find the single outgoing neighbor of a repository")
    void testNeighbors_SingleOutgoingEdge() {
        // Given
        node("repo:x", "repository", "X");
        node("service:y", "service", "Y");
        edge("repo:x", "service:y", "uses_service");

        // When
        List<NeighborResult> results = traversalService.neighbors(NeighborQuery.builder()
                .startSlug("repo:x")
                .direction(RelationshipDirection.OUTGOING)
                .maxDepth(1)
                .build());

        // Then
        assertEquals(List.of(new NeighborResult("service:y", "service", "Y", "uses_service", 1)), results);
    }

    @Test
    @DisplayName("Should find the two-hop path along a chain")
    void testShortestPath_Chain() {
        // Given
        chain();

        // When
        Optional<GraphPath> path = traversalService.shortestPath("a", "c", 5);

        // Then
        assertTrue(path.isPresent());
        assertEquals(List.of("a", "b", "c"), path.get().pathNodes());
        assertEquals(List.of("depends_on", "depends_on"), path.get().edgeTypes());
        assertEquals(2, path.get().pathLength());
    }

    @Test
    @DisplayName("Should lose the path once the middle node is deleted")
    void testShortestPath_AfterDelete() {
        // Given
        chain();

        // When
        nodeStore.deleteNode("b");

        // Then
        assertTrue(edgeStore.findEdge("a", "b", "depends_on").isEmpty());
        assertTrue(edgeStore.findEdge("b", "c", "depends_on").isEmpty());
        assertTrue(traversalService.shortestPath("a", "c", 5).isEmpty());
    }

    @Test
    @DisplayName("Should return a zero-length path from a node to itself")
    void testShortestPath_SameNode() {
        chain();

        GraphPath path = traversalService.shortestPath("b", "b", 1).orElseThrow();

        assertEquals(List.of("b"), path.pathNodes());
        assertTrue(path.pathEdges().isEmpty());
        assertEquals(0, path.pathLength());
    }

    @Test
    @DisplayName("Should return empty for unknown endpoints and unreachable targets")
    void testShortestPath_NotFound() {
        chain();

        assertTrue(traversalService.shortestPath("a", "ghost", 5).isEmpty());
        assertTrue(traversalService.shortestPath("c", "a", 5).isEmpty(), "Edges are followed src to dst only");
        assertTrue(traversalService.shortestPath("a", "c", 1).isEmpty(), "Path is longer than maxDepth");
    }

    @Test
    @DisplayName("Should follow edges backwards when paths search incoming edges")
    void testShortestPath_IncomingDirection() {
        chain();
        appProperties.getTraversal().setPathDirection(RelationshipDirection.INCOMING);

        GraphPath path = traversalService.shortestPath("c", "a", 5).orElseThrow();

        assertEquals(List.of("c", "b", "a"), path.pathNodes());
    }

    @Test
    @DisplayName("Should report minimum hop distances matching shortest path lengths")
    void testNeighbors_HopDistanceAgreesWithShortestPath() {
        // Given: A diamond with a shortcut and a cycle back to the start
        node("a", "module", "A");
        node("b", "module", "B");
        node("c", "module", "C");
        node("d", "module", "D");
        node("e", "module", "E");
        edge("a", "b", "depends_on");
        edge("b", "c", "depends_on");
        edge("c", "d", "depends_on");
        edge("a", "d", "depends_on");
        edge("d", "e", "depends_on");
        edge("e", "a", "depends_on");

        // When
        List<NeighborResult> results = traversalService.neighbors(NeighborQuery.builder()
                .startSlug("a")
                .maxDepth(5)
                .build());

        // Then: Start node excluded, each node once, ordered by hop then slug
        assertEquals(List.of("b", "d", "c", "e"), results.stream().map(NeighborResult::slug).toList());
        for (NeighborResult result : results) {
            GraphPath path = traversalService.shortestPath("a", result.slug(), 5).orElseThrow();
            assertEquals(result.hopDistance(), path.pathLength(), "Hop distance of " + result.slug());
        }
    }

    @Test
    @DisplayName("Should filter by edge type and respect the depth bound")
    void testNeighbors_EdgeTypeFilterAndDepth() {
        // Given
        node("repo:x", "repository", "X");
        node("service:y", "service", "Y");
        node("database:z", "database", "Z");
        node("deployment:p", "deployment", "P");
        edge("repo:x", "service:y", "uses_service");
        edge("service:y", "database:z", "stores_data_in");
        edge("repo:x", "deployment:p", "deployed_to");

        // When
        List<NeighborResult> usesOnly = traversalService.neighbors(NeighborQuery.builder()
                .startSlug("repo:x").edgeType("uses_service").maxDepth(3).build());
        List<NeighborResult> oneHop = traversalService.neighbors(NeighborQuery.builder()
                .startSlug("repo:x").maxDepth(1).build());

        // Then
        assertEquals(List.of("service:y"), usesOnly.stream().map(NeighborResult::slug).toList());
        assertEquals(List.of("deployment:p", "service:y"), oneHop.stream().map(NeighborResult::slug).toList());
    }

    @Test
    @DisplayName("Should walk incoming and both directions")
    void testNeighbors_Directions() {
        chain();

        List<NeighborResult> incoming = traversalService.neighbors(NeighborQuery.builder()
                .startSlug("c").direction(RelationshipDirection.INCOMING).maxDepth(2).build());
        List<NeighborResult> both = traversalService.neighbors(NeighborQuery.builder()
                .startSlug("b").direction(RelationshipDirection.BOTH).maxDepth(1).build());

        assertEquals(List.of(new NeighborResult("b", "module", "B", "depends_on", 1),
                new NeighborResult("a", "module", "A", "depends_on", 2)), incoming);
        assertEquals(List.of("a", "c"), both.stream().map(NeighborResult::slug).toList());
    }

    @Test
    @DisplayName("Should report the discovering edge type deterministically")
    void testNeighbors_DiscoveringEdgeType() {
        node("repo:x", "repository", "X");
        node("service:y", "service", "Y");
        edge("repo:x", "service:y", "uses_service");
        edge("repo:x", "service:y", "depends_on");

        List<NeighborResult> results = traversalService.neighbors(NeighborQuery.of("repo:x"));

        assertEquals(1, results.size());
        assertEquals("depends_on", results.get(0).edgeType());
    }

    @Test
    @DisplayName("Should skip dangling endpoints")
    void testNeighbors_SkipsDanglingEndpoints() {
        appProperties.getGraph().setAllowDanglingEdges(true);
        node("repo:x", "repository", "X");
        edge("repo:x", "service:ghost", "uses_service");

        assertTrue(traversalService.neighbors(NeighborQuery.of("repo:x")).isEmpty());
    }

    @Test
    @DisplayName("Should reject unknown starts, bad depths and unknown edge types")
    void testNeighbors_InvalidQueries() {
        chain();

        assertThrows(NodeNotFoundException.class, () -> traversalService.neighbors(NeighborQuery.of("ghost")));
        assertThrows(ValidationException.class, () -> traversalService.neighbors(NeighborQuery.builder()
                .startSlug("a").maxDepth(0).build()));
        assertThrows(DepthLimitExceededException.class, () -> traversalService.neighbors(NeighborQuery.builder()
                .startSlug("a").maxDepth(6).build()));
        assertThrows(ValidationException.class, () -> traversalService.neighbors(NeighborQuery.builder()
                .startSlug("a").edgeType("likes").build()));
        assertThrows(DepthLimitExceededException.class, () -> traversalService.shortestPath("a", "c", 99));
    }

    private void chain() {
        node("a", "module", "A");
        node("b", "module", "B");
        node("c", "module", "C");
        edge("a", "b", "depends_on");
        edge("b", "c", "depends_on");
    }
}
