package com.insightpulse.kgengine.service.impl;

import com.insightpulse.kgengine.KnowledgeGraphTestSupport;
import com.insightpulse.kgengine.exception.EmbeddingException;
import com.insightpulse.kgengine.exception.ValidationException;
import com.insightpulse.kgengine.model.audit.MutationLogEntry;
import com.insightpulse.kgengine.model.audit.MutationOperation;
import com.insightpulse.kgengine.model.audit.MutationStatus;
import com.insightpulse.kgengine.model.graph.KgNode;
import com.insightpulse.kgengine.model.graph.NodeUpsert;
import com.insightpulse.kgengine.model.retrieval.SemanticMatch;
import com.insightpulse.kgengine.service.KnowledgeGraphService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Knowledge Graph Service Tests")
class KnowledgeGraphServiceImplTest extends KnowledgeGraphTestSupport {

    @Autowired
    private KnowledgeGraphService knowledgeGraphService;

    @AfterEach
    void restoreEmbeddingSettings() {
        appProperties.getEmbedding().setAutoEmbed(false);
    }

    @Test
    @DisplayName("Should return semantic matches by similarity and honor the type filter")
    void testSemanticSearch() {
        // Given
        node("service:supabase-core", "service", "Supabase", 1f, 0f, 0f);
        node("service:litellm-gateway", "service", "LiteLLM", 0.5f, 0.5f, 0f);
        node("database:knowledge-graph", "database", "KG Database", 0.9f, 0.1f, 0f);
        node("schema:kg", "schema", "KG Schema");
        when(embeddingService.embed("postgres")).thenReturn(new float[]{1f, 0f, 0f});

        // When
        List<SemanticMatch> all = knowledgeGraphService.semanticSearch("postgres", null, 10);
        List<SemanticMatch> services = knowledgeGraphService.semanticSearch("postgres", "service", 1);

        // Then
        assertEquals(List.of("service:supabase-core", "database:knowledge-graph", "service:litellm-gateway"),
                all.stream().map(SemanticMatch::slug).toList());
        assertEquals(1.0, all.get(0).similarity(), 1e-6);
        assertEquals(1, services.size());
        assertEquals("Supabase", services.get(0).title());
    }

    @Test
    @DisplayName("Should reject invalid search arguments before calling the model")
    void testSemanticSearch_InvalidArguments() {
        assertThrows(ValidationException.class, () -> knowledgeGraphService.semanticSearch("", null, 5));
        assertThrows(ValidationException.class, () -> knowledgeGraphService.semanticSearch("q", "spaceship", 5));
        assertThrows(ValidationException.class, () -> knowledgeGraphService.semanticSearch("q", null, 0));

        verify(embeddingService, never()).embed(anyString());
    }

    @Test
    @DisplayName("Should embed title and description on refresh")
    void testRefreshEmbedding() {
        knowledgeGraphService.upsertNode(NodeUpsert.builder()
                .slug("module:vector-search").nodeType("module")
                .title("Vector Search").description("Semantic similarity search").build());
        when(embeddingService.embed("Vector Search Semantic similarity search")).thenReturn(new float[]{0f, 0f, 2f});

        knowledgeGraphService.refreshEmbedding("module:vector-search");

        assertArrayEquals(new float[]{0f, 0f, 2f}, knowledgeGraphService.getNode("module:vector-search").getEmbedding());
        assertTrue(similarityIndex.contains("module:vector-search"));
    }

    @Test
    @DisplayName("Should embed new nodes automatically when auto-embed is on")
    void testUpsert_AutoEmbed() {
        appProperties.getEmbedding().setAutoEmbed(true);
        when(embeddingService.embed("Gateway")).thenReturn(new float[]{0f, 1f, 0f});

        knowledgeGraphService.upsertNode(NodeUpsert.builder()
                .slug("service:gateway").nodeType("service").title("Gateway").build());

        assertTrue(knowledgeGraphService.getNode("service:gateway").hasEmbedding());
        assertEquals("service:gateway",
                knowledgeGraphService.semanticSearch(new float[]{0f, 1f, 0f}, null, 1).get(0).slug());
    }

    @Test
    @DisplayName("Should keep the node and log the failure when auto-embedding fails")
    void testUpsert_AutoEmbedFailure() {
        appProperties.getEmbedding().setAutoEmbed(true);
        when(embeddingService.embed(anyString())).thenThrow(new EmbeddingException("model unavailable"));

        KgNode node = knowledgeGraphService.upsertNode(NodeUpsert.builder()
                .slug("service:gateway").nodeType("service").title("Gateway").build());

        assertEquals("service:gateway", node.getSlug());
        assertFalse(knowledgeGraphService.getNode("service:gateway").hasEmbedding());
        List<MutationLogEntry> history = mutationLog.history("service:gateway");
        assertTrue(history.stream().anyMatch(entry -> entry.getOperation() == MutationOperation.NODE_UPSERT
                && entry.getStatus() == MutationStatus.SUCCESS));
        assertTrue(history.stream().anyMatch(entry -> entry.getOperation() == MutationOperation.EMBEDDING_SET
                && entry.getStatus() == MutationStatus.FAILURE
                && entry.getErrorMessage().contains("model unavailable")));
    }

    @Test
    @DisplayName("Should embed every node that has no embedding yet")
    void testEmbedMissing() {
        node("module:a", "module", "A");
        node("module:b", "module", "B", 1f, 0f, 0f);
        node("module:c", "module", "C");
        when(embeddingService.embed("A")).thenReturn(new float[]{0f, 1f, 0f});
        when(embeddingService.embed("C")).thenThrow(new EmbeddingException("timeout"));

        int stored = knowledgeGraphService.embedMissing();

        assertEquals(1, stored);
        assertTrue(knowledgeGraphService.getNode("module:a").hasEmbedding());
        assertFalse(knowledgeGraphService.getNode("module:c").hasEmbedding());
    }

    @Test
    @DisplayName("Should search paths up to the configured ceiling by default")
    void testShortestPath_DefaultDepth() {
        node("a", "module", "A");
        node("b", "module", "B");
        edge("a", "b", "depends_on");

        assertEquals(1, knowledgeGraphService.shortestPath("a", "b").orElseThrow().pathLength());
    }
}
