package com.insightpulse.kgengine.service.sync.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightpulse.kgengine.KnowledgeGraphTestSupport;
import com.insightpulse.kgengine.exception.NotFoundException;
import com.insightpulse.kgengine.exception.ValidationException;
import com.insightpulse.kgengine.model.audit.MutationLogEntry;
import com.insightpulse.kgengine.model.audit.MutationOperation;
import com.insightpulse.kgengine.model.audit.MutationRecord;
import com.insightpulse.kgengine.model.audit.MutationStatus;
import com.insightpulse.kgengine.model.graph.EdgeCreate;
import com.insightpulse.kgengine.model.graph.NodeUpsert;
import com.insightpulse.kgengine.model.sync.BulkSyncResult;
import com.insightpulse.kgengine.model.sync.GraphSnapshot;
import com.insightpulse.kgengine.service.sync.BulkSyncService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ResourceLoader;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@DisplayName("Bulk Sync Service Tests")
class BulkSyncServiceImplTest extends KnowledgeGraphTestSupport {

    @Autowired
    private BulkSyncService bulkSyncService;

    @Autowired
    private ResourceLoader resourceLoader;

    @Autowired
    private ObjectMapper objectMapper;

    @AfterEach
    void restoreEmbeddingSettings() {
        appProperties.getEmbedding().setAutoEmbed(false);
    }

    @Test
    @DisplayName("Should apply nodes then edges and count duplicates as skipped")
    void testSync_ShouldApplySnapshot() {
        // Given
        GraphSnapshot snapshot = GraphSnapshot.builder()
                .source("github-webhook")
                .nodes(List.of(
                        upsert("repo:core", "repository", "Core"),
                        upsert("service:gateway", "service", "Gateway")))
                .edges(List.of(
                        create("repo:core", "service:gateway", "uses_service"),
                        create("repo:core", "service:gateway", "uses_service")))
                .build();

        // When
        BulkSyncResult result = bulkSyncService.sync(snapshot);

        // Then
        assertTrue(result.isSuccessful());
        assertEquals(2, result.getNodesUpserted());
        assertEquals(1, result.getEdgesCreated());
        assertEquals(1, result.getEdgesSkipped());

        MutationLogEntry entry = mutationLog.findEntry(result.getLogEntryId()).orElseThrow();
        assertEquals(MutationOperation.BULK_SYNC, entry.getOperation());
        assertEquals("github-webhook", entry.getSource());
        assertEquals(MutationStatus.SUCCESS, entry.getStatus());
        assertTrue(entry.getPayload().contains("service:gateway"));

        // And: every item is attributed to the snapshot's source, not the engine default
        MutationLogEntry nodeEntry = mutationLog.history("repo:core").get(0);
        assertEquals(MutationOperation.NODE_UPSERT, nodeEntry.getOperation());
        assertEquals("github-webhook", nodeEntry.getSource());
        assertTrue(mutationLog.history("repo:core -[uses_service]-> service:gateway").stream()
                .allMatch(e -> "github-webhook".equals(e.getSource())));
    }

    @Test
    @DisplayName("Should collect item failures without stopping the batch")
    void testSync_ShouldCollectFailures() {
        GraphSnapshot snapshot = GraphSnapshot.builder()
                .source("ingest")
                .nodes(List.of(
                        upsert("repo:core", "repository", "Core"),
                        upsert("Bad Slug", "service", "Broken")))
                .edges(List.of(
                        create("repo:core", "service:missing", "uses_service"),
                        create("repo:core", "repo:core", "depends_on")))
                .build();

        BulkSyncResult result = bulkSyncService.sync(snapshot);

        assertFalse(result.isSuccessful());
        assertEquals(1, result.getNodesUpserted());
        assertEquals(0, result.getEdgesCreated());
        assertEquals(3, result.getFailures().size());
        assertTrue(nodeStore.exists("repo:core"));

        MutationLogEntry entry = mutationLog.findEntry(result.getLogEntryId()).orElseThrow();
        assertEquals(MutationStatus.FAILURE, entry.getStatus());
        assertTrue(entry.getErrorMessage().startsWith("3 item(s) failed"));
        assertEquals("ingest", mutationLog.history("Bad Slug").get(0).getSource());
    }

    @Test
    @DisplayName("Should replay a stored bulk sync")
    void testReplay_ShouldReapplySnapshot() {
        // Given: A synced snapshot whose nodes are then deleted
        BulkSyncResult original = bulkSyncService.sync(GraphSnapshot.builder()
                .source("ingest")
                .nodes(List.of(
                        NodeUpsert.builder().slug("repo:core").nodeType("repository").title("Core")
                                .props(Map.of("stars", 12, "tags", List.of("java"))).build(),
                        upsert("service:gateway", "service", "Gateway")))
                .edges(List.of(create("repo:core", "service:gateway", "uses_service")))
                .build());
        nodeStore.deleteNode("repo:core");
        nodeStore.deleteNode("service:gateway");

        // When
        BulkSyncResult replayed = bulkSyncService.replay(original.getLogEntryId());

        // Then
        assertTrue(replayed.isSuccessful());
        assertEquals(1, replayed.getEdgesCreated());
        assertEquals(12, nodeStore.getNode("repo:core").getProps().get("stars"));
        assertNotEquals(original.getLogEntryId(), replayed.getLogEntryId());
    }

    @Test
    @DisplayName("Should refuse to replay unknown or non bulk-sync entries")
    void testReplay_InvalidEntry() {
        MutationLogEntry upsert = mutationLog.record(MutationRecord.success(
                MutationOperation.NODE_UPSERT, "repo:core", "test", null));

        assertThrows(NotFoundException.class, () -> bulkSyncService.replay(999_999L));
        assertThrows(ValidationException.class, () -> bulkSyncService.replay(upsert.getId()));
    }

    @Test
    @DisplayName("Should compute missing embeddings after the sync when auto-embed is on")
    void testSync_AutoEmbed() {
        appProperties.getEmbedding().setAutoEmbed(true);
        when(embeddingService.embed("Core")).thenReturn(new float[]{1f, 0f, 0f});

        BulkSyncResult result = bulkSyncService.sync(GraphSnapshot.builder()
                .nodes(List.of(upsert("repo:core", "repository", "Core")))
                .build());

        assertEquals(1, result.getEmbeddingsComputed());
        assertEquals("bulk-sync", result.getSource());
        assertTrue(similarityIndex.contains("repo:core"));
    }

    @Test
    @DisplayName("Should load the seed graph from the configured resource")
    void testSeedGraphLoader_ShouldLoadFixture() {
        // Given
        SeedGraphLoader loader = new SeedGraphLoader(bulkSyncService, resourceLoader, objectMapper, appProperties);

        // When
        BulkSyncResult result = loader.load();

        // Then
        assertTrue(result.isSuccessful());
        assertEquals(SeedGraphLoader.SEED_SOURCE, result.getSource());
        assertEquals(3, result.getNodesUpserted());
        assertEquals(2, result.getEdgesCreated());
        assertEquals(1, result.getEdgesSkipped());
        assertEquals("Routes requests", nodeStore.getNode("service:gateway").getDescription());
    }

    @Test
    @DisplayName("Should parse the bundled seed graph")
    void testBundledSeedGraph_IsValid() throws Exception {
        GraphSnapshot snapshot = objectMapper.readValue(
                resourceLoader.getResource("classpath:kg/seed-graph.json").getInputStream(), GraphSnapshot.class);

        BulkSyncResult result = bulkSyncService.sync(snapshot);

        assertTrue(result.isSuccessful(), () -> "Seed failures: " + result.getFailures());
        assertEquals(snapshot.getNodes().size(), result.getNodesUpserted());
        assertEquals(snapshot.getEdges().size(), result.getEdgesCreated());
    }

    private static NodeUpsert upsert(String slug, String nodeType, String title) {
        return NodeUpsert.builder().slug(slug).nodeType(nodeType).title(title).build();
    }

    private static EdgeCreate create(String src, String dst, String edgeType) {
        return EdgeCreate.builder().srcSlug(src).dstSlug(dst).edgeType(edgeType).build();
    }
}
