package com.insightpulse.kgengine.service.sync.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightpulse.kgengine.configuration.AppProperties;
import com.insightpulse.kgengine.exception.DuplicateEdgeException;
import com.insightpulse.kgengine.exception.KnowledgeGraphException;
import com.insightpulse.kgengine.exception.NotFoundException;
import com.insightpulse.kgengine.exception.ValidationException;
import com.insightpulse.kgengine.knowledge.EdgeStore;
import com.insightpulse.kgengine.knowledge.MutationLog;
import com.insightpulse.kgengine.knowledge.NodeStore;
import com.insightpulse.kgengine.model.CallContext;
import com.insightpulse.kgengine.model.ServiceType;
import com.insightpulse.kgengine.model.audit.MutationLogEntry;
import com.insightpulse.kgengine.model.audit.MutationOperation;
import com.insightpulse.kgengine.model.audit.MutationRecord;
import com.insightpulse.kgengine.model.audit.MutationStatus;
import com.insightpulse.kgengine.model.graph.EdgeCreate;
import com.insightpulse.kgengine.model.graph.NodeUpsert;
import com.insightpulse.kgengine.model.sync.BulkSyncResult;
import com.insightpulse.kgengine.model.sync.GraphSnapshot;
import com.insightpulse.kgengine.service.KnowledgeGraphService;
import com.insightpulse.kgengine.service.sync.BulkSyncService;
import com.insightpulse.kgengine.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Not transactional: each node and edge commits or fails on its own.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BulkSyncServiceImpl implements BulkSyncService {

    private static final String DEFAULT_SOURCE = "bulk-sync";

    private final NodeStore nodeStore;
    private final EdgeStore edgeStore;
    private final MutationLog mutationLog;
    private final KnowledgeGraphService knowledgeGraphService;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    @Override
    public BulkSyncResult sync(GraphSnapshot snapshot) {
        if (snapshot == null) {
            throw new ValidationException("Snapshot cannot be null");
        }
        String source = snapshot.getSource() == null || snapshot.getSource().isBlank()
                ? DEFAULT_SOURCE : snapshot.getSource();
        List<NodeUpsert> nodes = snapshot.getNodes() == null ? List.of() : snapshot.getNodes();
        List<EdgeCreate> edges = snapshot.getEdges() == null ? List.of() : snapshot.getEdges();

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.INGESTION, "BulkSync", log);
        ctx.logRequest("Snapshot from " + source, "Nodes", nodes.size(), "Edges", edges.size());

        List<String> failures = new ArrayList<>();
        int nodesUpserted = 0;
        for (NodeUpsert node : nodes) {
            try {
                nodeStore.upsertNode(node == null ? null : node.toBuilder().source(source).build());
                nodesUpserted++;
            } catch (KnowledgeGraphException e) {
                failures.add("node " + (node == null ? null : node.getSlug()) + ": " + e.getMessage());
            }
        }

        int edgesCreated = 0;
        int edgesSkipped = 0;
        for (EdgeCreate edge : edges) {
            try {
                boolean existed = edge != null
                        && edgeStore.findEdge(edge.getSrcSlug(), edge.getDstSlug(), edge.getEdgeType()).isPresent();
                edgeStore.createEdge(edge == null ? null : edge.toBuilder().source(source).build());
                if (existed) {
                    edgesSkipped++;
                } else {
                    edgesCreated++;
                }
            } catch (DuplicateEdgeException e) {
                edgesSkipped++;
            } catch (KnowledgeGraphException e) {
                failures.add("edge " + (edge == null ? null : edge.describe()) + ": " + e.getMessage());
            }
        }

        int embeddingsComputed = 0;
        if (appProperties.getEmbedding().isAutoEmbed()) {
            embeddingsComputed = knowledgeGraphService.embedMissing();
        }

        MutationLogEntry entry = mutationLog.record(MutationRecord.builder()
                .operation(MutationOperation.BULK_SYNC)
                .target(source)
                .source(source)
                .status(failures.isEmpty() ? MutationStatus.SUCCESS : MutationStatus.FAILURE)
                .errorMessage(failures.isEmpty() ? null : failures.size() + " item(s) failed: " + String.join("; ", failures))
                .payload(snapshot)
                .build());

        ctx.logResponse("Snapshot applied", "Nodes", nodesUpserted, "Edges created", edgesCreated,
                "Edges skipped", edgesSkipped, "Failures", failures.size());
        if (failures.isEmpty()) {
            log.info("✅ Bulk sync '{}' done in {}ms: {} node(s), {} edge(s) created, {} skipped",
                    source, ctx.getElapsedMs(), nodesUpserted, edgesCreated, edgesSkipped);
        } else {
            log.warn("⚠️ Bulk sync '{}' finished with {} failure(s) in {}ms", source, failures.size(), ctx.getElapsedMs());
        }

        return BulkSyncResult.builder()
                .source(source)
                .nodesUpserted(nodesUpserted)
                .edgesCreated(edgesCreated)
                .edgesSkipped(edgesSkipped)
                .embeddingsComputed(embeddingsComputed)
                .failures(failures)
                .logEntryId(entry.getId())
                .build();
    }

    @Override
    public BulkSyncResult replay(Long logEntryId) {
        MutationLogEntry entry = mutationLog.findEntry(logEntryId)
                .orElseThrow(() -> new NotFoundException("Mutation log entry " + logEntryId + " not found"));
        if (entry.getOperation() != MutationOperation.BULK_SYNC) {
            throw new ValidationException("Entry " + logEntryId + " is a " + entry.getOperation() + ", not a bulk sync");
        }
        if (entry.getPayload() == null) {
            throw new ValidationException("Entry " + logEntryId + " carries no snapshot");
        }

        GraphSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(entry.getPayload(), GraphSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Entry " + logEntryId + " holds an unreadable snapshot: " + e.getOriginalMessage());
        }
        log.info("Replaying bulk sync entry {} from '{}'", logEntryId, snapshot.getSource());
        return sync(snapshot);
    }
}
