package com.insightpulse.kgengine.service.sync.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightpulse.kgengine.configuration.AppProperties;
import com.insightpulse.kgengine.model.sync.BulkSyncResult;
import com.insightpulse.kgengine.model.sync.GraphSnapshot;
import com.insightpulse.kgengine.service.sync.BulkSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the bundled ontology into the graph once the application is up.
 * Runs after the similarity index rebuild, so seeded embeddings reach the index through events.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.seed", name = "enabled", havingValue = "true")
public class SeedGraphLoader {

    static final String SEED_SOURCE = "seed";

    private final BulkSyncService bulkSyncService;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    @Order(10)
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        load();
    }

    public BulkSyncResult load() {
        String location = appProperties.getSeed().getLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Seed graph not found at " + location);
        }

        GraphSnapshot snapshot;
        try (InputStream in = resource.getInputStream()) {
            snapshot = objectMapper.readValue(in, GraphSnapshot.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read seed graph from " + location, e);
        }
        snapshot.setSource(SEED_SOURCE);

        BulkSyncResult result = bulkSyncService.sync(snapshot);
        log.info("🌱 Seeded graph from {}: {} node(s), {} edge(s) created, {} failure(s)",
                location, result.getNodesUpserted(), result.getEdgesCreated(), result.getFailures().size());
        return result;
    }
}
