package com.insightpulse.kgengine.search.impl;

import com.insightpulse.kgengine.knowledge.event.NodeEmbeddingChangedEvent;
import com.insightpulse.kgengine.knowledge.event.NodeEmbeddingRemovedEvent;
import com.insightpulse.kgengine.repository.KgNodeRepository;
import com.insightpulse.kgengine.search.IndexedVector;
import com.insightpulse.kgengine.search.SimilarityIndex;
import com.insightpulse.kgengine.util.StoreCalls;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps the in-memory similarity index in step with the node store.
 *
 * Embedding changes are applied after the storing transaction commits, so a rolled-back
 * mutation never reaches the index. At startup the index is rebuilt from every embedded node.
 * Events arriving while a rebuild is loading wait for it to finish, so the loaded snapshot
 * never overwrites a newer change.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimilarityIndexSynchronizer {

    private final SimilarityIndex similarityIndex;
    private final KgNodeRepository nodeRepository;
    private final ReentrantLock syncLock = new ReentrantLock(true);

    @TransactionalEventListener(fallbackExecution = true)
    public void onEmbeddingChanged(NodeEmbeddingChangedEvent event) {
        syncLock.lock();
        try {
            similarityIndex.upsert(event.slug(), event.nodeType(), event.embedding());
        } finally {
            syncLock.unlock();
        }
        log.debug("Indexed embedding for {}", event.slug());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onEmbeddingRemoved(NodeEmbeddingRemovedEvent event) {
        syncLock.lock();
        try {
            similarityIndex.remove(event.slug());
        } finally {
            syncLock.unlock();
        }
        log.debug("Removed {} from similarity index", event.slug());
    }

    @Order(0)
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        rebuild();
    }

    /**
     * Reload the index from the store.
     *
     * @return number of vectors indexed
     */
    public int rebuild() {
        syncLock.lock();
        try {
            List<IndexedVector> vectors = StoreCalls.read("load embeddings", () -> nodeRepository.findAllEmbedded()
                    .stream()
                    .map(node -> new IndexedVector(node.getSlug(), node.getNodeType(), node.getEmbedding()))
                    .toList());
            similarityIndex.rebuild(vectors);
            return similarityIndex.size();
        } finally {
            syncLock.unlock();
        }
    }
}
