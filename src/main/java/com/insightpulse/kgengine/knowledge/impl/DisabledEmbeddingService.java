package com.insightpulse.kgengine.knowledge.impl;

import com.insightpulse.kgengine.exception.EmbeddingException;
import com.insightpulse.kgengine.knowledge.EmbeddingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Installed with {@code app.embedding.provider=none}: vectors must be supplied by callers
 * through setEmbedding; text-based search and auto-embedding fail fast.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.embedding", name = "provider", havingValue = "none")
public class DisabledEmbeddingService implements EmbeddingService {

    public DisabledEmbeddingService() {
        log.info("Embedding provider disabled; text embedding requests will be rejected");
    }

    @Override
    public float[] embed(String text) {
        throw new EmbeddingException("No embedding provider configured (app.embedding.provider=none)");
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        throw new EmbeddingException("No embedding provider configured (app.embedding.provider=none)");
    }
}
