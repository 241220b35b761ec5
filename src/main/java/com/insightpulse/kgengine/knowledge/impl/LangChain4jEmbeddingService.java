package com.insightpulse.kgengine.knowledge.impl;

import com.insightpulse.kgengine.configuration.AppProperties;
import com.insightpulse.kgengine.configuration.EmbeddingProperties;
import com.insightpulse.kgengine.exception.EmbeddingException;
import com.insightpulse.kgengine.exception.ValidationException;
import com.insightpulse.kgengine.knowledge.EmbeddingService;
import com.insightpulse.kgengine.model.CallContext;
import com.insightpulse.kgengine.model.ServiceType;
import com.insightpulse.kgengine.util.ExternalCallLogger;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * LangChain4j-based embedding service. Retries and timeouts are handled by the model client;
 * the engine itself does not retry.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.embedding", name = "provider", havingValue = "ollama", matchIfMissing = true)
public class LangChain4jEmbeddingService implements EmbeddingService {

    private final EmbeddingModel embeddingModel;
    private final String modelName;
    private final int dimensions;

    @Autowired
    public LangChain4jEmbeddingService(AppProperties appProperties) {
        this(buildOllamaModel(appProperties.getEmbedding()),
                appProperties.getEmbedding().getModelName(),
                appProperties.getEmbedding().getDimensions());
    }

    LangChain4jEmbeddingService(EmbeddingModel embeddingModel, String modelName, int dimensions) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
        this.dimensions = dimensions;
    }

    private static EmbeddingModel buildOllamaModel(EmbeddingProperties properties) {
        log.info("🔷 Initializing LangChain4j Embedding Service");
        log.info("   - Ollama URL: {}", properties.getBaseUrl());
        log.info("   - Model: {}", properties.getModelName());
        log.info("   - Dimensions: {}", properties.getDimensions());
        log.info("   - Timeout: {}s", properties.getTimeoutSeconds());
        log.info("   - Max Retries: {}", properties.getMaxRetries());

        return OllamaEmbeddingModel.builder()
                .baseUrl(properties.getBaseUrl())
                .modelName(properties.getModelName())
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .maxRetries(properties.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Text to embed cannot be blank");
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.EMBEDDING, "Embed", log);
        ctx.logRequest("Embedding text", "Length", text.length());

        try {
            Response<Embedding> response = embeddingModel.embed(text);
            float[] vector = requireConfiguredLength(response.content().vector());
            ctx.logResponse("Embedding generated", "Dimensions", vector.length);
            return vector;
        } catch (EmbeddingException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        } catch (Exception e) {
            ctx.logError("Embedding generation failed", e);
            throw new EmbeddingException("Text embedding generation failed", e);
        }
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        if (texts.stream().anyMatch(text -> text == null || text.isBlank())) {
            throw new ValidationException("Texts to embed cannot be blank");
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.EMBEDDING, "EmbedAll", log);
        ctx.logRequest("Embedding batch", "Count", texts.size());

        try {
            List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
            Response<List<Embedding>> response = embeddingModel.embedAll(segments);
            List<float[]> vectors = response.content().stream()
                    .map(Embedding::vector)
                    .map(this::requireConfiguredLength)
                    .toList();
            if (vectors.size() != texts.size()) {
                throw new EmbeddingException("Embedding model returned " + vectors.size()
                        + " vectors for " + texts.size() + " texts");
            }
            ctx.logResponse("Batch embedded", "Count", vectors.size());
            return vectors;
        } catch (EmbeddingException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        } catch (Exception e) {
            ctx.logError("Batch embedding generation failed", e);
            throw new EmbeddingException("Batch embedding generation failed", e);
        }
    }

    private float[] requireConfiguredLength(float[] vector) {
        if (vector.length != dimensions) {
            throw new EmbeddingException("Model '" + modelName + "' returned " + vector.length
                    + "-dimensional vectors but app.embedding.dimensions is " + dimensions);
        }
        return vector;
    }
}
