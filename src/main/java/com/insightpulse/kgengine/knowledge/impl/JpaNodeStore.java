package com.insightpulse.kgengine.knowledge.impl;

import com.insightpulse.kgengine.configuration.AppProperties;
import com.insightpulse.kgengine.exception.KnowledgeGraphException;
import com.insightpulse.kgengine.exception.NodeNotFoundException;
import com.insightpulse.kgengine.exception.StoreException;
import com.insightpulse.kgengine.exception.ValidationException;
import com.insightpulse.kgengine.knowledge.GraphTaxonomy;
import com.insightpulse.kgengine.knowledge.MutationLog;
import com.insightpulse.kgengine.knowledge.NodeStore;
import com.insightpulse.kgengine.knowledge.event.NodeEmbeddingChangedEvent;
import com.insightpulse.kgengine.knowledge.event.NodeEmbeddingRemovedEvent;
import com.insightpulse.kgengine.model.audit.MutationOperation;
import com.insightpulse.kgengine.model.audit.MutationRecord;
import com.insightpulse.kgengine.model.graph.KgNode;
import com.insightpulse.kgengine.model.graph.NodeUpsert;
import com.insightpulse.kgengine.repository.KgEdgeRepository;
import com.insightpulse.kgengine.repository.KgNodeRepository;
import com.insightpulse.kgengine.util.GraphInputValidator;
import com.insightpulse.kgengine.util.StoreCalls;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Node store over Spring Data JPA. Timestamp refresh and cascading edge removal,
 * which the SQL schema did with triggers and foreign keys, are explicit here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaNodeStore implements NodeStore {

    private final KgNodeRepository nodeRepository;
    private final KgEdgeRepository edgeRepository;
    private final MutationLog mutationLog;
    private final GraphTaxonomy taxonomy;
    private final AppProperties appProperties;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public KgNode upsertNode(NodeUpsert request) {
        String slug = request == null ? null : request.getSlug();
        String source = sourceOf(request == null ? null : request.getSource());
        return audited(MutationOperation.NODE_UPSERT, String.valueOf(slug), source, null, () -> {
            validateUpsert(request);

            Optional<KgNode> existing = nodeRepository.findById(slug);
            boolean created = existing.isEmpty();
            String previousType = existing.map(KgNode::getNodeType).orElse(null);

            KgNode node = existing
                    .map(current -> merge(current, request))
                    .orElseGet(() -> create(request));
            node.setUpdatedAt(LocalDateTime.now());

            KgNode saved = nodeRepository.saveAndFlush(node);

            if (!created && saved.hasEmbedding() && !Objects.equals(previousType, saved.getNodeType())) {
                eventPublisher.publishEvent(new NodeEmbeddingChangedEvent(saved.getSlug(), saved.getNodeType(), saved.getEmbedding()));
            }

            mutationLog.record(MutationRecord.success(MutationOperation.NODE_UPSERT, slug, source,
                    Map.of("created", created, "nodeType", saved.getNodeType())));

            log.debug("{} node {} ({})", created ? "Created" : "Updated", slug, saved.getNodeType());
            return saved;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public KgNode getNode(String slug) {
        return findNode(slug).orElseThrow(() -> new NodeNotFoundException(slug));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<KgNode> findNode(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        return StoreCalls.read("find node " + slug, () -> nodeRepository.findById(slug));
    }

    @Override
    @Transactional(readOnly = true)
    public List<KgNode> findNodesByType(String nodeType) {
        taxonomy.requireNodeType(nodeType);
        return StoreCalls.read("find nodes of type " + nodeType, () -> nodeRepository.findByNodeTypeOrderBySlug(nodeType));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(String slug) {
        return slug != null && StoreCalls.read("exists " + slug, () -> nodeRepository.existsById(slug));
    }

    @Override
    @Transactional
    public void setEmbedding(String slug, float[] vector) {
        int dimensions = appProperties.getEmbedding().getDimensions();
        audited(MutationOperation.EMBEDDING_SET, String.valueOf(slug), source(), Map.of("dimensions", dimensions), () -> {
            KgNode node = requireNode(slug);
            GraphInputValidator.validateVector(vector, dimensions);

            float[] stored = vector.clone();
            node.setEmbedding(stored);
            node.setUpdatedAt(LocalDateTime.now());
            nodeRepository.saveAndFlush(node);

            eventPublisher.publishEvent(new NodeEmbeddingChangedEvent(slug, node.getNodeType(), stored));
            mutationLog.record(MutationRecord.success(MutationOperation.EMBEDDING_SET, slug, source(),
                    Map.of("dimensions", dimensions)));
            return null;
        });
    }

    @Override
    @Transactional
    public void clearEmbedding(String slug) {
        audited(MutationOperation.EMBEDDING_SET, String.valueOf(slug), source(), Map.of("cleared", true), () -> {
            KgNode node = requireNode(slug);
            if (node.hasEmbedding()) {
                node.setEmbedding(null);
                node.setUpdatedAt(LocalDateTime.now());
                nodeRepository.saveAndFlush(node);
                eventPublisher.publishEvent(new NodeEmbeddingRemovedEvent(slug));
            }
            mutationLog.record(MutationRecord.success(MutationOperation.EMBEDDING_SET, slug, source(),
                    Map.of("cleared", true)));
            return null;
        });
    }

    @Override
    @Transactional
    public int deleteNode(String slug) {
        return audited(MutationOperation.NODE_DELETE, String.valueOf(slug), source(), null, () -> {
            requireNode(slug);

            int edgesRemoved = edgeRepository.deleteIncident(slug);
            nodeRepository.deleteById(slug);
            nodeRepository.flush();

            eventPublisher.publishEvent(new NodeEmbeddingRemovedEvent(slug));
            mutationLog.record(MutationRecord.success(MutationOperation.NODE_DELETE, slug, source(),
                    Map.of("edgesRemoved", edgesRemoved)));

            log.info("Deleted node {} and {} incident edge(s)", slug, edgesRemoved);
            return edgesRemoved;
        });
    }

    private KgNode requireNode(String slug) {
        if (slug == null || slug.isBlank()) {
            throw new ValidationException("Slug cannot be null or blank");
        }
        return nodeRepository.findById(slug).orElseThrow(() -> new NodeNotFoundException(slug));
    }

    private void validateUpsert(NodeUpsert request) {
        if (request == null) {
            throw new ValidationException("Node upsert request cannot be null");
        }
        GraphInputValidator.validateSlug(request.getSlug());
        if (request.getNodeType() != null) {
            taxonomy.requireNodeType(request.getNodeType());
        }
        if (request.getTitle() != null && request.getTitle().isBlank()) {
            throw new ValidationException("Title cannot be blank");
        }
        GraphInputValidator.validateProperties("props", request.getProps());
        GraphInputValidator.validateProperties("metadata", request.getMetadata());
    }

    private KgNode create(NodeUpsert request) {
        if (request.getNodeType() == null) {
            throw new ValidationException("Node type is required to create node " + request.getSlug());
        }
        if (request.getTitle() == null) {
            throw new ValidationException("Title is required to create node " + request.getSlug());
        }
        return KgNode.builder()
                .slug(request.getSlug())
                .nodeType(request.getNodeType())
                .title(request.getTitle())
                .description(request.getDescription())
                .props(copyOf(request.getProps()))
                .metadata(copyOf(request.getMetadata()))
                .build();
    }

    private KgNode merge(KgNode node, NodeUpsert request) {
        if (request.getNodeType() != null) {
            node.setNodeType(request.getNodeType());
        }
        if (request.getTitle() != null) {
            node.setTitle(request.getTitle());
        }
        if (request.getDescription() != null) {
            node.setDescription(request.getDescription());
        }
        if (request.getProps() != null) {
            node.setProps(copyOf(request.getProps()));
        }
        if (request.getMetadata() != null) {
            node.setMetadata(copyOf(request.getMetadata()));
        }
        return node;
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return source == null ? new LinkedHashMap<>() : new LinkedHashMap<>(source);
    }

    private String source() {
        return appProperties.getGraph().getMutationSource();
    }

    private String sourceOf(String requested) {
        return requested == null || requested.isBlank() ? source() : requested;
    }

    /**
     * Runs a mutation; failures are written to the log in their own transaction and rethrown.
     */
    private <T> T audited(MutationOperation operation, String target, String source, Object payload,
                          Supplier<T> action) {
        try {
            return action.get();
        } catch (KnowledgeGraphException e) {
            mutationLog.recordIsolated(MutationRecord.failure(operation, target, source, e, payload));
            throw e;
        } catch (DataAccessException e) {
            mutationLog.recordIsolated(MutationRecord.failure(operation, target, source, e, payload));
            throw new StoreException("Store rejected " + operation + " on " + target, e);
        }
    }
}
