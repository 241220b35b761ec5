package com.insightpulse.kgengine.knowledge.impl;

import com.insightpulse.kgengine.configuration.AppProperties;
import com.insightpulse.kgengine.configuration.GraphProperties.DuplicateEdgePolicy;
import com.insightpulse.kgengine.exception.DanglingReferenceException;
import com.insightpulse.kgengine.exception.DuplicateEdgeException;
import com.insightpulse.kgengine.exception.EdgeNotFoundException;
import com.insightpulse.kgengine.exception.KnowledgeGraphException;
import com.insightpulse.kgengine.exception.SelfLoopException;
import com.insightpulse.kgengine.exception.StoreException;
import com.insightpulse.kgengine.exception.ValidationException;
import com.insightpulse.kgengine.knowledge.EdgeStore;
import com.insightpulse.kgengine.knowledge.GraphTaxonomy;
import com.insightpulse.kgengine.knowledge.MutationLog;
import com.insightpulse.kgengine.knowledge.RelationshipDirection;
import com.insightpulse.kgengine.model.audit.MutationOperation;
import com.insightpulse.kgengine.model.audit.MutationRecord;
import com.insightpulse.kgengine.model.graph.EdgeCreate;
import com.insightpulse.kgengine.model.graph.KgEdge;
import com.insightpulse.kgengine.repository.KgEdgeRepository;
import com.insightpulse.kgengine.repository.KgNodeRepository;
import com.insightpulse.kgengine.util.GraphInputValidator;
import com.insightpulse.kgengine.util.StoreCalls;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaEdgeStore implements EdgeStore {

    private final KgEdgeRepository edgeRepository;
    private final KgNodeRepository nodeRepository;
    private final MutationLog mutationLog;
    private final GraphTaxonomy taxonomy;
    private final AppProperties appProperties;
    private final PlatformTransactionManager transactionManager;

    /**
     * Runs in its own write transaction so that losing an insert race on the edge triple
     * can be resolved against the committed winner under the duplicate policy.
     */
    @Override
    public KgEdge createEdge(EdgeCreate request) {
        String target = request == null ? "(null)" : request.describe();
        String source = sourceOf(request == null ? null : request.getSource());
        try {
            return writeTransaction().execute(status ->
                    audited(MutationOperation.EDGE_CREATE, target, source, () -> insertOrReuse(request, target, source)));
        } catch (EdgeInsertConflict conflict) {
            log.debug("Insert of {} lost to a concurrent create, resolving against the stored edge", target);
            return writeTransaction().execute(status ->
                    audited(MutationOperation.EDGE_CREATE, target, source, () -> {
                        KgEdge winner = edgeRepository.findBySrcSlugAndDstSlugAndEdgeType(
                                        request.getSrcSlug(), request.getDstSlug(), request.getEdgeType())
                                .orElseThrow(() -> new StoreException(
                                        "Store rejected " + MutationOperation.EDGE_CREATE + " on " + target,
                                        conflict.getCause()));
                        return reuseExisting(request, winner, target, source);
                    }));
        }
    }

    private KgEdge insertOrReuse(EdgeCreate request, String target, String source) {
        validateCreate(request);

        Optional<KgEdge> existing = edgeRepository.findBySrcSlugAndDstSlugAndEdgeType(
                request.getSrcSlug(), request.getDstSlug(), request.getEdgeType());
        if (existing.isPresent()) {
            return reuseExisting(request, existing.get(), target, source);
        }

        KgEdge edge = KgEdge.builder()
                .srcSlug(request.getSrcSlug())
                .dstSlug(request.getDstSlug())
                .edgeType(request.getEdgeType())
                .weight(request.effectiveWeight())
                .props(copyOf(request.getProps()))
                .metadata(copyOf(request.getMetadata()))
                .build();
        KgEdge saved;
        try {
            saved = edgeRepository.saveAndFlush(edge);
        } catch (DataAccessException e) {
            // Unique-constraint violation or lock conflict with a concurrent insert of the same triple.
            throw new EdgeInsertConflict(e);
        }

        mutationLog.record(MutationRecord.success(MutationOperation.EDGE_CREATE, target, source,
                Map.of("duplicate", false, "weight", saved.getWeight())));
        log.debug("Created edge {}", target);
        return saved;
    }

    private KgEdge reuseExisting(EdgeCreate request, KgEdge existing, String target, String source) {
        if (appProperties.getGraph().getDuplicateEdgePolicy() == DuplicateEdgePolicy.FAIL) {
            throw new DuplicateEdgeException(request.getSrcSlug(), request.getDstSlug(), request.getEdgeType());
        }
        mutationLog.record(MutationRecord.success(MutationOperation.EDGE_CREATE, target, source,
                Map.of("duplicate", true)));
        log.debug("Duplicate edge ignored: {}", target);
        return existing;
    }

    @Override
    @Transactional
    public void deleteEdge(String srcSlug, String dstSlug, String edgeType) {
        String target = KgEdge.describe(srcSlug, dstSlug, edgeType);
        audited(MutationOperation.EDGE_DELETE, target, source(), () -> {
            KgEdge edge = edgeRepository.findBySrcSlugAndDstSlugAndEdgeType(srcSlug, dstSlug, edgeType)
                    .orElseThrow(() -> new EdgeNotFoundException(srcSlug, dstSlug, edgeType));
            edgeRepository.delete(edge);
            edgeRepository.flush();

            mutationLog.record(MutationRecord.success(MutationOperation.EDGE_DELETE, target, source(), null));
            log.debug("Deleted edge {}", target);
            return null;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<KgEdge> findEdge(String srcSlug, String dstSlug, String edgeType) {
        return StoreCalls.read("find edge",
                () -> edgeRepository.findBySrcSlugAndDstSlugAndEdgeType(srcSlug, dstSlug, edgeType));
    }

    @Override
    @Transactional(readOnly = true)
    public List<KgEdge> neighborsOf(String slug, RelationshipDirection direction) {
        if (slug == null) {
            return List.of();
        }
        return edgesOf(List.of(slug), direction);
    }

    @Override
    @Transactional(readOnly = true)
    public List<KgEdge> edgesOf(Collection<String> slugs, RelationshipDirection direction) {
        if (slugs == null || slugs.isEmpty()) {
            return List.of();
        }
        if (direction == null) {
            throw new ValidationException("Direction is required");
        }
        return StoreCalls.read("edges of " + slugs.size() + " node(s)", () -> {
            List<KgEdge> edges = new ArrayList<>();
            if (direction != RelationshipDirection.INCOMING) {
                edges.addAll(edgeRepository.findBySrcSlugIn(slugs));
            }
            if (direction != RelationshipDirection.OUTGOING) {
                edges.addAll(edgeRepository.findByDstSlugIn(slugs));
            }
            // An edge between two frontier nodes shows up in both lookups when direction is BOTH.
            Map<Long, KgEdge> unique = new LinkedHashMap<>();
            edges.forEach(edge -> unique.putIfAbsent(edge.getId(), edge));
            List<KgEdge> result = new ArrayList<>(unique.values());
            result.sort(Comparator.comparing(KgEdge::getId));
            return result;
        });
    }

    private void validateCreate(EdgeCreate request) {
        if (request == null) {
            throw new ValidationException("Edge create request cannot be null");
        }
        if (request.getSrcSlug() == null || request.getDstSlug() == null) {
            throw new ValidationException("Edge endpoints cannot be null");
        }
        if (request.getSrcSlug().equals(request.getDstSlug())) {
            throw new SelfLoopException(request.getSrcSlug(), request.getEdgeType());
        }
        GraphInputValidator.validateSlug(request.getSrcSlug());
        GraphInputValidator.validateSlug(request.getDstSlug());
        taxonomy.requireEdgeType(request.getEdgeType());
        GraphInputValidator.validateWeight(request.effectiveWeight());
        GraphInputValidator.validateProperties("props", request.getProps());
        GraphInputValidator.validateProperties("metadata", request.getMetadata());

        if (!appProperties.getGraph().isAllowDanglingEdges()) {
            if (!nodeRepository.existsById(request.getSrcSlug())) {
                throw new DanglingReferenceException(request.getSrcSlug());
            }
            if (!nodeRepository.existsById(request.getDstSlug())) {
                throw new DanglingReferenceException(request.getDstSlug());
            }
        }
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

    private TransactionTemplate writeTransaction() {
        return new TransactionTemplate(transactionManager);
    }

    private <T> T audited(MutationOperation operation, String target, String source, Supplier<T> action) {
        try {
            return action.get();
        } catch (KnowledgeGraphException e) {
            mutationLog.recordIsolated(MutationRecord.failure(operation, target, source, e, null));
            throw e;
        } catch (DataAccessException e) {
            mutationLog.recordIsolated(MutationRecord.failure(operation, target, source, e, null));
            throw new StoreException("Store rejected " + operation + " on " + target, e);
        }
    }

    /**
     * Insert failure. Escapes the write transaction so it rolls back before the stored edge is re-read.
     */
    private static final class EdgeInsertConflict extends RuntimeException {

        EdgeInsertConflict(DataAccessException cause) {
            super(cause);
        }
    }
}
