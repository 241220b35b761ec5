package com.insightpulse.kgengine.repository;

import com.insightpulse.kgengine.model.graph.KgEdge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * JPA Repository for KgEdge entities.
 * Traversal runs in Java; these are single-hop lookups only.
 */
@Repository
public interface KgEdgeRepository extends JpaRepository<KgEdge, Long> {

    Optional<KgEdge> findBySrcSlugAndDstSlugAndEdgeType(String srcSlug, String dstSlug, String edgeType);

    /**
     * Outgoing edges of a whole BFS frontier.
     */
    List<KgEdge> findBySrcSlugIn(Collection<String> srcSlugs);

    /**
     * Incoming edges of a whole BFS frontier.
     */
    List<KgEdge> findByDstSlugIn(Collection<String> dstSlugs);

    /**
     * Removes every edge touching a node, in either direction.
     * Runs inside the caller's transaction so the node delete and the cascade commit together.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM KgEdge e WHERE e.srcSlug = :slug OR e.dstSlug = :slug")
    int deleteIncident(@Param("slug") String slug);
}
