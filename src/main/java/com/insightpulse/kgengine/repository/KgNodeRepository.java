package com.insightpulse.kgengine.repository;

import com.insightpulse.kgengine.model.graph.KgNode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for knowledge graph nodes, keyed by slug.
 */
@Repository
public interface KgNodeRepository extends JpaRepository<KgNode, String> {

    /**
     * Find all nodes of one type tag.
     */
    List<KgNode> findByNodeTypeOrderBySlug(String nodeType);

    /**
     * Batch lookup used when materializing traversal and search results.
     */
    List<KgNode> findBySlugIn(Collection<String> slugs);

    /**
     * Nodes that carry an embedding; source for similarity index rebuilds.
     */
    @Query("SELECT n FROM KgNode n WHERE n.embedding IS NOT NULL")
    List<KgNode> findAllEmbedded();

    @Query("SELECT n FROM KgNode n WHERE n.embedding IS NULL ORDER BY n.slug")
    List<KgNode> findAllWithoutEmbedding();
}
