package com.insightpulse.kgengine.model.graph;

import com.insightpulse.kgengine.persistence.converter.FloatArrayConverter;
import com.insightpulse.kgengine.persistence.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JPA Entity representing a canonical entity in the knowledge graph.
 * The slug is the primary key and never changes once the row exists.
 * Maps to table 'KG_NODES'.
 */
@Entity
@Table(name = "KG_NODES", indexes = {
        @Index(name = "idx_kg_node_type", columnList = "node_type"),
        @Index(name = "idx_kg_node_created", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KgNode {

    @Id
    @Column(name = "slug", length = 200, updatable = false)
    private String slug; // e.g. service:gateway

    @Column(name = "node_type", nullable = false, length = 64)
    private String nodeType;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Lob
    @Column(name = "description")
    private String description;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "props", length = 100_000)
    @Builder.Default
    private Map<String, Object> props = new LinkedHashMap<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", length = 100_000)
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @ToString.Exclude
    @Convert(converter = FloatArrayConverter.class)
    @Column(name = "embedding", length = 200_000)
    private float[] embedding; // null until embedded

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean hasEmbedding() {
        return embedding != null;
    }

    /**
     * Text the embedding is computed from.
     */
    public String embeddingText() {
        return description == null || description.isBlank() ? title : title + " " + description;
    }

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
