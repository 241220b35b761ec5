package com.insightpulse.kgengine.model.graph;

import com.insightpulse.kgengine.persistence.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JPA Entity representing a directed, typed, weighted relationship between two node slugs.
 * Maps to table 'KG_EDGES'; (src, dst, type) is unique.
 */
@Entity
@Table(name = "KG_EDGES",
        uniqueConstraints = @UniqueConstraint(name = "uk_kg_edge_triple",
                columnNames = {"src_slug", "dst_slug", "edge_type"}),
        indexes = {
                @Index(name = "idx_kg_edge_src", columnList = "src_slug"),
                @Index(name = "idx_kg_edge_dst", columnList = "dst_slug"),
                @Index(name = "idx_kg_edge_type", columnList = "edge_type")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KgEdge {

    public static final double DEFAULT_WEIGHT = 1.0;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "src_slug", nullable = false, length = 200)
    private String srcSlug;

    @Column(name = "dst_slug", nullable = false, length = 200)
    private String dstSlug;

    @Column(name = "edge_type", nullable = false, length = 64)
    private String edgeType;

    @Column(name = "weight", nullable = false)
    @Builder.Default
    private double weight = DEFAULT_WEIGHT;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "props", length = 100_000)
    @Builder.Default
    private Map<String, Object> props = new LinkedHashMap<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", length = 100_000)
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public String describe() {
        return describe(srcSlug, dstSlug, edgeType);
    }

    public static String describe(String srcSlug, String dstSlug, String edgeType) {
        return srcSlug + " -[" + edgeType + "]-> " + dstSlug;
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
