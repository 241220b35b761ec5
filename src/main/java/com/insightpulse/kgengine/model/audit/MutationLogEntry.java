package com.insightpulse.kgengine.model.audit;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * Append-only ledger row for every attempted node/edge mutation.
 * AUDIT: rows are inserted once and never updated or deleted.
 */
@Entity
@Immutable
@Table(name = "KG_MUTATION_LOG", indexes = {
        @Index(name = "idx_kg_log_target", columnList = "target"),
        @Index(name = "idx_kg_log_status", columnList = "status"),
        @Index(name = "idx_kg_log_recorded", columnList = "recorded_at")
})
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MutationLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation", nullable = false, length = 20)
    private MutationOperation operation;

    @Column(name = "target", nullable = false, length = 500)
    private String target; // slug, or "src -[type]-> dst" for edges

    @Column(name = "source", nullable = false, length = 100)
    private String source;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private MutationStatus status;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @ToString.Exclude
    @Lob
    @Column(name = "payload")
    private String payload; // JSON

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private LocalDateTime recordedAt;

    @PrePersist
    protected void onCreate() {
        if (recordedAt == null) {
            recordedAt = LocalDateTime.now();
        }
    }
}
