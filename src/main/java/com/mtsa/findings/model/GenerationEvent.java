package com.mtsa.findings.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One generator call and how it ended. {@code outcome} is the validation status on success, or the
 * failure reason otherwise.
 */
@Entity
@Table(name = "generation_events",
        indexes = @Index(name = "idx_generation_generator", columnList = "generator_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "generator_id", nullable = false)
    private String generatorId;

    @Column(name = "combination_hash", nullable = false, length = 64)
    private String combinationHash;

    @Column(name = "success", nullable = false)
    private boolean success;

    @Column(name = "outcome", nullable = false, length = 32)
    private String outcome;

    @Column(name = "latency_ms", nullable = false)
    private long latencyMs;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "occurred_at", nullable = false)
    private OffsetDateTime occurredAt;

    @PrePersist
    void onCreate() {
        if (occurredAt == null) {
            occurredAt = OffsetDateTime.now();
        }
    }
}
