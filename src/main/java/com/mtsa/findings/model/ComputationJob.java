package com.mtsa.findings.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * One unit of precomputation work. {@code liveKey} holds the combination hash while the job is
 * PENDING or RUNNING and is cleared on completion or permanent failure, so the unique constraint
 * allows at most one live job per combination.
 */
@Entity
@Table(name = "computation_jobs",
        indexes = {
                @Index(name = "idx_jobs_status_priority", columnList = "status, priority"),
                @Index(name = "idx_jobs_combination_hash", columnList = "combination_hash"),
                @Index(name = "uk_jobs_live_key", columnList = "live_key", unique = true)
        })
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComputationJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "combination_hash", nullable = false, length = 64)
    private String combinationHash;

    @Column(name = "live_key", length = 64)
    private String liveKey;

    @Column(name = "canonical_key", nullable = false, columnDefinition = "TEXT")
    private String canonicalKey;

    @Column(name = "tool_name", nullable = false)
    private String toolName;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "source_ids", nullable = false)
    private List<String> sourceIds;

    @Column(name = "language", nullable = false, length = 8)
    private String language;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private JobStatus status;

    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "schema_version", nullable = false)
    private int schemaVersion;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "next_attempt_at")
    private OffsetDateTime nextAttemptAt;

    @Column(name = "leased_at")
    private OffsetDateTime leasedAt;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public CombinationKey toKey() {
        return new CombinationKey(toolName, sourceIds, language, canonicalKey, combinationHash);
    }

    @PrePersist
    void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }
}
