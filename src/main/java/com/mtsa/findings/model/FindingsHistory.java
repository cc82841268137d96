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
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Audit trail of a findings record. Written in the same transaction as the change it describes;
 * when content is replaced, the replaced sections are kept here.
 */
@Entity
@Table(name = "findings_history",
        indexes = @Index(name = "idx_history_combination_hash", columnList = "combination_hash"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FindingsHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "combination_hash", nullable = false, length = 64)
    private String combinationHash;

    @Column(name = "record_id")
    private UUID recordId;

    @Enumerated(EnumType.STRING)
    @Column(name = "change_type", nullable = false, length = 16)
    private HistoryChangeType changeType;

    @Column(name = "previous_schema_version")
    private Integer previousSchemaVersion;

    @Column(name = "schema_version")
    private Integer schemaVersion;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", length = 16)
    private ValidationStatus previousStatus;

    @Column(name = "previous_generator_id")
    private String previousGeneratorId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "previous_sections")
    private Map<String, String> previousSections;

    @Column(name = "change_reason", columnDefinition = "TEXT")
    private String changeReason;

    @Column(name = "changed_at", nullable = false)
    private OffsetDateTime changedAt;

    @PrePersist
    void onCreate() {
        if (changedAt == null) {
            changedAt = OffsetDateTime.now();
        }
    }
}
