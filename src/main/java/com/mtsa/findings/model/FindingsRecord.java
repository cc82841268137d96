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
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * One cached analysis per combination hash. Rows are never hard-deleted; superseded or rejected
 * content is soft-invalidated through {@link #active}. Updates write only changed columns, so a
 * content or feedback write never overwrites access counters bumped in bulk.
 */
@Setter
@Getter
@Entity
@DynamicUpdate
@Table(name = "findings_records",
        uniqueConstraints = @UniqueConstraint(name = "uk_findings_combination_hash", columnNames = "combination_hash"),
        indexes = {
                @Index(name = "idx_findings_tool", columnList = "tool_name"),
                @Index(name = "idx_findings_type", columnList = "analysis_type"),
                @Index(name = "idx_findings_language", columnList = "language")
        })
public class FindingsRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "combination_hash", nullable = false, length = 64)
    private String combinationHash;

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
    @Column(name = "analysis_type", nullable = false, length = 16)
    private AnalysisType analysisType;

    @Column(name = "executive_summary", columnDefinition = "TEXT")
    private String executiveSummary;

    @Column(name = "principal_findings", columnDefinition = "TEXT")
    private String principalFindings;

    @Column(name = "strategic_synthesis", columnDefinition = "TEXT")
    private String strategicSynthesis;

    @Column(name = "conclusions", columnDefinition = "TEXT")
    private String conclusions;

    // Cross-source sections; always null for SINGLE records.
    @Column(name = "correlation_analysis", columnDefinition = "TEXT")
    private String correlationAnalysis;

    @Column(name = "component_analysis", columnDefinition = "TEXT")
    private String componentAnalysis;

    @Column(name = "temporal_analysis", columnDefinition = "TEXT")
    private String temporalAnalysis;

    @Column(name = "seasonal_analysis", columnDefinition = "TEXT")
    private String seasonalAnalysis;

    @Column(name = "spectral_analysis", columnDefinition = "TEXT")
    private String spectralAnalysis;

    @Column(name = "generator_id")
    private String generatorId;

    @Column(name = "generation_latency_ms")
    private Long generationLatencyMs;

    @Column(name = "confidence_score")
    private Double confidenceScore;

    @Column(name = "data_points")
    private Integer dataPoints;

    @Enumerated(EnumType.STRING)
    @Column(name = "validation_status", nullable = false, length = 16)
    private ValidationStatus validationStatus;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "validation_issues")
    private List<String> validationIssues;

    @Column(name = "schema_version", nullable = false)
    private Integer schemaVersion;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "invalidation_reason", columnDefinition = "TEXT")
    private String invalidationReason;

    @Column(name = "access_count", nullable = false)
    private long accessCount;

    @Column(name = "last_accessed_at")
    private OffsetDateTime lastAccessedAt;

    @Column(name = "user_rating")
    private Integer userRating;

    @Column(name = "user_feedback", columnDefinition = "TEXT")
    private String userFeedback;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Version
    @Column(name = "row_version")
    private Long rowVersion;

    public FindingsRecord() {
    }

    /**
     * Whether this record may be returned to a caller.
     */
    public boolean isServable() {
        return active && validationStatus != null && validationStatus.isUsable();
    }

    public CombinationKey toKey() {
        return new CombinationKey(toolName, sourceIds, language, canonicalKey, combinationHash);
    }

    public AnalysisContent toContent() {
        if (analysisType == AnalysisType.SINGLE) {
            return new SingleSourceContent(executiveSummary, principalFindings, strategicSynthesis, conclusions);
        }
        return new MultiSourceContent(executiveSummary, principalFindings, strategicSynthesis, conclusions,
                correlationAnalysis, componentAnalysis, temporalAnalysis, seasonalAnalysis, spectralAnalysis);
    }

    public GenerationMetadata toMetadata() {
        return new GenerationMetadata(
                generatorId,
                generationLatencyMs != null ? generationLatencyMs : 0L,
                confidenceScore != null ? confidenceScore : 0.0,
                dataPoints != null ? dataPoints : 0);
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
