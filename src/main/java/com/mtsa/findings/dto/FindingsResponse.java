package com.mtsa.findings.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mtsa.findings.model.AnalysisContent;
import com.mtsa.findings.model.FindingsRecord;
import com.mtsa.findings.model.MultiSourceContent;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * API view of a findings record. Sections are keyed by their wire names; single-source records
 * never carry cross-source sections.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FindingsResponse {

    private String combinationHash;
    private String tool;
    private List<String> sources;
    private String language;
    private String analysisType;
    private String validationStatus;
    private List<String> validationIssues;
    private Boolean degraded;
    private Boolean cacheHit;
    private Long latencyMs;
    private Integer schemaVersion;
    private Map<String, String> sections;
    private String generatorId;
    private Double confidenceScore;
    private Integer dataPoints;
    private Long accessCount;
    private Integer userRating;
    private Boolean active;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public static FindingsResponse from(FindingsRecord record) {
        return builder()
                .combinationHash(record.getCombinationHash())
                .tool(record.getToolName())
                .sources(record.getSourceIds())
                .language(record.getLanguage())
                .analysisType(record.getAnalysisType() != null ? record.getAnalysisType().name() : null)
                .validationStatus(record.getValidationStatus() != null ? record.getValidationStatus().name() : null)
                .validationIssues(record.getValidationIssues())
                .schemaVersion(record.getSchemaVersion())
                .sections(sectionsOf(record.toContent()))
                .generatorId(record.getGeneratorId())
                .confidenceScore(record.getConfidenceScore())
                .dataPoints(record.getDataPoints())
                .accessCount(record.getAccessCount())
                .userRating(record.getUserRating())
                .active(record.isActive())
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .build();
    }

    public static Map<String, String> sectionsOf(AnalysisContent content) {
        Map<String, String> sections = new LinkedHashMap<>();
        sections.put("executive_summary", content.executiveSummary());
        sections.put("principal_findings", content.principalFindings());
        if (content instanceof MultiSourceContent multi) {
            sections.put("temporal_analysis", multi.temporalAnalysis());
            sections.put("seasonal_analysis", multi.seasonalAnalysis());
            sections.put("spectral_analysis", multi.spectralAnalysis());
            sections.put("correlation_analysis", multi.correlationAnalysis());
            sections.put("component_analysis", multi.componentAnalysis());
        }
        sections.put("strategic_synthesis", content.strategicSynthesis());
        sections.put("conclusions", content.conclusions());
        return sections;
    }
}
