package com.mtsa.findings.service;

import com.mtsa.findings.model.AnalysisContent;
import com.mtsa.findings.model.FindingsCandidate;
import com.mtsa.findings.model.GenerationMetadata;
import com.mtsa.findings.model.MultiSourceContent;
import com.mtsa.findings.model.SingleSourceContent;
import com.mtsa.findings.model.ValidationIssue;
import com.mtsa.findings.model.ValidationResult;
import com.mtsa.findings.model.ValidationStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies a candidate as VALID, PARTIAL or INVALID. Pure: never modifies the candidate.
 * <p>
 * Any of these makes a candidate INVALID: a missing executive summary or conclusions, empty
 * principal findings, an unknown generator, no data points, or (single-source only) non-trivial
 * cross-source content. Remaining shortfalls (short sections, too few sources for a multi-source
 * analysis) downgrade it to PARTIAL.
 */
@Service
public class ContentValidator {

    private static final Set<String> PLACEHOLDER_GENERATORS = Set.of("unknown", "n/a", "none", "null", "placeholder");

    private static final Set<ValidationIssue> FATAL = EnumSet.of(
            ValidationIssue.MISSING_EXECUTIVE_SUMMARY,
            ValidationIssue.MISSING_CONCLUSIONS,
            ValidationIssue.EMPTY_PRINCIPAL_FINDINGS,
            ValidationIssue.UNEXPECTED_CROSS_SOURCE_CONTENT,
            ValidationIssue.UNKNOWN_GENERATOR,
            ValidationIssue.NO_DATA_POINTS);

    private final int principalFindingsMin;
    private final int correlationMin;
    private final int componentMin;
    private final int trivialLength;
    private final int executiveSummaryMin;
    private final int conclusionsMin;

    public ContentValidator(@Value("${app.validation.principal-findings-min:200}") int principalFindingsMin,
                            @Value("${app.validation.correlation-min:200}") int correlationMin,
                            @Value("${app.validation.component-min:200}") int componentMin,
                            @Value("${app.validation.trivial-length:40}") int trivialLength,
                            @Value("${app.validation.executive-summary-min:50}") int executiveSummaryMin,
                            @Value("${app.validation.conclusions-min:20}") int conclusionsMin) {
        this.principalFindingsMin = principalFindingsMin;
        this.correlationMin = correlationMin;
        this.componentMin = componentMin;
        this.trivialLength = trivialLength;
        this.executiveSummaryMin = executiveSummaryMin;
        this.conclusionsMin = conclusionsMin;
    }

    public ValidationResult validate(FindingsCandidate candidate) {
        List<ValidationIssue> issues = new ArrayList<>();
        AnalysisContent content = candidate.content();

        if (length(content.executiveSummary()) < executiveSummaryMin) {
            issues.add(ValidationIssue.MISSING_EXECUTIVE_SUMMARY);
        }
        if (length(content.conclusions()) < conclusionsMin) {
            issues.add(ValidationIssue.MISSING_CONCLUSIONS);
        }
        int principal = length(content.principalFindings());
        if (principal == 0) {
            issues.add(ValidationIssue.EMPTY_PRINCIPAL_FINDINGS);
        } else if (principal < principalFindingsMin) {
            issues.add(ValidationIssue.SHORT_PRINCIPAL_FINDINGS);
        }

        if (content instanceof SingleSourceContent) {
            boolean stray = candidate.strayCrossSourceSections().values().stream().anyMatch(v -> !isTrivial(v));
            if (stray) {
                issues.add(ValidationIssue.UNEXPECTED_CROSS_SOURCE_CONTENT);
            }
        } else if (content instanceof MultiSourceContent multi) {
            if (candidate.key().sourceCount() < 2) {
                issues.add(ValidationIssue.INSUFFICIENT_SOURCES);
            }
            if (length(multi.correlationAnalysis()) < correlationMin) {
                issues.add(ValidationIssue.SHORT_CORRELATION_ANALYSIS);
            }
            if (length(multi.componentAnalysis()) < componentMin) {
                issues.add(ValidationIssue.SHORT_COMPONENT_ANALYSIS);
            }
        }

        GenerationMetadata metadata = candidate.metadata();
        if (metadata == null || isPlaceholderGenerator(metadata.generatorId())) {
            issues.add(ValidationIssue.UNKNOWN_GENERATOR);
        }
        if (metadata == null || metadata.dataPoints() <= 0) {
            issues.add(ValidationIssue.NO_DATA_POINTS);
        }

        return new ValidationResult(classify(issues), issues);
    }

    /**
     * Whether a text is short enough to count as absent for field-presence rules.
     */
    public boolean isTrivial(String text) {
        return length(text) <= trivialLength;
    }

    private static ValidationStatus classify(List<ValidationIssue> issues) {
        if (issues.isEmpty()) {
            return ValidationStatus.VALID;
        }
        return issues.stream().anyMatch(FATAL::contains) ? ValidationStatus.INVALID : ValidationStatus.PARTIAL;
    }

    private static boolean isPlaceholderGenerator(String generatorId) {
        return generatorId == null
                || generatorId.isBlank()
                || PLACEHOLDER_GENERATORS.contains(generatorId.trim().toLowerCase(Locale.ROOT));
    }

    private static int length(String text) {
        return text == null ? 0 : text.strip().length();
    }
}
