package com.mtsa.findings.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mtsa.findings.model.AnalysisSection;
import com.mtsa.findings.model.CombinationKey;
import com.mtsa.findings.model.FindingsCandidate;
import com.mtsa.findings.model.GenerationMetadata;
import com.mtsa.findings.model.MultiSourceContent;
import com.mtsa.findings.model.SingleSourceContent;
import com.mtsa.findings.model.ValidationIssue;
import com.mtsa.findings.model.ValidationResult;
import com.mtsa.findings.model.ValidationStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.mtsa.findings.service.FindingsFixtures.text;
import static org.assertj.core.api.Assertions.assertThat;

class ContentValidatorTest {

    private final ContentValidator validator = FindingsFixtures.validator();
    private final CombinationKeyFactory keys = new CombinationKeyFactory(CombinationCatalog.defaults(), new ObjectMapper());
    private final CombinationKey single = keys.canonicalize("Benchmarking", List.of("Google Trends"), "es");
    private final CombinationKey multi = keys.canonicalize("Benchmarking", List.of("Google Trends", "Crossref"), "es");

    @Test
    void completeSingleSourceCandidateIsValid() {
        ValidationResult result = validator.validate(FindingsFixtures.singleCandidate(single, 2));

        assertThat(result.status()).isEqualTo(ValidationStatus.VALID);
        assertThat(result.issues()).isEmpty();
    }

    @Test
    void completeMultiSourceCandidateIsValid() {
        assertThat(validator.validate(FindingsFixtures.multiCandidate(multi, 2)).status())
                .isEqualTo(ValidationStatus.VALID);
    }

    @Test
    void singleSourceWithCrossSourceContentIsInvalid() {
        FindingsCandidate base = FindingsFixtures.singleCandidate(single, 2);
        FindingsCandidate stray = new FindingsCandidate(single, base.content(), base.metadata(),
                Map.of(AnalysisSection.CORRELATION_ANALYSIS, text("Correlation", 300)), 2);

        ValidationResult result = validator.validate(stray);

        assertThat(result.status()).isEqualTo(ValidationStatus.INVALID);
        assertThat(result.hasIssue(ValidationIssue.UNEXPECTED_CROSS_SOURCE_CONTENT)).isTrue();
    }

    @Test
    void trivialCrossSourceTextOnSingleSourceIsIgnored() {
        FindingsCandidate base = FindingsFixtures.singleCandidate(single, 2);
        FindingsCandidate trivial = new FindingsCandidate(single, base.content(), base.metadata(),
                Map.of(AnalysisSection.COMPONENT_ANALYSIS, "N/A"), 2);

        assertThat(validator.validate(trivial).status()).isEqualTo(ValidationStatus.VALID);
    }

    @Test
    void multiSourceMissingCorrelationWithSummaryAndConclusionsIsPartial() {
        FindingsCandidate candidate = new FindingsCandidate(multi,
                new MultiSourceContent(text("Executive summary", 180), text("Principal findings", 520),
                        text("Synthesis", 200), text("Conclusions", 100),
                        "", text("Component", 400), "", "", ""),
                new GenerationMetadata("test-model", 900L, 0.7, 480),
                Map.of(), 2);

        ValidationResult result = validator.validate(candidate);

        assertThat(result.status()).isEqualTo(ValidationStatus.PARTIAL);
        assertThat(result.issues()).containsExactly(ValidationIssue.SHORT_CORRELATION_ANALYSIS);
    }

    @Test
    void multiSourceMissingCorrelationAndConclusionsIsInvalid() {
        FindingsCandidate candidate = new FindingsCandidate(multi,
                new MultiSourceContent(text("Executive summary", 180), text("Principal findings", 520),
                        text("Synthesis", 200), "",
                        "", text("Component", 400), "", "", ""),
                new GenerationMetadata("test-model", 900L, 0.7, 480),
                Map.of(), 2);

        ValidationResult result = validator.validate(candidate);

        assertThat(result.status()).isEqualTo(ValidationStatus.INVALID);
        assertThat(result.issues()).contains(ValidationIssue.MISSING_CONCLUSIONS, ValidationIssue.SHORT_CORRELATION_ANALYSIS);
    }

    @Test
    void emptyPrincipalFindingsIsNeverAccepted() {
        FindingsCandidate candidate = new FindingsCandidate(multi,
                new MultiSourceContent(text("Executive summary", 180), "   ",
                        text("Synthesis", 200), text("Conclusions", 100),
                        text("Correlation", 400), text("Component", 400), "", "", ""),
                new GenerationMetadata("test-model", 900L, 0.7, 480),
                Map.of(), 2);

        assertThat(validator.validate(candidate).status()).isEqualTo(ValidationStatus.INVALID);
    }

    @Test
    void shortPrincipalFindingsOnSingleSourceIsPartial() {
        FindingsCandidate candidate = new FindingsCandidate(single,
                new SingleSourceContent(text("Executive summary", 180), text("Principal", 120),
                        text("Synthesis", 200), text("Conclusions", 100)),
                new GenerationMetadata("test-model", 900L, 0.7, 240),
                Map.of(), 2);

        ValidationResult result = validator.validate(candidate);

        assertThat(result.status()).isEqualTo(ValidationStatus.PARTIAL);
        assertThat(result.issues()).containsExactly(ValidationIssue.SHORT_PRINCIPAL_FINDINGS);
    }

    @Test
    void placeholderGeneratorOrZeroDataPointsIsInvalid() {
        FindingsCandidate base = FindingsFixtures.singleCandidate(single, 2);
        FindingsCandidate unknownGenerator = new FindingsCandidate(single, base.content(),
                new GenerationMetadata("unknown", 900L, 0.7, 240), Map.of(), 2);
        FindingsCandidate noData = new FindingsCandidate(single, base.content(),
                new GenerationMetadata("test-model", 900L, 0.7, 0), Map.of(), 2);

        assertThat(validator.validate(unknownGenerator).issues()).containsExactly(ValidationIssue.UNKNOWN_GENERATOR);
        assertThat(validator.validate(unknownGenerator).status()).isEqualTo(ValidationStatus.INVALID);
        assertThat(validator.validate(noData).issues()).containsExactly(ValidationIssue.NO_DATA_POINTS);
    }

    @Test
    void validationDoesNotAlterTheCandidate() {
        FindingsCandidate candidate = FindingsFixtures.multiCandidate(multi, 2);
        String before = candidate.toString();

        validator.validate(candidate);

        assertThat(candidate.toString()).isEqualTo(before);
    }
}
