package com.mtsa.findings.service;

import com.mtsa.findings.model.AnalysisOutput;
import com.mtsa.findings.model.AnalysisSection;
import com.mtsa.findings.model.AnalysisType;
import com.mtsa.findings.model.CombinationKey;
import com.mtsa.findings.model.FindingsCandidate;
import com.mtsa.findings.model.GenerationMetadata;
import com.mtsa.findings.model.MultiSourceContent;
import com.mtsa.findings.model.SingleSourceContent;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared builders for generator output and candidates used across service tests.
 */
final class FindingsFixtures {

    static final String GENERATOR_ID = "test-model";

    private FindingsFixtures() {
    }

    static String text(String topic, int length) {
        StringBuilder sb = new StringBuilder();
        while (sb.length() < length) {
            sb.append(topic).append(" shows a sustained adoption pattern across the observed period. ");
        }
        return sb.substring(0, length).trim() + ".";
    }

    static ContentValidator validator() {
        return new ContentValidator(200, 200, 200, 40, 50, 20);
    }

    static AnalysisOutput validOutput(AnalysisType type) {
        Map<String, String> sections = new LinkedHashMap<>();
        sections.put(AnalysisSection.EXECUTIVE_SUMMARY.key(), text("Executive summary", 180));
        sections.put(AnalysisSection.PRINCIPAL_FINDINGS.key(), text("Principal findings", 520));
        sections.put(AnalysisSection.TEMPORAL_ANALYSIS.key(), text("Temporal trend", 300));
        sections.put(AnalysisSection.SEASONAL_ANALYSIS.key(), text("Seasonal cycle", 260));
        sections.put(AnalysisSection.SPECTRAL_ANALYSIS.key(), text("Spectral peak", 260));
        sections.put(AnalysisSection.STRATEGIC_SYNTHESIS.key(), text("Strategic synthesis", 240));
        sections.put(AnalysisSection.CONCLUSIONS.key(), text("Conclusions", 120));
        if (type == AnalysisType.MULTI) {
            sections.put(AnalysisSection.CORRELATION_ANALYSIS.key(), text("Correlation between sources", 420));
            sections.put(AnalysisSection.COMPONENT_ANALYSIS.key(), text("First principal component", 420));
        }
        return AnalysisOutput.builder()
                .sections(sections)
                .generatorId(GENERATOR_ID)
                .confidenceScore(0.82)
                .dataPoints(240)
                .build();
    }

    static AnalysisOutput validOutputFor(CombinationKey key) {
        return validOutput(key.analysisType());
    }

    static FindingsCandidate singleCandidate(CombinationKey key, int schemaVersion) {
        return new FindingsCandidate(key,
                new SingleSourceContent(text("Executive summary", 180), text("Principal findings", 520),
                        text("Strategic synthesis", 200), text("Conclusions", 100)),
                new GenerationMetadata(GENERATOR_ID, 1200L, 0.8, 240),
                Map.of(),
                schemaVersion);
    }

    static FindingsCandidate multiCandidate(CombinationKey key, int schemaVersion) {
        return new FindingsCandidate(key,
                new MultiSourceContent(text("Executive summary", 180), text("Principal findings", 520),
                        text("Strategic synthesis", 200), text("Conclusions", 100),
                        text("Correlation", 400), text("Component", 400),
                        text("Temporal", 300), text("Seasonal", 250), text("Spectral", 250)),
                new GenerationMetadata(GENERATOR_ID, 1500L, 0.8, 480),
                Map.of(),
                schemaVersion);
    }
}
