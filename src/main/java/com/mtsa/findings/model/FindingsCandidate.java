package com.mtsa.findings.model;

import java.util.Map;

/**
 * A generated (or reloaded) analysis awaiting classification and storage.
 *
 * @param strayCrossSourceSections cross-source sections the generator returned for a single-source
 *                                 combination; kept only so validation can flag them
 */
public record FindingsCandidate(CombinationKey key,
                                AnalysisContent content,
                                GenerationMetadata metadata,
                                Map<AnalysisSection, String> strayCrossSourceSections,
                                int schemaVersion) {

    public FindingsCandidate {
        strayCrossSourceSections = strayCrossSourceSections == null ? Map.of() : Map.copyOf(strayCrossSourceSections);
    }

    public AnalysisType analysisType() {
        return content.analysisType();
    }
}
