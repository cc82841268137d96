package com.mtsa.findings.model;

import java.util.List;

/**
 * Input to the analysis generator: display names for the prompt plus the dataset summary.
 */
public record GenerationRequest(CombinationKey key,
                                String toolName,
                                List<String> sourceNames,
                                String language,
                                DatasetSummary datasetSummary) {

    public GenerationRequest {
        sourceNames = List.copyOf(sourceNames);
    }

    public AnalysisType analysisType() {
        return key.analysisType();
    }
}
