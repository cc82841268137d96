package com.mtsa.findings.model;

/**
 * Single-source analysis. Temporal, seasonal and spectral narrative is folded into
 * {@link #principalFindings()} under labeled sub-headers.
 */
public record SingleSourceContent(String executiveSummary,
                                  String principalFindings,
                                  String strategicSynthesis,
                                  String conclusions) implements AnalysisContent {

    public SingleSourceContent {
        executiveSummary = AnalysisContent.orEmpty(executiveSummary);
        principalFindings = AnalysisContent.orEmpty(principalFindings);
        strategicSynthesis = AnalysisContent.orEmpty(strategicSynthesis);
        conclusions = AnalysisContent.orEmpty(conclusions);
    }

    @Override
    public AnalysisType analysisType() {
        return AnalysisType.SINGLE;
    }
}
