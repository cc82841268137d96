package com.mtsa.findings.model;

public record MultiSourceContent(String executiveSummary,
                                 String principalFindings,
                                 String strategicSynthesis,
                                 String conclusions,
                                 String correlationAnalysis,
                                 String componentAnalysis,
                                 String temporalAnalysis,
                                 String seasonalAnalysis,
                                 String spectralAnalysis) implements AnalysisContent {

    public MultiSourceContent {
        executiveSummary = AnalysisContent.orEmpty(executiveSummary);
        principalFindings = AnalysisContent.orEmpty(principalFindings);
        strategicSynthesis = AnalysisContent.orEmpty(strategicSynthesis);
        conclusions = AnalysisContent.orEmpty(conclusions);
        correlationAnalysis = AnalysisContent.orEmpty(correlationAnalysis);
        componentAnalysis = AnalysisContent.orEmpty(componentAnalysis);
        temporalAnalysis = AnalysisContent.orEmpty(temporalAnalysis);
        seasonalAnalysis = AnalysisContent.orEmpty(seasonalAnalysis);
        spectralAnalysis = AnalysisContent.orEmpty(spectralAnalysis);
    }

    @Override
    public AnalysisType analysisType() {
        return AnalysisType.MULTI;
    }
}
