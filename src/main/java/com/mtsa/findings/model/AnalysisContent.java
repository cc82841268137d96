package com.mtsa.findings.model;

/**
 * Narrative content of an analysis, tagged by shape. Single-source content has no place for
 * cross-source sections; multi-source content requires them.
 */
public sealed interface AnalysisContent permits SingleSourceContent, MultiSourceContent {

    String executiveSummary();

    String principalFindings();

    String strategicSynthesis();

    String conclusions();

    AnalysisType analysisType();

    static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
