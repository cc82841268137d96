package com.mtsa.findings.model;

/**
 * Shape of an analysis. Determines which content fields are required and which are forbidden.
 */
public enum AnalysisType {

    SINGLE,
    MULTI;

    public static AnalysisType forSourceCount(int sourceCount) {
        if (sourceCount < 1) {
            throw new IllegalArgumentException("Source count must be positive: " + sourceCount);
        }
        return sourceCount == 1 ? SINGLE : MULTI;
    }
}
