package com.mtsa.findings.model;

public enum ValidationIssue {

    MISSING_EXECUTIVE_SUMMARY,
    MISSING_CONCLUSIONS,
    EMPTY_PRINCIPAL_FINDINGS,
    SHORT_PRINCIPAL_FINDINGS,
    SHORT_CORRELATION_ANALYSIS,
    SHORT_COMPONENT_ANALYSIS,
    INSUFFICIENT_SOURCES,
    UNEXPECTED_CROSS_SOURCE_CONTENT,
    UNKNOWN_GENERATOR,
    NO_DATA_POINTS
}
