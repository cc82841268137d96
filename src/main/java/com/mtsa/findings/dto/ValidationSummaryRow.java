package com.mtsa.findings.dto;

/**
 * Per (tool, analysis type, language) counts of active records by validation status.
 */
public record ValidationSummaryRow(String tool,
                                   String analysisType,
                                   String language,
                                   long valid,
                                   long partial,
                                   long invalid) {
}
