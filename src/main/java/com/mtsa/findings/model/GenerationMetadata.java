package com.mtsa.findings.model;

/**
 * Technical metadata captured from a generator run.
 */
public record GenerationMetadata(String generatorId,
                                 long latencyMs,
                                 double confidenceScore,
                                 int dataPoints) {
}
