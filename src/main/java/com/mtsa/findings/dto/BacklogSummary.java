package com.mtsa.findings.dto;

/**
 * Result of enumerating combinations into the job table.
 */
public record BacklogSummary(int combinations, int enqueued, int skipped) {
}
