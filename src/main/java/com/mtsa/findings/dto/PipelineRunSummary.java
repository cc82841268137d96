package com.mtsa.findings.dto;

import java.util.UUID;

public record PipelineRunSummary(UUID runId,
                                 int completed,
                                 int retriesScheduled,
                                 int failedPermanently,
                                 int recoveredLeases,
                                 long elapsedMs) {
}
