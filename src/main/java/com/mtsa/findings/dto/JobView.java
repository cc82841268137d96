package com.mtsa.findings.dto;

import com.mtsa.findings.model.ComputationJob;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record JobView(UUID id,
                      String combinationHash,
                      String tool,
                      List<String> sources,
                      String language,
                      String status,
                      int priority,
                      int attemptCount,
                      String lastError,
                      OffsetDateTime nextAttemptAt,
                      OffsetDateTime completedAt,
                      OffsetDateTime updatedAt) {

    public static JobView from(ComputationJob job) {
        return new JobView(
                job.getId(),
                job.getCombinationHash(),
                job.getToolName(),
                job.getSourceIds(),
                job.getLanguage(),
                job.getStatus().name(),
                job.getPriority(),
                job.getAttemptCount(),
                job.getLastError(),
                job.getNextAttemptAt(),
                job.getCompletedAt(),
                job.getUpdatedAt());
    }
}
