package com.mtsa.findings.service;

import com.mtsa.findings.model.GenerationEvent;
import com.mtsa.findings.model.UsageEvent;
import com.mtsa.findings.repository.GenerationEventRepository;
import com.mtsa.findings.repository.UsageEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;

/**
 * Fire-and-forget sink for lookup and generator-call events. Failures and rejections are logged at DEBUG and dropped;
 * they never reach the caller.
 */
@Service
public class UsageRecorder {

    private static final Logger logger = LoggerFactory.getLogger(UsageRecorder.class);

    private static final int MAX_ERROR_LENGTH = 2000;

    private final UsageEventRepository usageEventRepository;
    private final GenerationEventRepository generationEventRepository;
    private final TaskExecutor executor;

    public UsageRecorder(UsageEventRepository usageEventRepository,
                         GenerationEventRepository generationEventRepository,
                         @Qualifier("usageRecorderExecutor") TaskExecutor executor) {
        this.usageEventRepository = usageEventRepository;
        this.generationEventRepository = generationEventRepository;
        this.executor = executor;
    }

    public void record(String combinationHash, boolean cacheHit, long latencyMs) {
        UsageEvent event = UsageEvent.builder()
                .combinationHash(combinationHash)
                .cacheHit(cacheHit)
                .latencyMs(latencyMs)
                .occurredAt(OffsetDateTime.now())
                .build();
        try {
            executor.execute(() -> persist(event));
        } catch (RuntimeException e) {
            logger.debug("Usage event for {} dropped: {}", combinationHash, e.getMessage());
        }
    }

    public void recordGeneration(String generatorId, String combinationHash, boolean success, String outcome,
                                 String errorMessage, long latencyMs) {
        GenerationEvent event = GenerationEvent.builder()
                .generatorId(generatorId)
                .combinationHash(combinationHash)
                .success(success)
                .outcome(outcome)
                .errorMessage(errorMessage != null && errorMessage.length() > MAX_ERROR_LENGTH
                        ? errorMessage.substring(0, MAX_ERROR_LENGTH) : errorMessage)
                .latencyMs(latencyMs)
                .occurredAt(OffsetDateTime.now())
                .build();
        try {
            executor.execute(() -> persist(event));
        } catch (RuntimeException e) {
            logger.debug("Generation event for {} dropped: {}", combinationHash, e.getMessage());
        }
    }

    private void persist(GenerationEvent event) {
        try {
            generationEventRepository.save(event);
        } catch (RuntimeException e) {
            logger.debug("Failed to persist generation event for {}: {}", event.getCombinationHash(), e.getMessage());
        }
    }

    private void persist(UsageEvent event) {
        try {
            usageEventRepository.save(event);
        } catch (RuntimeException e) {
            logger.debug("Failed to persist usage event for {}: {}", event.getCombinationHash(), e.getMessage());
        }
    }
}
