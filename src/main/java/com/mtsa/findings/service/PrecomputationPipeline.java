package com.mtsa.findings.service;

import com.google.common.util.concurrent.RateLimiter;
import com.mtsa.findings.dto.BacklogSummary;
import com.mtsa.findings.dto.PipelineRunSummary;
import com.mtsa.findings.model.CombinationKey;
import com.mtsa.findings.model.ComputationJob;
import com.mtsa.findings.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fills the findings store ahead of demand. Combinations are enumerated into the job table, then
 * drained by a bounded worker pool under a shared rate limit. Failed attempts are rescheduled with
 * exponential backoff and become FAILED once the attempt budget is spent. The job table is the
 * queue, so a restarted drain resumes where the previous one stopped.
 */
@Service
public class PrecomputationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(PrecomputationPipeline.class);
    private static final long MAX_IDLE_WAIT_MS = 1000L;

    private final CombinationKeyFactory keyFactory;
    private final CombinationCatalog catalog;
    private final ComputationJobStore jobStore;
    private final CacheResolver cacheResolver;
    private final BackoffPolicy backoffPolicy;
    private final PipelineProgressService progressService;
    private final RateLimiter generatorRateLimiter;
    private final TaskExecutor executor;
    private final int schemaVersion;
    private final int maxAttempts;
    private final int batchSize;
    private final Duration leaseTimeout;
    private final boolean workerEnabled;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public PrecomputationPipeline(CombinationKeyFactory keyFactory,
                                  CombinationCatalog catalog,
                                  ComputationJobStore jobStore,
                                  CacheResolver cacheResolver,
                                  BackoffPolicy backoffPolicy,
                                  PipelineProgressService progressService,
                                  @Qualifier("generatorRateLimiter") RateLimiter generatorRateLimiter,
                                  @Qualifier("precomputeExecutor") TaskExecutor executor,
                                  @Value("${app.findings.schema-version:2}") int schemaVersion,
                                  @Value("${app.pipeline.max-attempts:3}") int maxAttempts,
                                  @Value("${app.pipeline.batch-size:20}") int batchSize,
                                  @Value("${app.pipeline.lease-timeout-ms:600000}") long leaseTimeoutMs,
                                  @Value("${app.pipeline.worker.enabled:false}") boolean workerEnabled) {
        this.keyFactory = keyFactory;
        this.catalog = catalog;
        this.jobStore = jobStore;
        this.cacheResolver = cacheResolver;
        this.backoffPolicy = backoffPolicy;
        this.progressService = progressService;
        this.generatorRateLimiter = generatorRateLimiter;
        this.executor = executor;
        this.schemaVersion = schemaVersion;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.batchSize = Math.max(1, batchSize);
        this.leaseTimeout = Duration.ofMillis(leaseTimeoutMs);
        this.workerEnabled = workerEnabled;
    }

    /**
     * Enqueues every combination in the catalog that is not already computed for the current
     * schema version, failed permanently, or queued.
     */
    public BacklogSummary enqueueBacklog() {
        return enqueue(keyFactory.enumerateAll());
    }

    public BacklogSummary enqueue(Collection<CombinationKey> keys) {
        Set<String> skip = jobStore.settledOrLiveHashes(schemaVersion);
        int enqueued = 0;
        int skipped = 0;
        for (CombinationKey key : keys) {
            if (skip.contains(key.hash())) {
                skipped++;
                continue;
            }
            Optional<ComputationJob> job = jobStore.enqueue(key, priorityFor(key), schemaVersion);
            if (job.isPresent()) {
                enqueued++;
                skip.add(key.hash());
            } else {
                skipped++;
            }
        }
        logger.info("Backlog enumeration: {} combinations, {} enqueued, {} skipped", keys.size(), enqueued, skipped);
        return new BacklogSummary(keys.size(), enqueued, skipped);
    }

    /**
     * Processes due jobs until nothing is PENDING. Blocks through backoff delays.
     *
     * @throws IllegalStateException if a drain is already in progress
     */
    public PipelineRunSummary runUntilDrained() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Precomputation is already running");
        }
        try {
            return drain();
        } finally {
            running.set(false);
        }
    }

    /**
     * Scheduled entry point; a tick that overlaps a running drain is skipped.
     */
    @Scheduled(fixedDelayString = "${app.pipeline.worker.poll-delay-ms:10000}")
    public void pollBacklog() {
        if (!workerEnabled) {
            return;
        }
        if (!running.compareAndSet(false, true)) {
            logger.debug("Precomputation already running; skipping tick.");
            return;
        }
        try {
            if (jobStore.count(JobStatus.PENDING) > 0) {
                drain();
            }
        } catch (RuntimeException e) {
            logger.error("Scheduled precomputation tick failed: {}", e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Single-source combinations first, then the primary language.
     */
    int priorityFor(CombinationKey key) {
        int priority = 100 - 10 * (key.sourceCount() - 1);
        List<String> languages = catalog.languageIds();
        if (!languages.isEmpty() && languages.get(0).equals(key.language())) {
            priority += 5;
        }
        return priority;
    }

    private PipelineRunSummary drain() {
        long started = System.nanoTime();
        UUID runId = UUID.randomUUID();
        int recovered = jobStore.recoverStaleLeases(leaseTimeout);
        AtomicInteger completed = new AtomicInteger();
        AtomicInteger retried = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();

        progressService.startTracking(runId, (int) jobStore.count(JobStatus.PENDING));
        try {
            while (true) {
                List<ComputationJob> due = jobStore.findDue(batchSize);
                if (due.isEmpty()) {
                    if (jobStore.count(JobStatus.PENDING) == 0) {
                        break;
                    }
                    if (!waitForNextDue()) {
                        logger.warn("Precomputation run {} interrupted while waiting for backoff", runId);
                        break;
                    }
                    continue;
                }
                List<CompletableFuture<Void>> batch = due.stream()
                        .map(job -> CompletableFuture.runAsync(
                                () -> process(job, runId, completed, retried, failed), executor))
                        .toList();
                CompletableFuture.allOf(batch.toArray(new CompletableFuture[0])).join();
            }
        } finally {
            progressService.complete(runId);
        }

        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        logger.info("Precomputation run {} drained: {} completed, {} retries, {} failed permanently in {} ms",
                runId, completed.get(), retried.get(), failed.get(), elapsed);
        return new PipelineRunSummary(runId, completed.get(), retried.get(), failed.get(), recovered, elapsed);
    }

    private void process(ComputationJob job,
                         UUID runId,
                         AtomicInteger completed,
                         AtomicInteger retried,
                         AtomicInteger failed) {
        if (!jobStore.lease(job.getId())) {
            logger.debug("Job {} already taken by another worker", job.getId());
            return;
        }
        int attempt = job.getAttemptCount() + 1;
        CombinationKey key = job.toKey();
        try {
            generatorRateLimiter.acquire();
            cacheResolver.precompute(key, schemaVersion);
            jobStore.complete(job.getId());
            completed.incrementAndGet();
            progressService.increment(runId, key.toString(), true);
            logger.debug("Job {} completed for {} on attempt {}", job.getId(), key, attempt);
        } catch (RuntimeException e) {
            Duration delay = backoffPolicy.delayFor(attempt);
            JobStatus outcome = jobStore.recordFailure(job.getId(), attempt, maxAttempts, e.getMessage(), delay);
            progressService.increment(runId, key.toString(), false);
            if (outcome == JobStatus.FAILED) {
                failed.incrementAndGet();
                logger.error("Job {} for {} failed permanently after {} attempts: {}",
                        job.getId(), key, attempt, e.getMessage(), e);
            } else {
                retried.incrementAndGet();
                progressService.expectMore(runId, 1);
                logger.warn("Job {} for {} failed on attempt {}/{}; retrying in {} ms: {}",
                        job.getId(), key, attempt, maxAttempts, delay.toMillis(), e.getMessage());
            }
        }
    }

    /**
     * Sleeps until the earliest backoff elapses, bounded so new work is noticed. False if interrupted.
     */
    private boolean waitForNextDue() {
        long waitMs = jobStore.earliestPendingAttempt()
                .map(at -> Duration.between(OffsetDateTime.now(), at).toMillis())
                .orElse(MAX_IDLE_WAIT_MS);
        waitMs = Math.max(5L, Math.min(waitMs, MAX_IDLE_WAIT_MS));
        try {
            Thread.sleep(waitMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
