package com.mtsa.findings.service;

import com.mtsa.findings.model.CombinationKey;
import com.mtsa.findings.model.ComputationJob;
import com.mtsa.findings.model.JobStatus;
import com.mtsa.findings.repository.ComputationJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Job bookkeeping for the precomputation pipeline. Every transition is a conditional update, so a
 * job can only be leased, completed or failed by the worker that holds it.
 */
@Service
public class ComputationJobStore {

    private static final Logger logger = LoggerFactory.getLogger(ComputationJobStore.class);
    private static final int MAX_ERROR_LENGTH = 2000;

    private final ComputationJobRepository repository;

    public ComputationJobStore(ComputationJobRepository repository) {
        this.repository = repository;
    }

    /**
     * Hashes that need no new job: completed for this schema version, failed permanently, or live.
     */
    public Set<String> settledOrLiveHashes(int schemaVersion) {
        Set<String> hashes = new HashSet<>(repository.findHashesByStatusAndSchemaVersion(JobStatus.COMPLETED, schemaVersion));
        hashes.addAll(repository.findHashesByStatusAndSchemaVersion(JobStatus.FAILED, schemaVersion));
        hashes.addAll(repository.findLiveHashes());
        return hashes;
    }

    /**
     * Creates a PENDING job unless a live one exists for the same combination.
     */
    public Optional<ComputationJob> enqueue(CombinationKey key, int priority, int schemaVersion) {
        if (repository.findByLiveKey(key.hash()).isPresent()) {
            return Optional.empty();
        }
        ComputationJob job = ComputationJob.builder()
                .combinationHash(key.hash())
                .liveKey(key.hash())
                .canonicalKey(key.canonicalForm())
                .toolName(key.tool())
                .sourceIds(key.sources())
                .language(key.language())
                .status(JobStatus.PENDING)
                .priority(priority)
                .attemptCount(0)
                .schemaVersion(schemaVersion)
                .build();
        try {
            return Optional.of(repository.saveAndFlush(job));
        } catch (DataIntegrityViolationException e) {
            logger.debug("Live job for {} created concurrently; skipping", key);
            return Optional.empty();
        }
    }

    public List<ComputationJob> findDue(int limit) {
        return repository.findDue(JobStatus.PENDING, OffsetDateTime.now(), PageRequest.of(0, Math.max(1, limit)));
    }

    public Optional<OffsetDateTime> earliestPendingAttempt() {
        return repository.findEarliestAttemptAt(JobStatus.PENDING);
    }

    /**
     * PENDING to RUNNING. False when another worker got there first.
     */
    public boolean lease(UUID jobId) {
        return repository.lease(jobId, OffsetDateTime.now(), JobStatus.PENDING, JobStatus.RUNNING) == 1;
    }

    public boolean complete(UUID jobId) {
        return repository.complete(jobId, OffsetDateTime.now(), JobStatus.RUNNING, JobStatus.COMPLETED) == 1;
    }

    /**
     * Records a failed attempt: back to PENDING with a delay, or FAILED once the budget is spent.
     */
    public JobStatus recordFailure(UUID jobId, int attemptCount, int maxAttempts, String error, Duration delay) {
        OffsetDateTime now = OffsetDateTime.now();
        String message = truncate(error);
        if (attemptCount >= maxAttempts) {
            repository.fail(jobId, message, now, JobStatus.RUNNING, JobStatus.FAILED);
            return JobStatus.FAILED;
        }
        repository.reschedule(jobId, message, now.plus(delay), now, JobStatus.RUNNING, JobStatus.PENDING);
        return JobStatus.PENDING;
    }

    public int recoverStaleLeases(Duration leaseTimeout) {
        OffsetDateTime now = OffsetDateTime.now();
        int released = repository.releaseStaleLeases(now.minus(leaseTimeout), now, JobStatus.RUNNING, JobStatus.PENDING);
        if (released > 0) {
            logger.warn("Returned {} jobs with expired leases to PENDING", released);
        }
        return released;
    }

    /**
     * Operator retry: a FAILED job goes back to PENDING with a fresh attempt budget.
     *
     * @throws IllegalArgumentException if the job does not exist
     * @throws IllegalStateException    if the job is not FAILED or a live job already covers it
     */
    @Transactional
    public ComputationJob retryFailed(UUID jobId) {
        ComputationJob job = repository.findById(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Job not found: " + jobId));
        if (job.getStatus() != JobStatus.FAILED) {
            throw new IllegalStateException("Job " + jobId + " is " + job.getStatus() + ", not FAILED");
        }
        if (repository.findByLiveKey(job.getCombinationHash()).isPresent()) {
            throw new IllegalStateException("A live job already exists for " + job.getCombinationHash());
        }
        job.setStatus(JobStatus.PENDING);
        job.setLiveKey(job.getCombinationHash());
        job.setAttemptCount(0);
        job.setNextAttemptAt(null);
        job.setLeasedAt(null);
        job.setLastError(null);
        logger.info("Job {} reset to PENDING by operator", jobId);
        return repository.save(job);
    }

    public Optional<ComputationJob> findById(UUID jobId) {
        return repository.findById(jobId);
    }

    public Map<JobStatus, Long> countsByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        for (Object[] row : repository.countGroupedByStatus()) {
            counts.put((JobStatus) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    public long count(JobStatus status) {
        return repository.countByStatus(status);
    }

    public List<ComputationJob> search(String tool, JobStatus status, Integer minPriority) {
        return repository.search(tool, status, minPriority);
    }

    public List<ComputationJob> failures() {
        return repository.findAllByStatusOrderByUpdatedAtDesc(JobStatus.FAILED);
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
