package com.mtsa.findings.repository;

import com.mtsa.findings.model.ComputationJob;
import com.mtsa.findings.model.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Job table used as the work queue. State transitions are conditional updates so that two workers
 * can never both move the same job out of a given state.
 */
@Repository
public interface ComputationJobRepository extends JpaRepository<ComputationJob, UUID> {

    Optional<ComputationJob> findByLiveKey(String liveKey);

    @Query("select j.combinationHash from ComputationJob j where j.status = :status and j.schemaVersion = :schemaVersion")
    List<String> findHashesByStatusAndSchemaVersion(@Param("status") JobStatus status,
                                                    @Param("schemaVersion") int schemaVersion);

    @Query("select j.combinationHash from ComputationJob j where j.liveKey is not null")
    List<String> findLiveHashes();

    /**
     * Pending jobs whose backoff has elapsed, highest priority first.
     */
    @Query("select j from ComputationJob j where j.status = :status " +
            "and (j.nextAttemptAt is null or j.nextAttemptAt <= :now) " +
            "order by j.priority desc, j.createdAt asc")
    List<ComputationJob> findDue(@Param("status") JobStatus status, @Param("now") OffsetDateTime now, Pageable page);

    @Query("select min(j.nextAttemptAt) from ComputationJob j where j.status = :status")
    Optional<OffsetDateTime> findEarliestAttemptAt(@Param("status") JobStatus status);

    long countByStatus(JobStatus status);

    @Query("select j.status, count(j) from ComputationJob j group by j.status")
    List<Object[]> countGroupedByStatus();

    @Query("select j from ComputationJob j where (:tool is null or j.toolName = :tool) " +
            "and (:status is null or j.status = :status) " +
            "and (:minPriority is null or j.priority >= :minPriority) " +
            "order by j.priority desc, j.createdAt asc")
    List<ComputationJob> search(@Param("tool") String tool,
                                @Param("status") JobStatus status,
                                @Param("minPriority") Integer minPriority);

    List<ComputationJob> findAllByStatusOrderByUpdatedAtDesc(JobStatus status);

    /**
     * PENDING to RUNNING; counts the attempt. Returns 0 when another worker already took the job.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update ComputationJob j set j.status = :running, j.leasedAt = :now, j.updatedAt = :now, " +
            "j.startedAt = coalesce(j.startedAt, :now), j.attemptCount = j.attemptCount + 1 " +
            "where j.id = :id and j.status = :pending")
    int lease(@Param("id") UUID id,
              @Param("now") OffsetDateTime now,
              @Param("pending") JobStatus pending,
              @Param("running") JobStatus running);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update ComputationJob j set j.status = :completed, j.liveKey = null, j.completedAt = :now, " +
            "j.updatedAt = :now, j.lastError = null where j.id = :id and j.status = :running")
    int complete(@Param("id") UUID id,
                 @Param("now") OffsetDateTime now,
                 @Param("running") JobStatus running,
                 @Param("completed") JobStatus completed);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update ComputationJob j set j.status = :pending, j.lastError = :error, j.nextAttemptAt = :nextAttemptAt, " +
            "j.leasedAt = null, j.updatedAt = :now where j.id = :id and j.status = :running")
    int reschedule(@Param("id") UUID id,
                   @Param("error") String error,
                   @Param("nextAttemptAt") OffsetDateTime nextAttemptAt,
                   @Param("now") OffsetDateTime now,
                   @Param("running") JobStatus running,
                   @Param("pending") JobStatus pending);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update ComputationJob j set j.status = :failed, j.liveKey = null, j.lastError = :error, " +
            "j.leasedAt = null, j.updatedAt = :now where j.id = :id and j.status = :running")
    int fail(@Param("id") UUID id,
             @Param("error") String error,
             @Param("now") OffsetDateTime now,
             @Param("running") JobStatus running,
             @Param("failed") JobStatus failed);

    /**
     * Returns RUNNING jobs whose lease predates the cutoff to PENDING. The attempt stays counted.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update ComputationJob j set j.status = :pending, j.leasedAt = null, j.nextAttemptAt = null, " +
            "j.updatedAt = :now where j.status = :running and j.leasedAt < :cutoff")
    int releaseStaleLeases(@Param("cutoff") OffsetDateTime cutoff,
                           @Param("now") OffsetDateTime now,
                           @Param("running") JobStatus running,
                           @Param("pending") JobStatus pending);
}
