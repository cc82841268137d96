package com.mtsa.findings.repository;

import com.mtsa.findings.model.AnalysisType;
import com.mtsa.findings.model.FindingsRecord;
import com.mtsa.findings.model.ValidationStatus;
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

@Repository
public interface FindingsRecordRepository extends JpaRepository<FindingsRecord, UUID> {

    /**
     * Primary lookup by combination hash.
     */
    Optional<FindingsRecord> findByCombinationHash(String combinationHash);

    /**
     * Atomically bumps the access counter without touching the optimistic version.
     */
    @Transactional
    @Modifying
    @Query("update FindingsRecord r set r.accessCount = r.accessCount + 1, r.lastAccessedAt = :now " +
            "where r.combinationHash = :hash")
    int incrementAccess(@Param("hash") String combinationHash, @Param("now") OffsetDateTime now);

    /**
     * Counts active records with the given status; null filter arguments match everything.
     */
    @Query("select count(r) from FindingsRecord r where r.active = true and r.validationStatus = :status " +
            "and (:tool is null or r.toolName = :tool) " +
            "and (:type is null or r.analysisType = :type) " +
            "and (:language is null or r.language = :language)")
    long countActive(@Param("status") ValidationStatus status,
                     @Param("tool") String tool,
                     @Param("type") AnalysisType type,
                     @Param("language") String language);

    /**
     * Loads active records for secondary scans; null filter arguments match everything.
     */
    @Query("select r from FindingsRecord r where r.active = true " +
            "and (:tool is null or r.toolName = :tool) " +
            "and (:type is null or r.analysisType = :type) " +
            "and (:language is null or r.language = :language) " +
            "order by r.toolName, r.language, r.combinationHash")
    List<FindingsRecord> findActive(@Param("tool") String tool,
                                    @Param("type") AnalysisType type,
                                    @Param("language") String language);

    List<FindingsRecord> findAllByActiveTrueAndCreatedAtBefore(OffsetDateTime cutoff);

    List<FindingsRecord> findTop10ByActiveTrueOrderByAccessCountDesc();

    @Query("select r.language, count(r) from FindingsRecord r where r.active = true group by r.language")
    List<Object[]> countActiveByLanguage();

    @Query("select r.analysisType, count(r) from FindingsRecord r where r.active = true group by r.analysisType")
    List<Object[]> countActiveByType();

    /**
     * Rows of (tool, analysis type, language, validation status, count) over active records.
     */
    @Query("select r.toolName, r.analysisType, r.language, r.validationStatus, count(r) " +
            "from FindingsRecord r where r.active = true " +
            "group by r.toolName, r.analysisType, r.language, r.validationStatus")
    List<Object[]> summarizeValidation();
}
