package com.mtsa.findings.service;

import com.google.common.util.concurrent.Striped;
import com.mtsa.findings.dto.FindingsResponse;
import com.mtsa.findings.dto.RevalidationReport;
import com.mtsa.findings.dto.ValidationSummaryRow;
import com.mtsa.findings.model.AnalysisContent;
import com.mtsa.findings.model.AnalysisType;
import com.mtsa.findings.model.CombinationKey;
import com.mtsa.findings.model.FindingsCandidate;
import com.mtsa.findings.model.FindingsFilter;
import com.mtsa.findings.model.FindingsHistory;
import com.mtsa.findings.model.FindingsRecord;
import com.mtsa.findings.model.GenerationMetadata;
import com.mtsa.findings.model.HistoryChangeType;
import com.mtsa.findings.model.MultiSourceContent;
import com.mtsa.findings.model.ValidationResult;
import com.mtsa.findings.model.ValidationStatus;
import com.mtsa.findings.repository.FindingsHistoryRepository;
import com.mtsa.findings.repository.FindingsRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Durable store of findings records keyed by combination hash.
 * <p>
 * Writes for one hash are serialized through a striped lock and run in their own transaction;
 * writes for unrelated hashes proceed in parallel. The row's optimistic version catches writers
 * on other nodes. Records are only ever soft-invalidated, and a row's schema version never goes
 * down. Every content change and invalidation leaves a {@link FindingsHistory} entry.
 */
@Service
public class FindingsStore {

    private static final Logger logger = LoggerFactory.getLogger(FindingsStore.class);

    private final FindingsRecordRepository repository;
    private final FindingsHistoryRepository historyRepository;
    private final ContentValidator validator;
    private final TransactionOperations transactions;
    private final Striped<Lock> locks = Striped.lazyWeakLock(256);

    public FindingsStore(FindingsRecordRepository repository,
                         FindingsHistoryRepository historyRepository,
                         ContentValidator validator,
                         TransactionOperations transactions) {
        this.repository = repository;
        this.historyRepository = historyRepository;
        this.validator = validator;
        this.transactions = transactions;
    }

    public Optional<FindingsRecord> get(String combinationHash) {
        return repository.findByCombinationHash(combinationHash);
    }

    /**
     * Stores a VALID or PARTIAL candidate as the live record for its hash.
     *
     * @throws SchemaViolationException if the candidate breaks the field-presence rules of its
     *                                  analysis type, or was classified INVALID
     * @throws StaleWriteException      if the row already has a newer schema version, a live record
     *                                  with the same schema version exists, or a concurrent writer
     *                                  won the race
     */
    public FindingsRecord put(FindingsCandidate candidate, ValidationResult validation) {
        return put(candidate, validation, false);
    }

    /**
     * Like {@link #put(FindingsCandidate, ValidationResult)}; with {@code replaceCurrent} a live
     * record at the same schema version is overwritten too. A newer schema version is never
     * overwritten.
     */
    public FindingsRecord put(FindingsCandidate candidate, ValidationResult validation, boolean replaceCurrent) {
        checkShape(candidate);
        if (validation.status() == ValidationStatus.INVALID) {
            throw new SchemaViolationException("INVALID record for " + candidate.key() + " cannot be stored as live: "
                    + validation.issueNames());
        }
        String hash = candidate.key().hash();
        return withLock(hash, () -> {
            FindingsRecord record = repository.findByCombinationHash(hash).orElseGet(FindingsRecord::new);
            boolean existing = record.getId() != null;
            if (existing && record.getSchemaVersion() != null) {
                int current = record.getSchemaVersion();
                if (current > candidate.schemaVersion()) {
                    throw new StaleWriteException(hash, "Record for " + candidate.key() + " already has schema version "
                            + current + " (offered " + candidate.schemaVersion() + ")");
                }
                if (current == candidate.schemaVersion() && record.isServable() && !replaceCurrent) {
                    throw new StaleWriteException(hash, "Live record for " + candidate.key()
                            + " already has schema version " + current);
                }
            }
            FindingsHistory history = existing
                    ? superseded(record, candidate, replaceCurrent)
                    : FindingsHistory.builder()
                        .combinationHash(hash)
                        .changeType(HistoryChangeType.CREATED)
                        .schemaVersion(candidate.schemaVersion())
                        .changeReason("initial generation")
                        .build();
            apply(record, candidate, validation);
            record.setActive(true);
            record.setInvalidationReason(null);
            FindingsRecord saved = repository.saveAndFlush(record);
            history.setRecordId(saved.getId());
            historyRepository.save(history);
            if (validation.status() == ValidationStatus.PARTIAL) {
                logger.warn("Stored PARTIAL findings for {}: {}", candidate.key(), validation.issueNames());
            } else {
                logger.info("Stored findings for {} (schema v{}, {})", candidate.key(), candidate.schemaVersion(),
                        history.getChangeType());
            }
            return saved;
        });
    }

    public List<FindingsHistory> history(String combinationHash) {
        return historyRepository.findByCombinationHashOrderByChangedAtDesc(combinationHash);
    }

    /**
     * Keeps an INVALID candidate as an inactive row so the failure can be inspected later. Never
     * replaces a servable record, and never stores cross-source text on a single-source row.
     */
    public Optional<FindingsRecord> retainForDiagnostics(FindingsCandidate candidate, ValidationResult validation) {
        String hash = candidate.key().hash();
        try {
            return withLock(hash, () -> {
                FindingsRecord record = repository.findByCombinationHash(hash).orElseGet(FindingsRecord::new);
                if (record.getId() != null && record.isServable()) {
                    logger.debug("Not retaining invalid output for {}: a servable record exists", candidate.key());
                    return Optional.<FindingsRecord>empty();
                }
                if (record.getSchemaVersion() != null && record.getSchemaVersion() > candidate.schemaVersion()) {
                    logger.debug("Not retaining invalid output for {}: row is at a newer schema version", candidate.key());
                    return Optional.<FindingsRecord>empty();
                }
                apply(record, candidate, validation);
                record.setActive(false);
                record.setInvalidationReason("validation failed: " + String.join(", ", validation.issueNames()));
                return Optional.of(repository.saveAndFlush(record));
            });
        } catch (StaleWriteException e) {
            logger.debug("Lost race retaining diagnostics for {}: {}", candidate.key(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Counts one access and returns the record as it stands afterwards.
     */
    public Optional<FindingsRecord> markAccessed(String combinationHash) {
        repository.incrementAccess(combinationHash, OffsetDateTime.now());
        return repository.findByCombinationHash(combinationHash);
    }

    /**
     * Soft-invalidates a record.
     *
     * @throws FindingsNotFoundException if no record exists for the hash
     */
    public FindingsRecord invalidate(String combinationHash, String reason) {
        return withLock(combinationHash, () -> {
            FindingsRecord record = repository.findByCombinationHash(combinationHash)
                    .orElseThrow(() -> new FindingsNotFoundException("No findings for hash " + combinationHash));
            deactivate(record, reason);
            return repository.saveAndFlush(record);
        });
    }

    /**
     * Soft-invalidates the record if one is live; returns whether anything changed.
     */
    public boolean invalidateIfPresent(String combinationHash, String reason) {
        return withLock(combinationHash, () -> {
            Optional<FindingsRecord> existing = repository.findByCombinationHash(combinationHash);
            if (existing.isEmpty() || !existing.get().isActive()) {
                return false;
            }
            deactivate(existing.get(), reason);
            repository.saveAndFlush(existing.get());
            return true;
        });
    }

    /**
     * Soft-invalidates every active record created more than {@code age} ago.
     */
    public int invalidateOlderThan(Duration age, String reason) {
        OffsetDateTime cutoff = OffsetDateTime.now().minus(age);
        int invalidated = 0;
        for (FindingsRecord stale : repository.findAllByActiveTrueAndCreatedAtBefore(cutoff)) {
            if (invalidateIfPresent(stale.getCombinationHash(), reason)) {
                invalidated++;
            }
        }
        logger.info("Invalidated {} findings records older than {}", invalidated, age);
        return invalidated;
    }

    public FindingsRecord recordFeedback(String combinationHash, int rating, String feedback) {
        if (rating < 1 || rating > 5) {
            throw new IllegalArgumentException("Rating must be between 1 and 5");
        }
        return withLock(combinationHash, () -> {
            FindingsRecord record = repository.findByCombinationHash(combinationHash)
                    .orElseThrow(() -> new FindingsNotFoundException("No findings for hash " + combinationHash));
            record.setUserRating(rating);
            record.setUserFeedback(feedback);
            return repository.saveAndFlush(record);
        });
    }

    public long countValid(FindingsFilter filter) {
        return repository.countActive(ValidationStatus.VALID, filter.tool(), filter.analysisType(), filter.language());
    }

    public List<FindingsRecord> find(FindingsFilter filter) {
        return repository.findActive(filter.tool(), filter.analysisType(), filter.language());
    }

    /**
     * Re-runs the validator over active records matching the filter. Records now classified
     * INVALID are soft-invalidated; others get their status and issues refreshed.
     */
    public RevalidationReport revalidate(FindingsFilter filter) {
        int checked = 0;
        int valid = 0;
        int partial = 0;
        int invalidated = 0;
        int changed = 0;
        for (FindingsRecord snapshot : find(filter)) {
            checked++;
            ValidationResult result = validator.validate(toCandidate(snapshot));
            if (result.status() != snapshot.getValidationStatus()) {
                changed++;
            }
            switch (result.status()) {
                case VALID -> valid++;
                case PARTIAL -> partial++;
                case INVALID -> invalidated++;
            }
            String hash = snapshot.getCombinationHash();
            withLock(hash, () -> {
                repository.findByCombinationHash(hash).ifPresent(record -> {
                    record.setValidationStatus(result.status());
                    record.setValidationIssues(result.issueNames());
                    if (result.status() == ValidationStatus.INVALID) {
                        deactivate(record, "revalidation failed: " + String.join(", ", result.issueNames()));
                    }
                    repository.saveAndFlush(record);
                });
                return null;
            });
        }
        logger.info("Revalidated {} records: {} valid, {} partial, {} invalidated", checked, valid, partial, invalidated);
        return new RevalidationReport(checked, valid, partial, invalidated, changed);
    }

    public List<ValidationSummaryRow> validationSummary() {
        Map<String, long[]> counts = new LinkedHashMap<>();
        Map<String, String[]> labels = new LinkedHashMap<>();
        for (Object[] row : repository.summarizeValidation()) {
            String tool = (String) row[0];
            String type = String.valueOf(row[1]);
            String language = (String) row[2];
            ValidationStatus status = (ValidationStatus) row[3];
            long total = ((Number) row[4]).longValue();
            String group = tool + "|" + type + "|" + language;
            labels.putIfAbsent(group, new String[]{tool, type, language});
            counts.computeIfAbsent(group, g -> new long[3])[status.ordinal()] += total;
        }
        List<ValidationSummaryRow> rows = new ArrayList<>(counts.size());
        counts.forEach((group, c) -> {
            String[] l = labels.get(group);
            rows.add(new ValidationSummaryRow(l[0], l[1], l[2], c[0], c[1], c[2]));
        });
        return rows;
    }

    FindingsCandidate toCandidate(FindingsRecord record) {
        return new FindingsCandidate(record.toKey(), record.toContent(), record.toMetadata(), Map.of(),
                record.getSchemaVersion() == null ? 0 : record.getSchemaVersion());
    }

    private void checkShape(FindingsCandidate candidate) {
        CombinationKey key = candidate.key();
        AnalysisType expected = key.analysisType();
        if (candidate.analysisType() != expected) {
            throw new SchemaViolationException(candidate.analysisType() + " content offered for " + expected
                    + " combination " + key);
        }
        if (expected == AnalysisType.SINGLE) {
            boolean stray = candidate.strayCrossSourceSections().values().stream().anyMatch(v -> !validator.isTrivial(v));
            if (stray) {
                throw new SchemaViolationException("Single-source record for " + key + " carries cross-source content");
            }
        }
    }

    private void apply(FindingsRecord record, FindingsCandidate candidate, ValidationResult validation) {
        CombinationKey key = candidate.key();
        AnalysisContent content = candidate.content();
        GenerationMetadata metadata = candidate.metadata();
        record.setCombinationHash(key.hash());
        record.setCanonicalKey(key.canonicalForm());
        record.setToolName(key.tool());
        record.setSourceIds(key.sources());
        record.setLanguage(key.language());
        record.setAnalysisType(content.analysisType());
        record.setExecutiveSummary(content.executiveSummary());
        record.setPrincipalFindings(content.principalFindings());
        record.setStrategicSynthesis(content.strategicSynthesis());
        record.setConclusions(content.conclusions());
        if (content instanceof MultiSourceContent multi) {
            record.setCorrelationAnalysis(multi.correlationAnalysis());
            record.setComponentAnalysis(multi.componentAnalysis());
            record.setTemporalAnalysis(multi.temporalAnalysis());
            record.setSeasonalAnalysis(multi.seasonalAnalysis());
            record.setSpectralAnalysis(multi.spectralAnalysis());
        } else {
            record.setCorrelationAnalysis(null);
            record.setComponentAnalysis(null);
            record.setTemporalAnalysis(null);
            record.setSeasonalAnalysis(null);
            record.setSpectralAnalysis(null);
        }
        record.setGeneratorId(metadata.generatorId());
        record.setGenerationLatencyMs(metadata.latencyMs());
        record.setConfidenceScore(metadata.confidenceScore());
        record.setDataPoints(metadata.dataPoints());
        record.setValidationStatus(validation.status());
        record.setValidationIssues(validation.issueNames());
        record.setSchemaVersion(candidate.schemaVersion());
    }

    private FindingsHistory superseded(FindingsRecord previous, FindingsCandidate candidate, boolean replaceCurrent) {
        boolean refresh = replaceCurrent && previous.isServable()
                && previous.getSchemaVersion() != null && previous.getSchemaVersion() == candidate.schemaVersion();
        String reason;
        if (refresh) {
            reason = "forced refresh";
        } else if (previous.isActive()) {
            reason = "schema upgrade v" + previous.getSchemaVersion() + " -> v" + candidate.schemaVersion();
        } else {
            reason = "replaced inactive record"
                    + (previous.getInvalidationReason() != null ? " (" + previous.getInvalidationReason() + ")" : "");
        }
        return FindingsHistory.builder()
                .combinationHash(previous.getCombinationHash())
                .changeType(refresh ? HistoryChangeType.REFRESHED : HistoryChangeType.SUPERSEDED)
                .previousSchemaVersion(previous.getSchemaVersion())
                .schemaVersion(candidate.schemaVersion())
                .previousStatus(previous.getValidationStatus())
                .previousGeneratorId(previous.getGeneratorId())
                .previousSections(FindingsResponse.sectionsOf(previous.toContent()))
                .changeReason(reason)
                .build();
    }

    private void deactivate(FindingsRecord record, String reason) {
        boolean wasActive = record.isActive();
        record.setActive(false);
        record.setInvalidationReason(reason);
        if (wasActive) {
            historyRepository.save(FindingsHistory.builder()
                    .combinationHash(record.getCombinationHash())
                    .recordId(record.getId())
                    .changeType(HistoryChangeType.INVALIDATED)
                    .previousSchemaVersion(record.getSchemaVersion())
                    .schemaVersion(record.getSchemaVersion())
                    .previousStatus(record.getValidationStatus())
                    .previousGeneratorId(record.getGeneratorId())
                    .changeReason(reason)
                    .build());
        }
        logger.info("Invalidated findings {}: {}", record.getCombinationHash(), reason);
    }

    private <T> T withLock(String combinationHash, Supplier<T> work) {
        Lock lock = locks.get(combinationHash);
        lock.lock();
        try {
            return transactions.execute(status -> work.get());
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            throw new StaleWriteException(combinationHash, "Concurrent write for " + combinationHash + " rejected", e);
        } finally {
            lock.unlock();
        }
    }
}
