package com.mtsa.findings.service;

import com.mtsa.findings.model.AnalysisOutput;
import com.mtsa.findings.model.CombinationKey;
import com.mtsa.findings.model.DatasetSummary;
import com.mtsa.findings.model.FindingsCandidate;
import com.mtsa.findings.model.FindingsRecord;
import com.mtsa.findings.model.GenerationRequest;
import com.mtsa.findings.model.ValidationResult;
import com.mtsa.findings.model.ValidationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for findings lookups: LOOKUP, then HIT or MISS; on a miss GENERATE, VALIDATE and
 * STORE (or DISCARD). Concurrent misses for the same hash are coalesced onto one generation; the
 * other callers wait for its outcome. Live failures are surfaced, never retried here.
 */
@Service
public class CacheResolver {

    private static final Logger logger = LoggerFactory.getLogger(CacheResolver.class);

    private final CombinationKeyFactory keyFactory;
    private final CombinationCatalog catalog;
    private final FindingsStore store;
    private final ContentValidator validator;
    private final AnalysisGenerator generator;
    private final DatasetSummaryProvider datasetSummaryProvider;
    private final AnalysisContentAssembler assembler;
    private final UsageRecorder usageRecorder;
    private final long followerWaitMs;
    private final boolean retainInvalid;

    private final ConcurrentMap<String, CompletableFuture<FindingsRecord>> inFlight = new ConcurrentHashMap<>();

    public CacheResolver(CombinationKeyFactory keyFactory,
                         CombinationCatalog catalog,
                         FindingsStore store,
                         ContentValidator validator,
                         AnalysisGenerator generator,
                         DatasetSummaryProvider datasetSummaryProvider,
                         AnalysisContentAssembler assembler,
                         UsageRecorder usageRecorder,
                         @Value("${app.resolver.follower-wait-ms:120000}") long followerWaitMs,
                         @Value("${app.findings.retain-invalid:true}") boolean retainInvalid) {
        this.keyFactory = keyFactory;
        this.catalog = catalog;
        this.store = store;
        this.validator = validator;
        this.generator = generator;
        this.datasetSummaryProvider = datasetSummaryProvider;
        this.assembler = assembler;
        this.usageRecorder = usageRecorder;
        this.followerWaitMs = followerWaitMs;
        this.retainInvalid = retainInvalid;
    }

    /**
     * Canonicalizes the request, then resolves it.
     *
     * @throws InvalidCombinationException before any lookup for requests outside the catalog
     * @throws GenerationFailedException   when a miss could not be filled with a usable record
     */
    public ResolvedFindings resolve(String tool, Collection<String> sources, String language, boolean forceRefresh) {
        return resolve(keyFactory.canonicalize(tool, sources, language), forceRefresh);
    }

    public ResolvedFindings resolve(CombinationKey key, boolean forceRefresh) {
        long start = System.nanoTime();
        ResolutionTrace trace = new ResolutionTrace();
        boolean hit = false;
        try {
            Optional<FindingsRecord> existing = store.get(key.hash());
            existing.ifPresent(record -> verifyCanonical(key, record));
            if (!forceRefresh && existing.isPresent() && existing.get().isServable()) {
                trace.enter(ResolutionState.HIT);
                hit = true;
                FindingsRecord accessed = store.markAccessed(key.hash()).orElse(existing.get());
                logger.info("Findings cache hit for {}", key);
                return ResolvedFindings.of(accessed, true, elapsedMs(start), trace.states());
            }
            trace.enter(ResolutionState.MISS);
            if (forceRefresh) {
                // The current record stays servable until a replacement is stored.
                logger.info("Forced refresh for {}", key);
            } else {
                logger.info("Findings cache miss for {}", key);
            }
            FindingsRecord record = generateCoalesced(key, 0, forceRefresh, trace);
            return ResolvedFindings.of(record, false, elapsedMs(start), trace.states());
        } finally {
            usageRecorder.record(key.hash(), hit, elapsedMs(start));
        }
    }

    /**
     * Pipeline path: returns the live record if it is already at the current schema version,
     * otherwise generates, validates and stores through the same coalesced path as live traffic.
     */
    public FindingsRecord precompute(CombinationKey key, int schemaVersion) {
        Optional<FindingsRecord> existing = store.get(key.hash());
        existing.ifPresent(record -> verifyCanonical(key, record));
        if (existing.isPresent() && existing.get().isServable()
                && existing.get().getSchemaVersion() != null
                && existing.get().getSchemaVersion() >= schemaVersion) {
            logger.debug("Precompute skipped for {}: current record present", key);
            return existing.get();
        }
        ResolutionTrace trace = new ResolutionTrace();
        trace.enter(ResolutionState.MISS);
        return generateCoalesced(key, schemaVersion, false, trace);
    }

    /**
     * Number of generations currently in flight. Exposed for monitoring.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    private FindingsRecord generateCoalesced(CombinationKey key, int minSchemaVersion, boolean refresh,
                                             ResolutionTrace trace) {
        CompletableFuture<FindingsRecord> mine = new CompletableFuture<>();
        CompletableFuture<FindingsRecord> leader = inFlight.putIfAbsent(key.hash(), mine);
        if (leader != null) {
            logger.debug("Joining in-flight generation for {}", key);
            FindingsRecord record = awaitLeader(key, leader);
            trace.enter(ResolutionState.HIT);
            return record;
        }
        try {
            // A previous leader may have stored the record between our lookup and registration.
            Optional<FindingsRecord> stored = refresh ? Optional.empty() : store.get(key.hash())
                    .filter(FindingsRecord::isServable)
                    .filter(r -> r.getSchemaVersion() != null && r.getSchemaVersion() >= minSchemaVersion);
            FindingsRecord record;
            if (stored.isPresent()) {
                trace.enter(ResolutionState.HIT);
                record = stored.get();
            } else {
                record = generateAndStore(key, refresh, trace);
            }
            mine.complete(record);
            return record;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key.hash(), mine);
        }
    }

    private FindingsRecord generateAndStore(CombinationKey key, boolean refresh, ResolutionTrace trace) {
        trace.enter(ResolutionState.GENERATE);
        DatasetSummary summary = datasetSummaryProvider.summarize(key);
        GenerationRequest request = new GenerationRequest(
                key,
                catalog.toolDisplayName(key.tool()),
                catalog.sourceDisplayNames(key.sources()),
                key.language(),
                summary);

        long started = System.nanoTime();
        AnalysisOutput output;
        try {
            logger.info("Generating findings for {}", key);
            output = generator.generate(request);
        } catch (GeneratorException e) {
            trace.enter(ResolutionState.DISCARD);
            usageRecorder.recordGeneration(generatorId(), key.hash(), false, e.getReason().name(), e.getMessage(),
                    elapsedMs(started));
            logger.warn("Generator failed for {} ({}): {}", key, e.getReason(), e.getMessage());
            throw new GenerationFailedException(key, "Generation failed for " + key + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            trace.enter(ResolutionState.DISCARD);
            usageRecorder.recordGeneration(generatorId(), key.hash(), false, "ERROR", e.getMessage(), elapsedMs(started));
            logger.error("Unexpected generator error for {}: {}", key, e.getMessage(), e);
            throw new GenerationFailedException(key, "Generation failed for " + key + ": " + e.getMessage(), e);
        }
        if (output == null) {
            trace.enter(ResolutionState.DISCARD);
            usageRecorder.recordGeneration(generatorId(), key.hash(), false, "NO_OUTPUT", null, elapsedMs(started));
            throw new GenerationFailedException(key, "Generator returned no output for " + key);
        }

        trace.enter(ResolutionState.VALIDATE);
        FindingsCandidate candidate = assembler.assemble(key, output, elapsedMs(started));
        ValidationResult validation = validator.validate(candidate);
        String producedBy = candidate.metadata().generatorId() != null ? candidate.metadata().generatorId() : generatorId();
        usageRecorder.recordGeneration(producedBy, key.hash(), validation.status() != ValidationStatus.INVALID,
                validation.status().name(),
                validation.status() == ValidationStatus.INVALID ? String.join(", ", validation.issueNames()) : null,
                candidate.metadata().latencyMs());
        if (validation.status() == ValidationStatus.INVALID) {
            trace.enter(ResolutionState.DISCARD);
            logger.warn("Discarding invalid findings for {}: {}", key, validation.issueNames());
            if (retainInvalid) {
                store.retainForDiagnostics(candidate, validation);
            }
            throw new GenerationFailedException(key, "Generated findings for " + key + " failed validation: "
                    + validation.issueNames());
        }

        FindingsRecord stored;
        try {
            stored = store.put(candidate, validation, refresh);
        } catch (StaleWriteException e) {
            // Another node stored this combination first; serve its record.
            Optional<FindingsRecord> winner = store.get(key.hash()).filter(FindingsRecord::isServable);
            if (winner.isEmpty()) {
                throw e;
            }
            trace.enter(ResolutionState.DISCARD);
            logger.warn("Stale write for {}; serving the concurrently stored record", key);
            return winner.get();
        }
        trace.enter(ResolutionState.STORE);
        logger.info("Generated findings for {} in {} ms ({})", key, candidate.metadata().latencyMs(), validation.status());
        return stored;
    }

    private FindingsRecord awaitLeader(CombinationKey key, CompletableFuture<FindingsRecord> leader) {
        try {
            return leader.get(followerWaitMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GenerationFailedException failed) {
                throw failed;
            }
            throw new GenerationFailedException(key, "Coalesced generation failed for " + key, cause);
        } catch (TimeoutException e) {
            throw new GenerationFailedException(key, "Timed out waiting for in-flight generation of " + key, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationFailedException(key, "Interrupted waiting for generation of " + key, e);
        }
    }

    private String generatorId() {
        String id = generator.id();
        return id != null ? id : generator.getClass().getSimpleName();
    }

    private void verifyCanonical(CombinationKey key, FindingsRecord record) {
        if (record.getCanonicalKey() != null && !record.getCanonicalKey().equals(key.canonicalForm())) {
            throw new CombinationCollisionException(key.hash(), key.canonicalForm(), record.getCanonicalKey());
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
