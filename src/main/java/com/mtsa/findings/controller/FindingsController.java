package com.mtsa.findings.controller;

import com.mtsa.findings.dto.FeedbackRequest;
import com.mtsa.findings.dto.FindingsResponse;
import com.mtsa.findings.dto.InvalidateRequest;
import com.mtsa.findings.dto.RevalidationReport;
import com.mtsa.findings.model.AnalysisType;
import com.mtsa.findings.model.FindingsFilter;
import com.mtsa.findings.model.FindingsHistory;
import com.mtsa.findings.model.FindingsRecord;
import com.mtsa.findings.service.CacheResolver;
import com.mtsa.findings.service.CombinationCatalog;
import com.mtsa.findings.service.CombinationCollisionException;
import com.mtsa.findings.service.FindingsNotFoundException;
import com.mtsa.findings.service.FindingsStatisticsService;
import com.mtsa.findings.service.FindingsStore;
import com.mtsa.findings.service.GenerationFailedException;
import com.mtsa.findings.service.InvalidCombinationException;
import com.mtsa.findings.service.ResolvedFindings;
import com.mtsa.findings.service.SchemaViolationException;
import com.mtsa.findings.service.StaleWriteException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@Tag(name = "Findings", description = "Key findings lookup, feedback, invalidation and statistics API endpoints")
@RequestMapping("/api/findings")
public class FindingsController {

    private static final Logger logger = LoggerFactory.getLogger(FindingsController.class);

    private final CacheResolver cacheResolver;
    private final FindingsStore findingsStore;
    private final FindingsStatisticsService statisticsService;

    public FindingsController(CacheResolver cacheResolver,
                              FindingsStore findingsStore,
                              FindingsStatisticsService statisticsService) {
        this.cacheResolver = cacheResolver;
        this.findingsStore = findingsStore;
        this.statisticsService = statisticsService;
    }

    /**
     * Returns findings for a combination, generating them on a miss.
     */
    @Operation(
            summary = "Resolve findings for a combination",
            description = "Looks up the cached analysis for a tool, source set and language. On a miss the analysis is generated, validated and stored before it is returned."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Findings returned (cache hit or freshly generated)"),
            @ApiResponse(responseCode = "400", description = "Unknown tool, source or language, or empty source set"),
            @ApiResponse(responseCode = "502", description = "Generation failed or produced unusable content"),
            @ApiResponse(responseCode = "500", description = "Unexpected server error")
    })
    @GetMapping
    public ResponseEntity<?> resolve(
            @Parameter(description = "Management tool name", required = true) @RequestParam String tool,
            @Parameter(description = "One or more data source names", required = true) @RequestParam List<String> sources,
            @Parameter(description = "Output language (es or en)") @RequestParam(defaultValue = "es") String language,
            @Parameter(description = "Invalidate and regenerate the cached analysis") @RequestParam(defaultValue = "false") boolean refresh) {
        try {
            ResolvedFindings resolved = cacheResolver.resolve(tool, sources, language, refresh);
            FindingsResponse response = FindingsResponse.from(resolved.record());
            response.setCacheHit(resolved.cacheHit());
            response.setDegraded(resolved.degraded());
            response.setLatencyMs(resolved.latencyMs());
            return ResponseEntity.ok(response);
        } catch (InvalidCombinationException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (GenerationFailedException e) {
            logger.warn("Findings generation failed for {} {} {}: {}", tool, sources, language, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(e.getMessage());
        } catch (CombinationCollisionException e) {
            logger.error("Combination hash collision: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to resolve findings for {} {} {}: {}", tool, sources, language, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.getMessage());
        }
    }

    @Operation(summary = "Fetch a stored record by combination hash",
            description = "Never triggers generation. Invalidated and INVALID rows are only returned with includeInactive.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Record returned"),
            @ApiResponse(responseCode = "404", description = "No servable record for this hash")
    })
    @GetMapping("/{hash}")
    public ResponseEntity<?> getByHash(@PathVariable String hash,
                                       @Parameter(description = "Also return invalidated or INVALID rows, for diagnostics")
                                       @RequestParam(defaultValue = "false") boolean includeInactive) {
        return findingsStore.get(hash)
                .filter(record -> includeInactive || record.isServable())
                .<ResponseEntity<?>>map(record -> ResponseEntity.ok(FindingsResponse.from(record)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("No findings for hash " + hash));
    }

    @Operation(summary = "Change history of a combination", description = "Newest first; replaced content is included.")
    @GetMapping("/{hash}/history")
    public ResponseEntity<?> history(@PathVariable String hash) {
        try {
            List<FindingsHistory> entries = findingsStore.history(hash);
            if (entries.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body("No history for hash " + hash);
            }
            return ResponseEntity.ok(entries);
        } catch (Exception e) {
            logger.error("Failed to load history for {}: {}", hash, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.getMessage());
        }
    }

    @Operation(summary = "Record user feedback", description = "Stores a 1-5 rating and optional comment on a record.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Feedback stored"),
            @ApiResponse(responseCode = "400", description = "Rating missing or out of range"),
            @ApiResponse(responseCode = "404", description = "No record for this hash")
    })
    @PostMapping("/{hash}/feedback")
    public ResponseEntity<?> feedback(@PathVariable String hash, @RequestBody FeedbackRequest request) {
        try {
            if (request == null || request.getRating() == null) {
                return ResponseEntity.badRequest().body("rating is required");
            }
            FindingsRecord record = findingsStore.recordFeedback(hash, request.getRating(), request.getFeedback());
            return ResponseEntity.ok(FindingsResponse.from(record));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (FindingsNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (StaleWriteException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
        }
    }

    @Operation(summary = "Soft-invalidate a record", description = "Marks the record inactive; the next lookup regenerates it.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Record invalidated"),
            @ApiResponse(responseCode = "404", description = "No record for this hash"),
            @ApiResponse(responseCode = "409", description = "Concurrent write")
    })
    @PostMapping("/{hash}/invalidate")
    public ResponseEntity<?> invalidate(@PathVariable String hash,
                                        @RequestBody(required = false) InvalidateRequest request) {
        String reason = request != null && request.getReason() != null ? request.getReason() : "manual invalidation";
        try {
            return ResponseEntity.ok(FindingsResponse.from(findingsStore.invalidate(hash, reason)));
        } catch (FindingsNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (StaleWriteException | SchemaViolationException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
        }
    }

    @Operation(summary = "Soft-invalidate records older than a number of days")
    @PostMapping("/invalidate-older-than")
    public ResponseEntity<?> invalidateOlderThan(@RequestParam int days) {
        if (days < 1) {
            return ResponseEntity.badRequest().body("days must be positive");
        }
        int invalidated = findingsStore.invalidateOlderThan(Duration.ofDays(days), "older than " + days + " days");
        return ResponseEntity.ok(Map.of("invalidated", invalidated));
    }

    @Operation(summary = "Re-run validation over stored records",
            description = "Records now classified INVALID are soft-invalidated.")
    @PostMapping("/revalidate")
    public ResponseEntity<?> revalidate(@RequestParam(required = false) String tool,
                                        @RequestParam(required = false) String analysisType,
                                        @RequestParam(required = false) String language) {
        try {
            FindingsFilter filter = toFilter(tool, analysisType, language);
            RevalidationReport report = findingsStore.revalidate(filter);
            return ResponseEntity.ok(report);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @Operation(summary = "Count VALID records matching a filter")
    @GetMapping("/count")
    public ResponseEntity<?> countValid(@RequestParam(required = false) String tool,
                                        @RequestParam(required = false) String analysisType,
                                        @RequestParam(required = false) String language) {
        try {
            return ResponseEntity.ok(Map.of("valid", findingsStore.countValid(toFilter(tool, analysisType, language))));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @Operation(summary = "Store statistics", description = "Active records by language and type, most accessed, job counts and hit/miss totals.")
    @GetMapping("/statistics")
    public ResponseEntity<?> statistics() {
        return ResponseEntity.ok(statisticsService.statistics());
    }

    @Operation(summary = "Validation summary per tool, analysis type and language")
    @GetMapping("/validation-summary")
    public ResponseEntity<?> validationSummary() {
        return ResponseEntity.ok(findingsStore.validationSummary());
    }

    private static FindingsFilter toFilter(String tool, String analysisType, String language) {
        AnalysisType type = analysisType == null || analysisType.isBlank()
                ? null
                : AnalysisType.valueOf(analysisType.trim().toUpperCase(Locale.ROOT));
        return new FindingsFilter(
                tool == null || tool.isBlank() ? null : CombinationCatalog.normalize(tool),
                type,
                language == null || language.isBlank() ? null : CombinationCatalog.normalize(language));
    }
}
