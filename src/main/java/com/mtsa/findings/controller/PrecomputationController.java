package com.mtsa.findings.controller;

import com.mtsa.findings.dto.BacklogSummary;
import com.mtsa.findings.dto.JobView;
import com.mtsa.findings.dto.PipelineRunSummary;
import com.mtsa.findings.model.JobStatus;
import com.mtsa.findings.service.CombinationCatalog;
import com.mtsa.findings.service.ComputationJobStore;
import com.mtsa.findings.service.PrecomputationPipeline;
import io.swagger.v3.oas.annotations.Operation;
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
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@RestController
@Tag(name = "Precomputation", description = "Backlog enumeration, draining and job administration API endpoints")
@RequestMapping("/api/precompute")
public class PrecomputationController {

    private static final Logger logger = LoggerFactory.getLogger(PrecomputationController.class);

    private final PrecomputationPipeline pipeline;
    private final ComputationJobStore jobStore;

    public PrecomputationController(PrecomputationPipeline pipeline, ComputationJobStore jobStore) {
        this.pipeline = pipeline;
        this.jobStore = jobStore;
    }

    @Operation(summary = "Enqueue the precomputation backlog",
            description = "Enumerates every tool, source subset and language and creates jobs for combinations not yet computed.")
    @PostMapping("/backlog")
    public ResponseEntity<?> enqueueBacklog() {
        try {
            BacklogSummary summary = pipeline.enqueueBacklog();
            return ResponseEntity.ok(summary);
        } catch (Exception e) {
            logger.error("Failed to enqueue backlog: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.getMessage());
        }
    }

    @Operation(summary = "Drain the backlog", description = "Blocks until no job is PENDING.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Backlog drained"),
            @ApiResponse(responseCode = "409", description = "A drain is already running")
    })
    @PostMapping("/run")
    public ResponseEntity<?> run() {
        try {
            PipelineRunSummary summary = pipeline.runUntilDrained();
            return ResponseEntity.ok(summary);
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
        } catch (Exception e) {
            logger.error("Precomputation run failed: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.getMessage());
        }
    }

    @Operation(summary = "Job counts by status")
    @GetMapping("/status")
    public ResponseEntity<?> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        jobStore.countsByStatus().forEach((status, count) -> body.put(status.name(), count));
        body.put("running", pipeline.isRunning());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Query jobs by tool, status and minimum priority")
    @GetMapping("/jobs")
    public ResponseEntity<?> jobs(@RequestParam(required = false) String tool,
                                  @RequestParam(required = false) String status,
                                  @RequestParam(required = false) Integer minPriority) {
        try {
            JobStatus jobStatus = status == null || status.isBlank()
                    ? null
                    : JobStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
            String toolId = tool == null || tool.isBlank() ? null : CombinationCatalog.normalize(tool);
            List<JobView> jobs = jobStore.search(toolId, jobStatus, minPriority).stream().map(JobView::from).toList();
            return ResponseEntity.ok(jobs);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @Operation(summary = "Permanently failed jobs")
    @GetMapping("/failures")
    public ResponseEntity<?> failures() {
        return ResponseEntity.ok(jobStore.failures().stream().map(JobView::from).toList());
    }

    @Operation(summary = "Retry a failed job", description = "Resets a FAILED job to PENDING with a fresh attempt budget.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Job reset"),
            @ApiResponse(responseCode = "404", description = "Job not found"),
            @ApiResponse(responseCode = "409", description = "Job is not FAILED or already has a live successor")
    })
    @PostMapping("/jobs/{id}/retry")
    public ResponseEntity<?> retry(@PathVariable UUID id) {
        try {
            return ResponseEntity.ok(JobView.from(jobStore.retryFailed(id)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
        }
    }
}
