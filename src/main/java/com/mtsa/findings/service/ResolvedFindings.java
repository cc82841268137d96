package com.mtsa.findings.service;

import com.mtsa.findings.model.FindingsRecord;
import com.mtsa.findings.model.ValidationStatus;

import java.util.List;

/**
 * Outcome of a resolve call.
 *
 * @param degraded true when the record is PARTIAL
 * @param trace    the states this lookup passed through; a coalesced follower ends in HIT
 */
public record ResolvedFindings(FindingsRecord record,
                               boolean cacheHit,
                               boolean degraded,
                               long latencyMs,
                               List<ResolutionState> trace) {

    static ResolvedFindings of(FindingsRecord record, boolean cacheHit, long latencyMs, List<ResolutionState> trace) {
        boolean degraded = record.getValidationStatus() == ValidationStatus.PARTIAL;
        return new ResolvedFindings(record, cacheHit, degraded, latencyMs, List.copyOf(trace));
    }
}
