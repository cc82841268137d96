package com.mtsa.findings.service;

import com.mtsa.findings.model.AnalysisOutput;
import com.mtsa.findings.model.GenerationRequest;

/**
 * Produces narrative sections for a combination. Slow and non-deterministic; may fail.
 * Implementations must not retry internally.
 */
public interface AnalysisGenerator {

    /**
     * @throws GeneratorException on timeout, malformed output, rate limiting or provider failure
     */
    AnalysisOutput generate(GenerationRequest request);

    /**
     * Name reported in generation statistics, also for calls that produced no output.
     */
    default String id() {
        return getClass().getSimpleName();
    }
}
