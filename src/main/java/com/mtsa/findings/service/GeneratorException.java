package com.mtsa.findings.service;

/**
 * Failure reported by an {@link AnalysisGenerator}. Generators never retry internally; callers
 * decide whether the failure is surfaced (live path) or rescheduled (pipeline).
 */
public class GeneratorException extends RuntimeException {

    public enum Reason {
        TIMEOUT,
        MALFORMED_OUTPUT,
        RATE_LIMITED,
        PROVIDER_ERROR
    }

    private final Reason reason;

    public GeneratorException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public GeneratorException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
