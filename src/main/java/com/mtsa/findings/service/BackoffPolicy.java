package com.mtsa.findings.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter: {@code base * 2^(attempt-1)} plus up to a quarter of the base,
 * capped at the maximum.
 */
@Component
public class BackoffPolicy {

    private final long baseMs;
    private final long maxMs;

    public BackoffPolicy(@Value("${app.pipeline.backoff.base-ms:2000}") long baseMs,
                         @Value("${app.pipeline.backoff.max-ms:60000}") long maxMs) {
        this.baseMs = Math.max(0L, baseMs);
        this.maxMs = Math.max(this.baseMs, maxMs);
    }

    public Duration delayFor(int attempt) {
        int exponent = Math.min(Math.max(attempt, 1) - 1, 30);
        long delay = baseMs * (1L << exponent);
        long jitterBound = baseMs / 4;
        if (jitterBound > 0) {
            delay += ThreadLocalRandom.current().nextLong(jitterBound + 1);
        }
        return Duration.ofMillis(Math.min(delay, maxMs));
    }
}
