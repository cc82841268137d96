package com.mtsa.findings.dto;

import java.time.OffsetDateTime;

public record GeneratorPerformance(String generatorId,
                                   long calls,
                                   long successes,
                                   double averageLatencyMs,
                                   OffsetDateTime lastCallAt) {

    public double successRate() {
        return calls == 0 ? 0.0 : (double) successes / calls;
    }
}
