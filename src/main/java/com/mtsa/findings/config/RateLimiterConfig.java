package com.mtsa.findings.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${app.ratelimit.generatorQps:0.5}")
    private double generatorQps;

    /**
     * Shared budget for precomputation calls to the generator; 0 or less disables throttling.
     */
    @Bean("generatorRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter generatorRateLimiter() {
        double effectiveQps = generatorQps > 0 ? generatorQps : Double.MAX_VALUE;
        return RateLimiter.create(effectiveQps);
    }
}
