package io.regtruth.pipeline.config;

import java.time.Duration;

public record RateLimitConfig(
        Duration requestDelay,
        int circuitBreakerThreshold,
        int unhealthyThreshold,
        Duration circuitResetAfter
) {
    public RateLimitConfig {
        requestDelay = requestDelay != null ? requestDelay : Duration.ofSeconds(2);
        circuitBreakerThreshold = circuitBreakerThreshold > 0 ? circuitBreakerThreshold : 5;
        unhealthyThreshold = unhealthyThreshold > 0 ? unhealthyThreshold : 3;
        circuitResetAfter = circuitResetAfter != null ? circuitResetAfter : Duration.ofHours(1);
    }

    public static RateLimitConfig defaults() {
        return new RateLimitConfig(null, 0, 0, null);
    }
}
