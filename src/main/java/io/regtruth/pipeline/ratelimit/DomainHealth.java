package io.regtruth.pipeline.ratelimit;

import java.time.Instant;

public record DomainHealth(
        String domain,
        boolean healthy,
        double successRate,
        int consecutiveErrors,
        boolean circuitOpen,
        long totalRequests,
        Instant lastSuccessAt,
        String lastError
) {}
