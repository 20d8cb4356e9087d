package io.regtruth.pipeline.ratelimit;

import java.util.Map;

public record HealthStatus(
        boolean healthy,
        Map<String, DomainHealth> domains
) {}
