package io.regtruth.pipeline.discovery;

import java.util.List;

public record DiscoveryRunResult(
        int endpointsProcessed,
        int endpointsFailed,
        int urlsFound,
        int newItems,
        int requeuedItems,
        long durationMs,
        List<EndpointDiscoveryResult> endpoints
) {}
