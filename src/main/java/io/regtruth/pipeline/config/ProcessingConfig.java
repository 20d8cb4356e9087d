package io.regtruth.pipeline.config;

import java.time.Duration;

public record ProcessingConfig(
        Duration discoveryInterval,
        Duration fetchInterval,
        Duration arbiterInterval,
        Duration initialDelay,
        boolean enableScheduling,
        int maxItemsPerRun,
        int maxFetchRetries,
        Duration scanErrorCooldown,
        Duration failedRetryDelay,
        int maxEndpointErrors,
        int fetchConcurrency
) {
    public ProcessingConfig {
        discoveryInterval = discoveryInterval != null ? discoveryInterval : Duration.ofHours(1);
        fetchInterval = fetchInterval != null ? fetchInterval : Duration.ofMinutes(5);
        arbiterInterval = arbiterInterval != null ? arbiterInterval : Duration.ofMinutes(15);
        initialDelay = initialDelay != null ? initialDelay : Duration.ofSeconds(30);
        maxItemsPerRun = maxItemsPerRun > 0 ? maxItemsPerRun : 100;
        maxFetchRetries = maxFetchRetries > 0 ? maxFetchRetries : 3;
        scanErrorCooldown = scanErrorCooldown != null ? scanErrorCooldown : Duration.ofHours(1);
        failedRetryDelay = failedRetryDelay != null ? failedRetryDelay : Duration.ofMinutes(30);
        maxEndpointErrors = maxEndpointErrors > 0 ? maxEndpointErrors : 5;
        fetchConcurrency = fetchConcurrency > 0 ? fetchConcurrency : 4;
    }

    public static ProcessingConfig defaults() {
        return new ProcessingConfig(null, null, null, null, true, 0, 0, null, null, 0, 0);
    }

    public long getDiscoveryIntervalMs() {
        return discoveryInterval.toMillis();
    }

    public long getFetchIntervalMs() {
        return fetchInterval.toMillis();
    }

    public long getArbiterIntervalMs() {
        return arbiterInterval.toMillis();
    }

    public long getInitialDelayMs() {
        return initialDelay.toMillis();
    }
}
