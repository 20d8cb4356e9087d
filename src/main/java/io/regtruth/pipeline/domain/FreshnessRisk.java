package io.regtruth.pipeline.domain;

import java.time.Duration;

/**
 * How costly a stale copy of a page is. Drives both the scan interval and the order in
 * which due items are picked up.
 */
public enum FreshnessRisk {
    CRITICAL(Duration.ofHours(6)),
    HIGH(Duration.ofHours(24)),
    MEDIUM(Duration.ofHours(72)),
    LOW(Duration.ofHours(168));

    private final Duration baseInterval;

    FreshnessRisk(Duration baseInterval) {
        this.baseInterval = baseInterval;
    }

    public Duration baseInterval() {
        return baseInterval;
    }
}
