package io.regtruth.pipeline.domain;

import java.time.Duration;
import java.time.Instant;

public enum ScrapeFrequency {
    EVERY_RUN(Duration.ZERO),
    DAILY(Duration.ofDays(1)),
    TWICE_WEEKLY(Duration.ofHours(84)),
    WEEKLY(Duration.ofDays(7)),
    MONTHLY(Duration.ofDays(30));

    private final Duration interval;

    ScrapeFrequency(Duration interval) {
        this.interval = interval;
    }

    public Duration interval() {
        return interval;
    }

    public boolean isDue(Instant lastScrapedAt, Instant now) {
        if (lastScrapedAt == null || interval.isZero()) {
            return true;
        }
        return !lastScrapedAt.plus(interval).isAfter(now);
    }
}
