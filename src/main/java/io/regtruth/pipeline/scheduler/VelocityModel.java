package io.regtruth.pipeline.scheduler;

import io.regtruth.pipeline.domain.FreshnessRisk;

import java.time.Duration;
import java.time.Instant;

/**
 * Change-velocity estimate and the scan interval derived from it.
 */
public final class VelocityModel {

    public static final Duration MIN_INTERVAL = Duration.ofHours(1);
    public static final Duration MAX_INTERVAL = Duration.ofDays(30);

    private static final double MIN_ALPHA = 0.1;

    private VelocityModel() {
    }

    /**
     * Exponentially weighted update toward 1.0 on change and 0.0 otherwise. Early scans weigh
     * more ({@code alpha = 1/(scanCount+2)}) until alpha bottoms out at 0.1.
     */
    public static double updateVelocity(double previousFrequency, int scanCount, boolean changed) {
        double alpha = Math.max(MIN_ALPHA, 1.0 / (Math.max(0, scanCount) + 2));
        double target = changed ? 1.0 : 0.0;
        double updated = previousFrequency + alpha * (target - previousFrequency);
        return clamp(updated, 0.0, 1.0);
    }

    public static Duration nextScanInterval(double changeFrequency, FreshnessRisk risk) {
        double multiplier = 1.5 - clamp(changeFrequency, 0.0, 1.0);
        long millis = Math.round(risk.baseInterval().toMillis() * multiplier);
        millis = (long) clamp(millis, MIN_INTERVAL.toMillis(), MAX_INTERVAL.toMillis());
        return Duration.ofMillis(millis);
    }

    public static Instant calculateNextScan(double changeFrequency, FreshnessRisk risk, Instant now) {
        return now.plus(nextScanInterval(changeFrequency, risk));
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
