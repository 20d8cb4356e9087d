package io.regtruth.pipeline.ratelimit;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

public final class BackoffCalculator {

    private BackoffCalculator() {
    }

    public static Duration calculateBackoffDelay(int attempt, Duration base, Duration max) {
        return calculateBackoffDelay(attempt, base, max, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Exponential delay capped at {@code max}, scaled by a jitter factor in [0.5, 1.0].
     *
     * @param attempt zero-based retry attempt
     * @param random  source of values in [0, 1)
     */
    public static Duration calculateBackoffDelay(int attempt, Duration base, Duration max, DoubleSupplier random) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        double exponential = base.toMillis() * Math.pow(2, Math.min(attempt, 30));
        double capped = Math.min(exponential, max.toMillis());
        double jitter = 0.5 + random.getAsDouble() * 0.5;
        return Duration.ofMillis((long) (capped * jitter));
    }
}
