package io.regtruth.pipeline.ratelimit;

import java.time.Duration;

/**
 * Parks the calling thread. Swapped out in tests so waits do not cost wall time.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
