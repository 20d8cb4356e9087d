package io.regtruth.pipeline.ratelimit;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;

import java.time.Duration;

/**
 * Capped exponential backoff with jitter, delegating each delay to {@link BackoffCalculator}.
 */
public class JitteredBackOffPolicy implements BackOffPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Sleeper sleeper;

    public JitteredBackOffPolicy(Duration baseDelay, Duration maxDelay, Sleeper sleeper) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new AttemptContext();
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        AttemptContext attempts = (AttemptContext) backOffContext;
        Duration delay = BackoffCalculator.calculateBackoffDelay(attempts.completed++, baseDelay, maxDelay);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted during fetch backoff", e);
        }
    }

    private static final class AttemptContext implements BackOffContext {
        private int completed;
    }
}
