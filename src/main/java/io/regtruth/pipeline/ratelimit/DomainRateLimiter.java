package io.regtruth.pipeline.ratelimit;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.regtruth.pipeline.config.RateLimitConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Per-domain request pacing with a consecutive-error circuit breaker.
 * <p>
 * Slots are reserved under the domain's lock and waited for outside of it, so requests to
 * one domain leave in reservation order while other domains proceed independently.
 * <p>
 * Each domain owns a resilience4j breaker over a count window as wide as the threshold with a
 * 100% failure rate, so it opens exactly when the last {@code threshold} recorded calls all
 * failed. The open period is measured against the injected clock and ends with a full close.
 */
public class DomainRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(DomainRateLimiter.class);

    private final RateLimitConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final CircuitBreakerRegistry breakers;
    private final Map<String, DomainState> states = new ConcurrentHashMap<>();

    public DomainRateLimiter(RateLimitConfig config, Clock clock, Sleeper sleeper) {
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
        this.breakers = CircuitBreakerRegistry.of(breakerConfig(config));
    }

    static CircuitBreakerConfig breakerConfig(RateLimitConfig config) {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(config.circuitBreakerThreshold())
                .minimumNumberOfCalls(config.circuitBreakerThreshold())
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(config.circuitResetAfter())
                .permittedNumberOfCallsInHalfOpenState(1)
                .build();
    }

    /**
     * Block until the next request slot for {@code domain}.
     *
     * @throws CircuitBreakerOpenException immediately when the domain's breaker is open
     */
    public void waitForSlot(String domain) throws InterruptedException {
        DomainState state = stateFor(domain);
        Instant slot;

        synchronized (state) {
            Instant now = clock.instant();
            closeIfExpired(domain, state, now);
            if (isOpen(state)) {
                throw new CircuitBreakerOpenException(domain, state.circuitOpenedAt);
            }
            slot = state.nextSlot == null || state.nextSlot.isBefore(now) ? now : state.nextSlot;
            state.nextSlot = slot.plus(config.requestDelay());
        }

        Duration wait = Duration.between(clock.instant(), slot);
        if (!wait.isNegative() && !wait.isZero()) {
            sleeper.sleep(wait);
        }
    }

    public void recordSuccess(String domain) {
        DomainState state = stateFor(domain);
        synchronized (state) {
            state.breaker.onSuccess(0, TimeUnit.MILLISECONDS);
            state.consecutiveErrors = 0;
            state.totalRequests++;
            state.successfulRequests++;
            state.lastSuccessAt = clock.instant();
        }
    }

    public void recordError(String domain, String message) {
        DomainState state = stateFor(domain);
        synchronized (state) {
            state.breaker.onError(0, TimeUnit.MILLISECONDS, new IOException(message));
            state.consecutiveErrors++;
            state.totalRequests++;
            state.lastError = message;

            if (state.circuitOpenedAt == null && isOpen(state)) {
                state.circuitOpenedAt = clock.instant();
                logger.warn("Circuit breaker opened for {} after {} consecutive errors (last: {})",
                        domain, state.consecutiveErrors, message);
            }
        }
    }

    public boolean isCircuitOpen(String domain) {
        DomainState state = stateFor(domain);
        synchronized (state) {
            closeIfExpired(domain, state, clock.instant());
            return isOpen(state);
        }
    }

    public void resetCircuitBreaker(String domain) {
        DomainState state = stateFor(domain);
        synchronized (state) {
            state.breaker.reset();
            state.circuitOpenedAt = null;
            state.consecutiveErrors = 0;
        }
        logger.info("Circuit breaker manually reset for {}", domain);
    }

    public DomainHealth getDomainHealth(String domain) {
        DomainState state = stateFor(domain);
        synchronized (state) {
            closeIfExpired(domain, state, clock.instant());
            return snapshot(domain, state);
        }
    }

    public HealthStatus getHealthStatus() {
        Map<String, DomainHealth> domains = new TreeMap<>();
        for (String domain : states.keySet()) {
            domains.put(domain, getDomainHealth(domain));
        }
        boolean healthy = domains.values().stream().allMatch(DomainHealth::healthy);
        return new HealthStatus(healthy, domains);
    }

    private DomainHealth snapshot(String domain, DomainState state) {
        double successRate = state.totalRequests == 0
                ? 1.0
                : (double) state.successfulRequests / state.totalRequests;
        boolean open = isOpen(state);
        boolean healthy = !open && state.consecutiveErrors < config.unhealthyThreshold();
        return new DomainHealth(domain, healthy, successRate, state.consecutiveErrors, open,
                state.totalRequests, state.lastSuccessAt, state.lastError);
    }

    private void closeIfExpired(String domain, DomainState state, Instant now) {
        if (state.circuitOpenedAt != null && !state.circuitOpenedAt.plus(config.circuitResetAfter()).isAfter(now)) {
            state.breaker.transitionToClosedState();
            state.circuitOpenedAt = null;
            state.consecutiveErrors = 0;
            logger.info("Circuit breaker for {} closed after reset period", domain);
        }
    }

    private static boolean isOpen(DomainState state) {
        return state.breaker.getState() != CircuitBreaker.State.CLOSED;
    }

    private DomainState stateFor(String domain) {
        return states.computeIfAbsent(domain, d -> new DomainState(breakers.circuitBreaker(d)));
    }

    private static final class DomainState {
        private final CircuitBreaker breaker;
        private Instant nextSlot;
        private int consecutiveErrors;
        private long totalRequests;
        private long successfulRequests;
        private Instant lastSuccessAt;
        private String lastError;
        private Instant circuitOpenedAt;

        private DomainState(CircuitBreaker breaker) {
            this.breaker = breaker;
        }
    }
}
