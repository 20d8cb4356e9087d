package io.regtruth.pipeline.ratelimit;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.regtruth.pipeline.config.RateLimitConfig;
import io.regtruth.pipeline.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainRateLimiterTest {

    private MutableClock clock;
    private List<Duration> sleeps;
    private DomainRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        sleeps = new ArrayList<>();
        RateLimitConfig config = new RateLimitConfig(Duration.ofSeconds(2), 5, 3, Duration.ofHours(1));
        rateLimiter = new DomainRateLimiter(config, clock, sleeps::add);
    }

    @Test
    @DisplayName("Should space consecutive requests to one domain by the request delay")
    void shouldSpaceRequestsToSameDomain() throws InterruptedException {
        rateLimiter.waitForSlot("example.hr");
        rateLimiter.waitForSlot("example.hr");
        rateLimiter.waitForSlot("example.hr");

        assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("Should not make different domains wait for each other")
    void shouldNotDelayOtherDomains() throws InterruptedException {
        rateLimiter.waitForSlot("a.hr");
        rateLimiter.waitForSlot("b.hr");

        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Should not wait when the delay has already elapsed")
    void shouldNotWaitAfterDelayElapsed() throws InterruptedException {
        rateLimiter.waitForSlot("example.hr");
        clock.advance(Duration.ofSeconds(3));
        rateLimiter.waitForSlot("example.hr");

        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Should open the circuit after the threshold of consecutive errors")
    void shouldOpenCircuitAfterThreshold() {
        for (int i = 0; i < 4; i++) {
            rateLimiter.recordError("example.hr", "timeout");
        }
        assertThat(rateLimiter.isCircuitOpen("example.hr")).isFalse();

        rateLimiter.recordError("example.hr", "timeout");

        assertThat(rateLimiter.isCircuitOpen("example.hr")).isTrue();
        assertThatThrownBy(() -> rateLimiter.waitForSlot("example.hr"))
                .isInstanceOf(CircuitBreakerOpenException.class);
    }

    @Test
    @DisplayName("Should reset the consecutive error count on success")
    void shouldResetErrorsOnSuccess() {
        for (int i = 0; i < 4; i++) {
            rateLimiter.recordError("example.hr", "timeout");
        }
        rateLimiter.recordSuccess("example.hr");
        rateLimiter.recordError("example.hr", "timeout");

        assertThat(rateLimiter.isCircuitOpen("example.hr")).isFalse();
        assertThat(rateLimiter.getDomainHealth("example.hr").consecutiveErrors()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should close the circuit automatically after the reset period")
    void shouldCloseCircuitAfterResetPeriod() {
        for (int i = 0; i < 5; i++) {
            rateLimiter.recordError("example.hr", "timeout");
        }
        clock.advance(Duration.ofMinutes(59));
        assertThat(rateLimiter.isCircuitOpen("example.hr")).isTrue();

        clock.advance(Duration.ofMinutes(1));

        assertThat(rateLimiter.isCircuitOpen("example.hr")).isFalse();
        assertThat(rateLimiter.getDomainHealth("example.hr").consecutiveErrors()).isZero();
    }

    @Test
    @DisplayName("Should need a full run of consecutive errors to reopen after the reset period")
    void shouldReopenOnlyAfterThresholdAgain() {
        for (int i = 0; i < 5; i++) {
            rateLimiter.recordError("example.hr", "timeout");
        }
        clock.advance(Duration.ofHours(1));
        assertThat(rateLimiter.isCircuitOpen("example.hr")).isFalse();

        for (int i = 0; i < 4; i++) {
            rateLimiter.recordError("example.hr", "timeout");
        }
        assertThat(rateLimiter.isCircuitOpen("example.hr")).isFalse();

        rateLimiter.recordError("example.hr", "timeout");
        assertThat(rateLimiter.isCircuitOpen("example.hr")).isTrue();
    }

    @Test
    @DisplayName("Should size the breaker window to the consecutive error threshold")
    void shouldConfigureCountBasedBreaker() {
        CircuitBreakerConfig breakerConfig = DomainRateLimiter.breakerConfig(
                new RateLimitConfig(Duration.ofSeconds(2), 5, 3, Duration.ofMinutes(45)));

        assertThat(breakerConfig.getSlidingWindowType()).isEqualTo(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED);
        assertThat(breakerConfig.getSlidingWindowSize()).isEqualTo(5);
        assertThat(breakerConfig.getMinimumNumberOfCalls()).isEqualTo(5);
        assertThat(breakerConfig.getFailureRateThreshold()).isEqualTo(100.0f);
    }

    @Test
    @DisplayName("Should close the circuit on manual reset")
    void shouldCloseCircuitOnManualReset() {
        for (int i = 0; i < 5; i++) {
            rateLimiter.recordError("example.hr", "timeout");
        }

        rateLimiter.resetCircuitBreaker("example.hr");

        assertThat(rateLimiter.isCircuitOpen("example.hr")).isFalse();
    }

    @Test
    @DisplayName("Should report a domain unhealthy from the unhealthy threshold on")
    void shouldReportUnhealthyDomain() {
        rateLimiter.recordSuccess("good.hr");
        for (int i = 0; i < 3; i++) {
            rateLimiter.recordError("bad.hr", "HTTP 503");
        }

        HealthStatus status = rateLimiter.getHealthStatus();

        assertThat(status.healthy()).isFalse();
        assertThat(status.domains().get("good.hr").healthy()).isTrue();
        assertThat(status.domains().get("bad.hr").healthy()).isFalse();
        assertThat(status.domains().get("bad.hr").circuitOpen()).isFalse();
        assertThat(status.domains().get("bad.hr").lastError()).isEqualTo("HTTP 503");
        assertThat(status.domains().get("bad.hr").successRate()).isZero();
    }
}
