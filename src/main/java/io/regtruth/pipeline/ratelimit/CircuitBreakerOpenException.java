package io.regtruth.pipeline.ratelimit;

import java.time.Instant;

public class CircuitBreakerOpenException extends RuntimeException {
    private final String domain;
    private final Instant openedAt;

    public CircuitBreakerOpenException(String domain, Instant openedAt) {
        super("Circuit breaker open for " + domain + " since " + openedAt);
        this.domain = domain;
        this.openedAt = openedAt;
    }

    public String getDomain() {
        return domain;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }
}
