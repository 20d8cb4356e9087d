package io.regtruth.pipeline.ratelimit;

import io.regtruth.pipeline.api.exception.ErrorCategory;
import io.regtruth.pipeline.http.ContentFetcher;
import io.regtruth.pipeline.http.FetchException;
import io.regtruth.pipeline.http.FetchResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;

import java.net.URI;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps a {@link ContentFetcher} with per-domain pacing, the circuit breaker and
 * bounded exponential-backoff retries for transient failures. Retries run through the
 * fetch {@link RetryTemplate}; every attempt waits for its own domain slot.
 */
public class RateLimitedFetcher {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitedFetcher.class);

    private final ContentFetcher fetcher;
    private final DomainRateLimiter rateLimiter;
    private final RetryTemplate retryTemplate;

    public RateLimitedFetcher(ContentFetcher fetcher, DomainRateLimiter rateLimiter, RetryTemplate retryTemplate) {
        this.fetcher = fetcher;
        this.rateLimiter = rateLimiter;
        this.retryTemplate = retryTemplate;
    }

    public FetchOutcome fetch(String url) {
        String domain;
        try {
            domain = domainOf(url);
        } catch (IllegalArgumentException e) {
            return new FetchOutcome.Failure(url, ErrorCategory.INVALID_URL, false, 0, e.getMessage(), null);
        }

        AtomicInteger attempts = new AtomicInteger();
        try {
            FetchResponse response = retryTemplate.execute(context -> {
                context.setAttribute(DomainErrorRetryListener.DOMAIN_ATTRIBUTE, domain);
                awaitSlot(domain);
                attempts.incrementAndGet();
                return fetcher.fetch(url);
            });
            rateLimiter.recordSuccess(domain);
            return new FetchOutcome.Success(response, attempts.get());

        } catch (CircuitBreakerOpenException e) {
            return new FetchOutcome.CircuitOpen(domain, e.getMessage());

        } catch (BackOffInterruptedException e) {
            return new FetchOutcome.Failure(url, ErrorCategory.UNKNOWN, false, attempts.get(), "Interrupted", null);

        } catch (FetchException e) {
            if (!e.isRetryable()) {
                logger.debug("Permanent failure for {}: {} ({})", url, e.getMessage(), e.getCategory());
            }
            return new FetchOutcome.Failure(url, e.getCategory(), e.isRetryable(), attempts.get(),
                    e.getMessage(), e.getStatusCode());
        }
    }

    private void awaitSlot(String domain) throws FetchException {
        try {
            rateLimiter.waitForSlot(domain);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted", e, ErrorCategory.UNKNOWN);
        }
    }

    public static String domainOf(String url) {
        if (url == null) {
            throw new IllegalArgumentException("URL is null");
        }
        String host = URI.create(url.trim()).getHost();
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("URL has no host: " + url);
        }
        return host.toLowerCase(Locale.ROOT);
    }
}
