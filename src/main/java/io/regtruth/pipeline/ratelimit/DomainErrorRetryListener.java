package io.regtruth.pipeline.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;

/**
 * Charges every retryable fetch failure to its domain's error count. Permanent failures
 * say nothing about the domain's health and are left alone.
 */
public class DomainErrorRetryListener implements RetryListener {

    private static final Logger logger = LoggerFactory.getLogger(DomainErrorRetryListener.class);

    /** Retry context attribute carrying the domain of the URL being fetched. */
    public static final String DOMAIN_ATTRIBUTE = "fetch.domain";

    private final DomainRateLimiter rateLimiter;

    public DomainErrorRetryListener(DomainRateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        if (!RetryableFetchPolicy.isRetryable(throwable)) {
            return;
        }
        String domain = (String) context.getAttribute(DOMAIN_ATTRIBUTE);
        if (domain == null) {
            return;
        }
        rateLimiter.recordError(domain, throwable.getMessage());
        logger.warn("Transient failure for {} (attempt {}): {}", domain, context.getRetryCount(), throwable.getMessage());
    }
}
