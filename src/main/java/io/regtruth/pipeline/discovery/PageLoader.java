package io.regtruth.pipeline.discovery;

import io.regtruth.pipeline.api.exception.ErrorCategory;
import io.regtruth.pipeline.http.FetchResponse;
import io.regtruth.pipeline.ratelimit.FetchOutcome;
import io.regtruth.pipeline.ratelimit.RateLimitedFetcher;
import org.springframework.stereotype.Component;

/**
 * Loads listing pages through the rate limiter and turns non-success outcomes into
 * {@link DiscoveryException}.
 */
@Component
public class PageLoader {

    private final RateLimitedFetcher fetcher;

    public PageLoader(RateLimitedFetcher fetcher) {
        this.fetcher = fetcher;
    }

    public FetchResponse load(String url) throws DiscoveryException {
        FetchOutcome outcome = fetcher.fetch(url);

        if (outcome instanceof FetchOutcome.Success success) {
            return success.response();
        }
        if (outcome instanceof FetchOutcome.CircuitOpen open) {
            throw new DiscoveryException(open.message(), ErrorCategory.CIRCUIT_OPEN);
        }
        FetchOutcome.Failure failure = (FetchOutcome.Failure) outcome;
        throw new DiscoveryException("Failed to load " + url + " after " + failure.attempts()
                + " attempt(s): " + failure.message(), failure.category());
    }
}
