package io.regtruth.pipeline.http;

/**
 * Single outbound GET. Implementations apply their own timeouts and classify failures;
 * retries and rate limiting happen above this seam.
 */
public interface ContentFetcher {

    FetchResponse fetch(String url) throws FetchException;
}
