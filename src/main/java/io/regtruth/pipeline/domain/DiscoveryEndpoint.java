package io.regtruth.pipeline.domain;

import java.time.Instant;

public record DiscoveryEndpoint(
        String id,
        String domain,
        String path,
        ListingStrategy listingStrategy,
        DiscoveryPriority priority,
        ScrapeFrequency scrapeFrequency,
        ListingOptions options,
        boolean active,
        int consecutiveErrors,
        String lastError,
        Instant lastScrapedAt,
        String lastScrapeHash
) {
    public DiscoveryEndpoint {
        options = options != null ? options : ListingOptions.defaults();
    }

    public String url() {
        return "https://" + domain + (path == null || path.isEmpty() ? "/" : path);
    }

    public boolean isDue(Instant now) {
        return active && scrapeFrequency.isDue(lastScrapedAt, now);
    }

    public DiscoveryEndpoint withSuccess(Instant scrapedAt, String scrapeHash) {
        return new DiscoveryEndpoint(id, domain, path, listingStrategy, priority, scrapeFrequency, options,
                active, 0, null, scrapedAt, scrapeHash);
    }

    public DiscoveryEndpoint withError(String error, Instant attemptedAt, int deactivateAfter) {
        int errors = consecutiveErrors + 1;
        return new DiscoveryEndpoint(id, domain, path, listingStrategy, priority, scrapeFrequency, options,
                active && errors < deactivateAfter, errors, error, attemptedAt, lastScrapeHash);
    }
}
