package io.regtruth.pipeline.config;

import io.regtruth.pipeline.domain.DiscoveryEndpoint;
import io.regtruth.pipeline.domain.DiscoveryPriority;
import io.regtruth.pipeline.domain.ListingOptions;
import io.regtruth.pipeline.domain.ListingStrategy;
import io.regtruth.pipeline.domain.ScrapeFrequency;

public record EndpointSource(
        String domain,
        String path,
        ListingStrategy listingStrategy,
        DiscoveryPriority priority,
        ScrapeFrequency scrapeFrequency,
        boolean enabled,
        int maxDepth,
        int maxUrls,
        int maxPages,
        String linkSelector,
        String urlPattern
) {
    public String getEndpointId() {
        return domain + (path == null ? "/" : path);
    }

    public DiscoveryEndpoint toEndpoint() {
        return new DiscoveryEndpoint(
                getEndpointId(),
                domain,
                path,
                listingStrategy,
                priority != null ? priority : DiscoveryPriority.MEDIUM,
                scrapeFrequency != null ? scrapeFrequency : ScrapeFrequency.DAILY,
                new ListingOptions(maxDepth, maxUrls, maxPages, linkSelector, urlPattern, null),
                enabled,
                0,
                null,
                null,
                null
        );
    }
}
