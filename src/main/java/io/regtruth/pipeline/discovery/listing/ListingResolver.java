package io.regtruth.pipeline.discovery.listing;

import io.regtruth.pipeline.discovery.DiscoveryException;
import io.regtruth.pipeline.domain.DiscoveryEndpoint;
import io.regtruth.pipeline.domain.ListingStrategy;

import java.util.List;

/**
 * Turns one discovery endpoint into the URLs it currently lists. Implementations bound their
 * traversal by the endpoint's depth, URL and page budgets.
 */
public interface ListingResolver {

    ListingStrategy strategy();

    /**
     * @return absolute URLs in discovery order; may contain duplicates
     * @throws DiscoveryException when the endpoint itself cannot be read
     */
    List<String> listUrls(DiscoveryEndpoint endpoint) throws DiscoveryException;
}
