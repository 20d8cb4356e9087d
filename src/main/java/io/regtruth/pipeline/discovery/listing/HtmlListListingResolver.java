package io.regtruth.pipeline.discovery.listing;

import io.regtruth.pipeline.discovery.DiscoveryException;
import io.regtruth.pipeline.discovery.PageLoader;
import io.regtruth.pipeline.domain.DiscoveryEndpoint;
import io.regtruth.pipeline.domain.ListingStrategy;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class HtmlListListingResolver implements ListingResolver {

    private final PageLoader pageLoader;
    private final HtmlLinkExtractor linkExtractor;

    public HtmlListListingResolver(PageLoader pageLoader, HtmlLinkExtractor linkExtractor) {
        this.pageLoader = pageLoader;
        this.linkExtractor = linkExtractor;
    }

    @Override
    public ListingStrategy strategy() {
        return ListingStrategy.HTML_LIST;
    }

    @Override
    public List<String> listUrls(DiscoveryEndpoint endpoint) throws DiscoveryException {
        var page = pageLoader.load(endpoint.url());
        return linkExtractor.extractLinks(page.bodyAsString(), endpoint.url(), endpoint.options().linkSelector())
                .stream()
                .limit(endpoint.options().maxUrls())
                .toList();
    }
}
