package io.regtruth.pipeline.discovery.listing;

import io.regtruth.pipeline.discovery.DiscoveryException;
import io.regtruth.pipeline.discovery.PageLoader;
import io.regtruth.pipeline.domain.DiscoveryEndpoint;
import io.regtruth.pipeline.domain.ListingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
public class PaginationListingResolver implements ListingResolver {

    private static final Logger logger = LoggerFactory.getLogger(PaginationListingResolver.class);

    private final PageLoader pageLoader;
    private final HtmlLinkExtractor linkExtractor;

    public PaginationListingResolver(PageLoader pageLoader, HtmlLinkExtractor linkExtractor) {
        this.pageLoader = pageLoader;
        this.linkExtractor = linkExtractor;
    }

    @Override
    public ListingStrategy strategy() {
        return ListingStrategy.PAGINATION;
    }

    @Override
    public List<String> listUrls(DiscoveryEndpoint endpoint) throws DiscoveryException {
        var options = endpoint.options();
        Set<String> found = new LinkedHashSet<>();

        for (int page = 1; page <= options.maxPages() && found.size() < options.maxUrls(); page++) {
            String pageUrl = pageUrl(endpoint.url(), options.pageParam(), page);
            List<String> links;
            try {
                links = linkExtractor.extractLinks(pageLoader.load(pageUrl).bodyAsString(), pageUrl, options.linkSelector());
            } catch (DiscoveryException e) {
                if (page == 1) {
                    throw e;
                }
                logger.warn("Stopping pagination of {} at page {}: {}", endpoint.url(), page, e.getMessage());
                break;
            }

            int before = found.size();
            links.stream()
                    .filter(link -> !link.equals(pageUrl))
                    .forEach(found::add);
            if (found.size() == before) {
                logger.debug("Page {} of {} yielded no new links; stopping", page, endpoint.url());
                break;
            }
        }

        return new ArrayList<>(found).subList(0, Math.min(found.size(), options.maxUrls()));
    }

    static String pageUrl(String baseUrl, String pageParam, int page) {
        if (page == 1) {
            return baseUrl;
        }
        return baseUrl + (baseUrl.contains("?") ? "&" : "?") + pageParam + "=" + page;
    }
}
