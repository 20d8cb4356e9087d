package io.regtruth.pipeline.discovery.listing;

import io.regtruth.pipeline.discovery.DiscoveryException;
import io.regtruth.pipeline.discovery.PageLoader;
import io.regtruth.pipeline.domain.DiscoveryEndpoint;
import io.regtruth.pipeline.domain.ListingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
public class SitemapListingResolver implements ListingResolver {

    private static final Logger logger = LoggerFactory.getLogger(SitemapListingResolver.class);

    private final PageLoader pageLoader;
    private final SitemapParser sitemapParser;

    public SitemapListingResolver(PageLoader pageLoader, SitemapParser sitemapParser) {
        this.pageLoader = pageLoader;
        this.sitemapParser = sitemapParser;
    }

    @Override
    public ListingStrategy strategy() {
        return ListingStrategy.SITEMAP_XML;
    }

    @Override
    public List<String> listUrls(DiscoveryEndpoint endpoint) throws DiscoveryException {
        int maxDepth = endpoint.options().maxDepth();
        int maxUrls = endpoint.options().maxUrls();

        List<String> pages = new ArrayList<>();
        Set<String> visitedSitemaps = new HashSet<>();
        Deque<SitemapRef> queue = new ArrayDeque<>();
        queue.add(new SitemapRef(endpoint.url(), 0));

        while (!queue.isEmpty() && pages.size() < maxUrls) {
            SitemapRef ref = queue.poll();
            if (!visitedSitemaps.add(ref.url())) {
                continue;
            }

            SitemapParser.SitemapDocument document;
            try {
                document = sitemapParser.parse(pageLoader.load(ref.url()).bodyAsString());
            } catch (DiscoveryException e) {
                if (ref.depth() == 0) {
                    throw e;
                }
                logger.warn("Skipping nested sitemap {}: {}", ref.url(), e.getMessage());
                continue;
            }

            if (document.index()) {
                if (ref.depth() + 1 > maxDepth) {
                    logger.debug("Sitemap depth budget reached at {}", ref.url());
                    continue;
                }
                document.locations().forEach(loc -> queue.add(new SitemapRef(loc, ref.depth() + 1)));
            } else {
                for (String loc : document.locations()) {
                    if (pages.size() >= maxUrls) {
                        break;
                    }
                    pages.add(loc);
                }
            }
        }

        logger.debug("Sitemap {} listed {} URLs from {} sitemap(s)", endpoint.url(), pages.size(), visitedSitemaps.size());
        return pages;
    }

    private record SitemapRef(String url, int depth) {}
}
