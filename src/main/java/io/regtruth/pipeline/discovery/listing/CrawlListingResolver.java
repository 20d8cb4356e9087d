package io.regtruth.pipeline.discovery.listing;

import io.regtruth.pipeline.discovery.DiscoveryException;
import io.regtruth.pipeline.discovery.PageLoader;
import io.regtruth.pipeline.discovery.UrlNormalizer;
import io.regtruth.pipeline.domain.DiscoveryEndpoint;
import io.regtruth.pipeline.domain.ListingStrategy;
import io.regtruth.pipeline.http.FetchResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Same-domain breadth-first crawl bounded by depth and URL budgets, honouring robots.txt.
 */
@Component
public class CrawlListingResolver implements ListingResolver {

    private static final Logger logger = LoggerFactory.getLogger(CrawlListingResolver.class);

    private final PageLoader pageLoader;
    private final HtmlLinkExtractor linkExtractor;

    public CrawlListingResolver(PageLoader pageLoader, HtmlLinkExtractor linkExtractor) {
        this.pageLoader = pageLoader;
        this.linkExtractor = linkExtractor;
    }

    @Override
    public ListingStrategy strategy() {
        return ListingStrategy.CRAWL;
    }

    @Override
    public List<String> listUrls(DiscoveryEndpoint endpoint) throws DiscoveryException {
        String seed = UrlNormalizer.normalize(endpoint.url())
                .orElseThrow(() -> new IllegalArgumentException("Invalid endpoint URL: " + endpoint.url()));
        RobotsRules robots = loadRobots(seed);
        int maxDepth = endpoint.options().maxDepth();
        int maxUrls = endpoint.options().maxUrls();

        Set<String> seen = new LinkedHashSet<>();
        Deque<CrawlRef> queue = new ArrayDeque<>();
        queue.add(new CrawlRef(seed, 0));
        seen.add(seed);

        while (!queue.isEmpty()) {
            CrawlRef ref = queue.poll();
            if (ref.depth() >= maxDepth || isAsset(ref.url())) {
                continue;
            }

            FetchResponse page;
            try {
                page = pageLoader.load(ref.url());
            } catch (DiscoveryException e) {
                if (ref.depth() == 0) {
                    throw e;
                }
                logger.debug("Crawl skipped {}: {}", ref.url(), e.getMessage());
                continue;
            }
            if (page.contentType() != null && !page.contentType().toLowerCase(Locale.ROOT).contains("html")) {
                continue;
            }

            for (String link : linkExtractor.extractLinks(page.bodyAsString(), ref.url(), "a[href]")) {
                if (seen.size() >= maxUrls) {
                    break;
                }
                if (!UrlNormalizer.isSameDomain(seed, link) || !robots.isAllowed(URI.create(link).getPath())) {
                    continue;
                }
                if (seen.add(link)) {
                    queue.add(new CrawlRef(link, ref.depth() + 1));
                }
            }
        }

        List<String> urls = new ArrayList<>(seen);
        urls.remove(seed);
        return urls;
    }

    private RobotsRules loadRobots(String seed) {
        URI uri = URI.create(seed);
        String robotsUrl = uri.getScheme() + "://" + uri.getRawAuthority() + "/robots.txt";
        try {
            return RobotsRules.parse(pageLoader.load(robotsUrl).bodyAsString());
        } catch (DiscoveryException e) {
            logger.debug("No robots.txt at {} ({}); crawling without restrictions", robotsUrl, e.getMessage());
            return RobotsRules.allowAll();
        }
    }

    private static boolean isAsset(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.endsWith(".pdf") || lower.endsWith(".doc") || lower.endsWith(".docx")
                || lower.endsWith(".xls") || lower.endsWith(".xlsx") || lower.endsWith(".zip");
    }

    private record CrawlRef(String url, int depth) {}
}
