package io.regtruth.pipeline.discovery.listing;

import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import io.regtruth.pipeline.api.exception.ErrorCategory;
import io.regtruth.pipeline.discovery.DiscoveryException;
import io.regtruth.pipeline.discovery.PageLoader;
import io.regtruth.pipeline.domain.DiscoveryEndpoint;
import io.regtruth.pipeline.domain.ListingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.StringReader;
import java.util.List;
import java.util.Objects;

@Component
public class RssFeedListingResolver implements ListingResolver {

    private static final Logger logger = LoggerFactory.getLogger(RssFeedListingResolver.class);

    private final PageLoader pageLoader;

    public RssFeedListingResolver(PageLoader pageLoader) {
        this.pageLoader = pageLoader;
    }

    @Override
    public ListingStrategy strategy() {
        return ListingStrategy.RSS_FEED;
    }

    @Override
    public List<String> listUrls(DiscoveryEndpoint endpoint) throws DiscoveryException {
        String xmlContent = pageLoader.load(endpoint.url()).bodyAsString();

        try {
            var feed = new SyndFeedInput().build(new StringReader(xmlContent));

            if (feed.getEntries() == null || feed.getEntries().isEmpty()) {
                logger.warn("Feed {} has no entries", endpoint.url());
                return List.of();
            }

            return feed.getEntries().stream()
                    .map(SyndEntry::getLink)
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(link -> !link.isEmpty())
                    .limit(endpoint.options().maxUrls())
                    .toList();

        } catch (FeedException | IllegalArgumentException e) {
            throw new DiscoveryException("Feed parsing error for " + endpoint.url() + ": " + e.getMessage(), e,
                    ErrorCategory.PARSE_ERROR);
        }
    }
}
