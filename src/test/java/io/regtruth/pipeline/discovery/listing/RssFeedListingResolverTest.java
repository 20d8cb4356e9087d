package io.regtruth.pipeline.discovery.listing;

import io.regtruth.pipeline.api.exception.ErrorCategory;
import io.regtruth.pipeline.discovery.DiscoveryException;
import io.regtruth.pipeline.discovery.PageLoader;
import io.regtruth.pipeline.domain.DiscoveryEndpoint;
import io.regtruth.pipeline.domain.DiscoveryPriority;
import io.regtruth.pipeline.domain.ListingOptions;
import io.regtruth.pipeline.domain.ListingStrategy;
import io.regtruth.pipeline.domain.ScrapeFrequency;
import io.regtruth.pipeline.http.FetchResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RssFeedListingResolverTest {

    private static final String FEED_URL = "https://www.hnb.hr/rss/vijesti";

    @Mock
    private PageLoader pageLoader;

    private RssFeedListingResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new RssFeedListingResolver(pageLoader);
    }

    @Test
    @DisplayName("Should list entry links and skip entries without one")
    void shouldListEntryLinks() throws Exception {
        when(pageLoader.load(FEED_URL)).thenReturn(feed("""
                <?xml version="1.0" encoding="UTF-8"?>
                <rss version="2.0">
                  <channel>
                    <title>HNB vijesti</title>
                    <link>https://www.hnb.hr</link>
                    <description>Priopcenja</description>
                    <item><title>Tecajna lista</title><link>https://www.hnb.hr/vijesti/tecaj</link></item>
                    <item><title>Bez poveznice</title></item>
                    <item><title>Kamatne stope</title><link> https://www.hnb.hr/vijesti/kamate </link></item>
                  </channel>
                </rss>
                """));

        assertThat(resolver.listUrls(endpoint()))
                .containsExactly("https://www.hnb.hr/vijesti/tecaj", "https://www.hnb.hr/vijesti/kamate");
    }

    @Test
    @DisplayName("Should report malformed feeds as parse errors")
    void shouldRejectMalformedFeed() throws Exception {
        when(pageLoader.load(FEED_URL)).thenReturn(feed("<rss><channel><item>"));

        assertThatThrownBy(() -> resolver.listUrls(endpoint()))
                .isInstanceOf(DiscoveryException.class)
                .satisfies(e -> assertThat(((DiscoveryException) e).getCategory()).isEqualTo(ErrorCategory.PARSE_ERROR));
    }

    private static DiscoveryEndpoint endpoint() {
        return new DiscoveryEndpoint("hnb-rss", "www.hnb.hr", "/rss/vijesti", ListingStrategy.RSS_FEED,
                DiscoveryPriority.HIGH, ScrapeFrequency.DAILY, ListingOptions.defaults(), true, 0, null, null, null);
    }

    private static FetchResponse feed(String xml) {
        return new FetchResponse(FEED_URL, 200, "application/rss+xml", xml.getBytes(StandardCharsets.UTF_8));
    }
}
