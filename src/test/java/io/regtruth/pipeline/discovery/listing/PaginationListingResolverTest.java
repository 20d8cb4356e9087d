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
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaginationListingResolverTest {

    private static final String BASE = "https://porezna-uprava.hr/vijesti";

    @Mock
    private PageLoader pageLoader;

    private PaginationListingResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new PaginationListingResolver(pageLoader, new HtmlLinkExtractor());
    }

    @Test
    @DisplayName("Should append the page parameter from the second page on")
    void shouldBuildPageUrls() {
        assertThat(PaginationListingResolver.pageUrl(BASE, "page", 1)).isEqualTo(BASE);
        assertThat(PaginationListingResolver.pageUrl(BASE, "page", 3)).isEqualTo(BASE + "?page=3");
        assertThat(PaginationListingResolver.pageUrl(BASE + "?lang=hr", "p", 2)).isEqualTo(BASE + "?lang=hr&p=2");
    }

    @Test
    @DisplayName("Should stop paging when a page adds no new links")
    void shouldStopWhenNoNewLinks() throws Exception {
        when(pageLoader.load(BASE)).thenReturn(html(BASE, "<a href='/vijesti/1'>1</a><a href='/vijesti/2'>2</a>"));
        when(pageLoader.load(BASE + "?page=2")).thenReturn(html(BASE, "<a href='/vijesti/2'>2</a>"));

        assertThat(resolver.listUrls(endpoint()))
                .containsExactly("https://porezna-uprava.hr/vijesti/1", "https://porezna-uprava.hr/vijesti/2");
    }

    @Test
    @DisplayName("Should keep links gathered before a later page fails")
    void shouldKeepLinksWhenLaterPageFails() throws Exception {
        when(pageLoader.load(BASE)).thenReturn(html(BASE, "<a href='/vijesti/1'>1</a>"));
        when(pageLoader.load(BASE + "?page=2"))
                .thenThrow(new DiscoveryException("HTTP 500", ErrorCategory.SERVER_ERROR));

        assertThat(resolver.listUrls(endpoint())).containsExactly("https://porezna-uprava.hr/vijesti/1");
    }

    private static DiscoveryEndpoint endpoint() {
        return new DiscoveryEndpoint("porezna-news", "porezna-uprava.hr", "/vijesti", ListingStrategy.PAGINATION,
                DiscoveryPriority.HIGH, ScrapeFrequency.DAILY, ListingOptions.defaults(), true, 0, null, null, null);
    }

    private static FetchResponse html(String url, String body) {
        return new FetchResponse(url, 200, "text/html; charset=UTF-8", body.getBytes(StandardCharsets.UTF_8));
    }
}
