package io.regtruth.pipeline.discovery.listing;

import io.regtruth.pipeline.discovery.PageLoader;
import io.regtruth.pipeline.domain.DiscoveryEndpoint;
import io.regtruth.pipeline.domain.DiscoveryPriority;
import io.regtruth.pipeline.domain.ListingOptions;
import io.regtruth.pipeline.domain.ListingStrategy;
import io.regtruth.pipeline.domain.ScrapeFrequency;
import io.regtruth.pipeline.http.FetchResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HtmlListListingResolverTest {

    private static final String LIST_URL = "https://mfin.gov.hr/propisi";

    @Mock
    private PageLoader pageLoader;

    @Test
    @DisplayName("Should take links from the configured selector up to the URL budget")
    void shouldListSelectedLinks() throws Exception {
        String html = """
                <nav><a href="/o-nama">O nama</a></nav>
                <ul class="propisi">
                  <li><a href="/propisi/pdv#top">Zakon o PDV-u</a></li>
                  <li><a href="/propisi/dobit">Zakon o porezu na dobit</a></li>
                  <li><a href="/propisi/dohodak">Zakon o porezu na dohodak</a></li>
                </ul>
                """;
        when(pageLoader.load(LIST_URL))
                .thenReturn(new FetchResponse(LIST_URL, 200, "text/html", html.getBytes(StandardCharsets.UTF_8)));
        HtmlListListingResolver resolver = new HtmlListListingResolver(pageLoader, new HtmlLinkExtractor());
        DiscoveryEndpoint endpoint = new DiscoveryEndpoint("mfin-propisi", "mfin.gov.hr", "/propisi",
                ListingStrategy.HTML_LIST, DiscoveryPriority.MEDIUM, ScrapeFrequency.WEEKLY,
                new ListingOptions(0, 2, 0, "ul.propisi li", null, null), true, 0, null, null, null);

        assertThat(resolver.listUrls(endpoint))
                .containsExactly("https://mfin.gov.hr/propisi/pdv", "https://mfin.gov.hr/propisi/dobit");
    }
}
