package io.regtruth.pipeline.http;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.regtruth.pipeline.api.exception.ErrorCategory;
import io.regtruth.pipeline.config.HttpConfig;
import io.regtruth.pipeline.config.PipelineConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpContentFetcherTest {

    @RegisterExtension
    static WireMockExtension wireMock = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private HttpContentFetcher fetcher;

    @BeforeEach
    void setUp() {
        HttpConfig http = new HttpConfig(2_000, 2_000, 0, null, null, List.of("AgentA", "AgentB"));
        fetcher = new HttpContentFetcher(new PipelineConfig(List.of(), http, null, null, null));
    }

    @Test
    @DisplayName("Should return body, status and content type of a successful response")
    void shouldFetchPage() throws Exception {
        wireMock.stubFor(get(urlEqualTo("/vijesti")).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "text/html; charset=UTF-8")
                .withBody("<p>Obavijest</p>")));

        FetchResponse response = fetcher.fetch(wireMock.baseUrl() + "/vijesti");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.contentType()).isEqualTo("text/html; charset=UTF-8");
        assertThat(response.bodyAsString()).isEqualTo("<p>Obavijest</p>");
    }

    @Test
    @DisplayName("Should decompress gzip encoded bodies")
    void shouldDecompressGzip() throws Exception {
        ByteArrayOutputStream compressed = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(compressed)) {
            gzip.write("Sluzbeni tekst".getBytes(StandardCharsets.UTF_8));
        }
        wireMock.stubFor(get(urlEqualTo("/nn")).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "text/plain")
                .withHeader("Content-Encoding", "gzip")
                .withBody(compressed.toByteArray())));

        assertThat(fetcher.fetch(wireMock.baseUrl() + "/nn").bodyAsString()).isEqualTo("Sluzbeni tekst");
    }

    @Test
    @DisplayName("Should classify 404 as a non-retryable not found")
    void shouldClassifyNotFound() {
        wireMock.stubFor(get(urlEqualTo("/missing")).willReturn(aResponse().withStatus(404)));

        assertThatThrownBy(() -> fetcher.fetch(wireMock.baseUrl() + "/missing"))
                .isInstanceOfSatisfying(FetchException.class, e -> {
                    assertThat(e.getCategory()).isEqualTo(ErrorCategory.NOT_FOUND);
                    assertThat(e.getStatusCode()).isEqualTo(404);
                    assertThat(e.isRetryable()).isFalse();
                });
    }

    @Test
    @DisplayName("Should classify 503 as a retryable unavailable server")
    void shouldClassifyUnavailable() {
        wireMock.stubFor(get(urlEqualTo("/busy")).willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> fetcher.fetch(wireMock.baseUrl() + "/busy"))
                .isInstanceOfSatisfying(FetchException.class, e -> {
                    assertThat(e.getCategory()).isEqualTo(ErrorCategory.SERVER_UNAVAILABLE);
                    assertThat(e.isRetryable()).isTrue();
                });
    }

    @Test
    @DisplayName("Should time out on slow responses")
    void shouldTimeOut() {
        wireMock.stubFor(get(urlEqualTo("/slow")).willReturn(aResponse().withStatus(200).withFixedDelay(3_000)));

        assertThatThrownBy(() -> fetcher.fetch(wireMock.baseUrl() + "/slow"))
                .isInstanceOfSatisfying(FetchException.class,
                        e -> assertThat(e.getCategory()).isEqualTo(ErrorCategory.TIMEOUT));
    }

    @Test
    @DisplayName("Should reject empty and malformed URLs")
    void shouldRejectInvalidUrls() {
        assertThatThrownBy(() -> fetcher.fetch(" "))
                .isInstanceOfSatisfying(FetchException.class,
                        e -> assertThat(e.getCategory()).isEqualTo(ErrorCategory.INVALID_URL));
        assertThatThrownBy(() -> fetcher.fetch("ht tp://bad url"))
                .isInstanceOfSatisfying(FetchException.class,
                        e -> assertThat(e.getCategory()).isEqualTo(ErrorCategory.INVALID_URL));
    }

    @Test
    @DisplayName("Should rotate configured user agents")
    void shouldRotateUserAgents() throws Exception {
        wireMock.stubFor(get(urlEqualTo("/ua")).willReturn(aResponse().withStatus(200).withBody("ok")));

        fetcher.fetch(wireMock.baseUrl() + "/ua");
        fetcher.fetch(wireMock.baseUrl() + "/ua");

        wireMock.verify(1, getRequestedFor(urlEqualTo("/ua")).withHeader("User-Agent", equalTo("AgentA")));
        wireMock.verify(1, getRequestedFor(urlEqualTo("/ua")).withHeader("User-Agent", equalTo("AgentB")));
    }
}
