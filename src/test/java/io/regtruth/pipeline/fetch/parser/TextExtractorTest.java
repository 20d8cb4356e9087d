package io.regtruth.pipeline.fetch.parser;

import io.regtruth.pipeline.domain.ContentClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextExtractorTest {

    private final TextExtractor extractor = new TextExtractor();

    @Test
    @DisplayName("Should drop scripts and styles and keep one line per block")
    void shouldExtractHtmlText() {
        String html = """
                <html><head><style>p { color: red }</style></head>
                <body>
                  <script>track()</script>
                  <h1>Pausalno oporezivanje</h1>
                  <p>Prag iznosi 60.000 EUR</p>
                </body></html>
                """;

        assertThat(extractor.extract(html, ContentClass.HTML))
                .isEqualTo("Pausalno oporezivanje\nPrag iznosi 60.000 EUR");
    }

    @Test
    @DisplayName("Should pass non-HTML text through stripped")
    void shouldStripOtherText() {
        assertThat(extractor.extract("  {\"rate\": 25}\n", ContentClass.JSON)).isEqualTo("{\"rate\": 25}");
        assertThat(extractor.extract(null, ContentClass.HTML)).isEmpty();
    }
}
