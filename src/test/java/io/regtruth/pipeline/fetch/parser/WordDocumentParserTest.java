package io.regtruth.pipeline.fetch.parser;

import io.regtruth.pipeline.domain.ContentClass;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WordDocumentParserTest {

    private final WordDocumentParser parser = new WordDocumentParser();

    @Test
    @DisplayName("Should extract paragraph text from a DOCX")
    void shouldExtractDocxText() throws Exception {
        byte[] docx = docx("Zahtjev za ostvarivanje prava na dopunsko zdravstveno osiguranje",
                "Rok za predaju zahtjeva je 30 dana.");

        ParsedDocument document = parser.parse(docx, ContentClass.DOCX);

        assertThat(document.scanned()).isFalse();
        assertThat(document.text())
                .contains("dopunsko zdravstveno osiguranje")
                .contains("Rok za predaju zahtjeva je 30 dana.");
    }

    @Test
    @DisplayName("Should fail on empty, corrupt or mislabelled Word content")
    void shouldFailOnBadContent() throws Exception {
        assertThatThrownBy(() -> parser.parse(new byte[0], ContentClass.DOCX))
                .isInstanceOf(DocumentParseException.class)
                .hasMessage("Empty DOCX document");
        assertThatThrownBy(() -> parser.parse("PK..".getBytes(StandardCharsets.US_ASCII), ContentClass.DOCX))
                .isInstanceOf(DocumentParseException.class)
                .hasMessageStartingWith("DOCX extraction failed");
        assertThatThrownBy(() -> parser.parse(docx("Obrazac"), ContentClass.DOC))
                .isInstanceOf(DocumentParseException.class)
                .hasMessageStartingWith("DOC extraction failed");
    }

    @Test
    @DisplayName("Should only accept Word document classes")
    void shouldSupportWordClassesOnly() {
        assertThat(parser.supports(ContentClass.DOCX)).isTrue();
        assertThat(parser.supports(ContentClass.DOC)).isTrue();
        assertThat(parser.supports(ContentClass.XLSX)).isFalse();
        assertThatThrownBy(() -> parser.parse(new byte[]{1}, ContentClass.PDF_TEXT))
                .isInstanceOf(DocumentParseException.class);
    }

    static byte[] docx(String... paragraphs) throws IOException {
        try (XWPFDocument document = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (String paragraph : paragraphs) {
                document.createParagraph().createRun().setText(paragraph);
            }
            document.write(out);
            return out.toByteArray();
        }
    }
}
