package io.regtruth.pipeline.fetch.parser;

import io.regtruth.pipeline.domain.ContentClass;
import org.apache.poi.hwpf.HWPFDocument;
import org.apache.poi.hwpf.extractor.WordExtractor;
import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Word text extraction: DOCX through XWPF, legacy DOC through HWPF.
 */
@Component
public class WordDocumentParser implements BinaryDocumentParser {

    private static final Logger logger = LoggerFactory.getLogger(WordDocumentParser.class);

    @Override
    public boolean supports(ContentClass contentClass) {
        return contentClass == ContentClass.DOCX || contentClass == ContentClass.DOC;
    }

    @Override
    public ParsedDocument parse(byte[] content, ContentClass contentClass) throws DocumentParseException {
        if (!supports(contentClass)) {
            throw new DocumentParseException("Unsupported document class: " + contentClass);
        }
        if (content == null || content.length == 0) {
            throw new DocumentParseException("Empty " + contentClass + " document");
        }

        try {
            String text = contentClass == ContentClass.DOCX ? extractDocx(content) : extractDoc(content);
            logger.debug("Parsed {}: {} chars", contentClass, text.length());
            return new ParsedDocument(text, 1, false);

        } catch (IOException | RuntimeException e) {
            // POI reports malformed files through both checked and unchecked exceptions
            throw new DocumentParseException(contentClass + " extraction failed: " + e.getMessage(), e);
        }
    }

    private static String extractDocx(byte[] content) throws IOException {
        try (XWPFWordExtractor extractor = new XWPFWordExtractor(new XWPFDocument(new ByteArrayInputStream(content)))) {
            return extractor.getText();
        }
    }

    private static String extractDoc(byte[] content) throws IOException {
        try (WordExtractor extractor = new WordExtractor(new HWPFDocument(new ByteArrayInputStream(content)))) {
            return extractor.getText();
        }
    }
}
