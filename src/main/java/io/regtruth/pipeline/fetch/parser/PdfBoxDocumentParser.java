package io.regtruth.pipeline.fetch.parser;

import io.regtruth.pipeline.domain.ContentClass;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * PDF text extraction. A PDF averaging fewer than {@value #MIN_TEXT_CHARS_PER_PAGE}
 * non-whitespace characters per page is reported as scanned.
 */
@Component
public class PdfBoxDocumentParser implements BinaryDocumentParser {

    private static final Logger logger = LoggerFactory.getLogger(PdfBoxDocumentParser.class);

    public static final int MIN_TEXT_CHARS_PER_PAGE = 50;

    @Override
    public boolean supports(ContentClass contentClass) {
        return contentClass == ContentClass.PDF_TEXT || contentClass == ContentClass.PDF_SCANNED;
    }

    @Override
    public ParsedDocument parse(byte[] content, ContentClass contentClass) throws DocumentParseException {
        if (!supports(contentClass)) {
            throw new DocumentParseException("Unsupported document class: " + contentClass);
        }
        if (content == null || content.length == 0) {
            throw new DocumentParseException("Empty PDF");
        }

        try (PDDocument document = Loader.loadPDF(content)) {
            String text = new PDFTextStripper().getText(document);
            int pages = Math.max(1, document.getNumberOfPages());
            int meaningfulChars = text.replaceAll("\\s+", "").length();
            boolean scanned = meaningfulChars / pages < MIN_TEXT_CHARS_PER_PAGE;

            logger.debug("Parsed PDF: {} pages, {} chars{}", pages, meaningfulChars, scanned ? " (scanned)" : "");
            return new ParsedDocument(text, pages, scanned);

        } catch (IOException e) {
            throw new DocumentParseException("PDF extraction failed: " + e.getMessage(), e);
        }
    }
}
