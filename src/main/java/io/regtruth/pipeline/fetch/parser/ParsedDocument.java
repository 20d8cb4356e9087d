package io.regtruth.pipeline.fetch.parser;

/**
 * @param scanned true when the document is an image scan with too little extractable text
 */
public record ParsedDocument(
        String text,
        int pageCount,
        boolean scanned
) {}
