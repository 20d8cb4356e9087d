package io.regtruth.pipeline.fetch.parser;

import io.regtruth.pipeline.domain.ContentClass;

public interface BinaryDocumentParser {

    boolean supports(ContentClass contentClass);

    ParsedDocument parse(byte[] content, ContentClass contentClass) throws DocumentParseException;
}
