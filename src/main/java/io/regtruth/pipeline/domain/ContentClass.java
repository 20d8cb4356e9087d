package io.regtruth.pipeline.domain;

public enum ContentClass {
    HTML,
    PDF_TEXT,
    PDF_SCANNED,
    DOCX,
    DOC,
    XLSX,
    XLS,
    JSON,
    XML,
    UNKNOWN;

    public boolean isBinaryDocument() {
        return switch (this) {
            case PDF_TEXT, PDF_SCANNED, DOCX, DOC, XLSX, XLS -> true;
            case HTML, JSON, XML, UNKNOWN -> false;
        };
    }
}
