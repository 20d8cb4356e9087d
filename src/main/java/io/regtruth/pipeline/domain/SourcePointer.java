package io.regtruth.pipeline.domain;

public record SourcePointer(
        String id,
        String evidenceId,
        String exactQuote,
        String extractedValue,
        double confidence
) {}
