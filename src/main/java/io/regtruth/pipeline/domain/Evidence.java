package io.regtruth.pipeline.domain;

import java.time.Instant;

/**
 * Immutable snapshot of fetched content. Unique on (url, contentHash); the derived text
 * artifact is the only thing attached after creation.
 */
public record Evidence(
        String id,
        String url,
        String contentHash,
        ContentClass contentClass,
        byte[] rawContent,
        String contentType,
        Instant fetchedAt,
        boolean contentChanged,
        String changeSummary,
        String derivedText,
        String discoveredItemId
) {
    public Evidence withDerivedText(String text) {
        return new Evidence(id, url, contentHash, contentClass, rawContent, contentType, fetchedAt,
                contentChanged, changeSummary, text, discoveredItemId);
    }
}
