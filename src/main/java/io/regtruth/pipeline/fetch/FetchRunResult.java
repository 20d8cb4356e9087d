package io.regtruth.pipeline.fetch;

public record FetchRunResult(
        int processed,
        int fetched,
        int changed,
        int unchanged,
        int skipped,
        int failed,
        int deferred,
        long durationMs
) {}
