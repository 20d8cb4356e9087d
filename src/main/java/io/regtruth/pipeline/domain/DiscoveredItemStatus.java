package io.regtruth.pipeline.domain;

/**
 * Lifecycle of a discovered URL.
 * <p>
 * Moves forward only (PENDING, FETCHED, PROCESSED) with two sanctioned exceptions:
 * FAILED back to PENDING for a bounded retry, and FETCHED/PROCESSED back to PENDING
 * when discovery sees the URL again. SKIPPED is terminal, even towards itself.
 */
public enum DiscoveredItemStatus {
    PENDING,
    FETCHED,
    PROCESSED,
    FAILED,
    SKIPPED;

    public boolean canTransitionTo(DiscoveredItemStatus target) {
        return switch (this) {
            case PENDING -> target == PENDING || target == FETCHED || target == FAILED || target == SKIPPED;
            case FETCHED -> target == FETCHED || target == PROCESSED || target == FAILED || target == SKIPPED
                    || target == PENDING;
            case PROCESSED -> target == PROCESSED || target == PENDING || target == FAILED;
            case FAILED -> target == FAILED || target == PENDING;
            case SKIPPED -> false;
        };
    }
}
