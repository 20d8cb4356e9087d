package io.regtruth.pipeline.domain;

/**
 * Named system-initiated status changes that bypass the normal review flow.
 * Each one is restricted to a fixed set of transitions.
 */
public enum SystemAction {
    QUARANTINE_DOWNGRADE,
    ROLLBACK,
    CONFLICT_SUPERSEDE
}
