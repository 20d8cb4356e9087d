package io.regtruth.pipeline.store;

import io.regtruth.pipeline.domain.RuleStatus;

/**
 * Partial update for rule content. Null fields are left unchanged.
 */
public record RulePatch(
        String title,
        String value,
        Double confidence,
        String reviewerNotes,
        RuleStatus status
) {
    public static RulePatch notes(String reviewerNotes) {
        return new RulePatch(null, null, null, reviewerNotes, null);
    }

    public boolean touchesStatus() {
        return status != null;
    }
}
