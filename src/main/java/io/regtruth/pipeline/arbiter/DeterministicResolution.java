package io.regtruth.pipeline.arbiter;

import io.regtruth.pipeline.domain.ResolutionStrategy;

/**
 * Outcome of the precedence ladder. {@code winnerId} and {@code loserId} are null when
 * unresolved; a {@code recommendationOnly} result must not be applied automatically.
 */
public record DeterministicResolution(
        boolean resolved,
        String winnerId,
        String loserId,
        String reason,
        boolean recommendationOnly,
        ResolutionStrategy strategy
) {
    static DeterministicResolution unresolved(String reason, boolean recommendationOnly) {
        return new DeterministicResolution(false, null, null, reason, recommendationOnly, null);
    }

    public boolean canAutoApply() {
        return resolved && !recommendationOnly;
    }
}
