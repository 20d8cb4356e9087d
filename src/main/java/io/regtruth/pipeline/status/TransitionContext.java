package io.regtruth.pipeline.status;

import io.regtruth.pipeline.domain.SystemAction;

/**
 * Who or what asks for a status change.
 *
 * @param source         identifies the caller, e.g. {@code "release:2025-02"}; required for
 *                       publishing and for every system action
 * @param systemAction   named system action, or null for the normal review flow
 * @param bypassApproval legacy flag, kept for callers that predate system actions
 */
public record TransitionContext(
        String source,
        SystemAction systemAction,
        boolean bypassApproval
) {
    public static TransitionContext none() {
        return new TransitionContext(null, null, false);
    }

    public static TransitionContext of(String source) {
        return new TransitionContext(source, null, false);
    }

    public static TransitionContext system(SystemAction action, String source) {
        return new TransitionContext(source, action, false);
    }

    /**
     * @deprecated use {@link #system(SystemAction, String)}
     */
    @Deprecated
    public static TransitionContext bypass(String source) {
        return new TransitionContext(source, null, true);
    }

    public boolean hasSource() {
        return source != null && !source.isBlank();
    }
}
