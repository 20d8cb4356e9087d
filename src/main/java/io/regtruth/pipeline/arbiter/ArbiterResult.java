package io.regtruth.pipeline.arbiter;

import io.regtruth.pipeline.domain.ArbiterResolution;

/**
 * {@code resolution} is null for conflicts closed without a winner.
 */
public record ArbiterResult(
        boolean success,
        String conflictId,
        ArbiterResolution resolution,
        Arbitration arbitration,
        String error
) {
    public static ArbiterResult success(String conflictId, ArbiterResolution resolution, Arbitration arbitration) {
        return new ArbiterResult(true, conflictId, resolution, arbitration, null);
    }

    public static ArbiterResult failure(String conflictId, String error) {
        return new ArbiterResult(false, conflictId, null, null, error);
    }

    public boolean escalated() {
        return success && resolution == ArbiterResolution.ESCALATE_TO_HUMAN;
    }
}
