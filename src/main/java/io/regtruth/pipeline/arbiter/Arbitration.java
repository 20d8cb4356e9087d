package io.regtruth.pipeline.arbiter;

import io.regtruth.pipeline.domain.ConflictType;
import io.regtruth.pipeline.domain.ResolutionStrategy;

import java.util.List;

/**
 * Validated model verdict.
 */
public record Arbitration(
        String conflictId,
        ConflictType conflictType,
        List<ConflictingItem> conflictingItems,
        String winningItemId,
        ResolutionStrategy strategy,
        String rationaleHr,
        String rationaleEn,
        double confidence,
        boolean requiresHumanReview,
        String humanReviewReason
) {
    public Arbitration {
        conflictingItems = conflictingItems != null ? List.copyOf(conflictingItems) : List.of();
    }
}
