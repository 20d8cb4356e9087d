package io.regtruth.pipeline.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record RegulatoryConflict(
        String id,
        ConflictType conflictType,
        String itemAId,
        String itemBId,
        List<String> sourcePointerIds,
        String description,
        ConflictStatus status,
        ConflictResolution resolution,
        Double confidence,
        boolean requiresHumanReview,
        String humanReviewReason,
        Instant createdAt,
        Instant resolvedAt
) {
    public RegulatoryConflict {
        sourcePointerIds = sourcePointerIds != null ? List.copyOf(sourcePointerIds) : List.of();
    }

    public static RegulatoryConflict open(String id, ConflictType type, String itemAId, String itemBId,
                                          List<String> sourcePointerIds, String description, Instant now) {
        return new RegulatoryConflict(id, type, itemAId, itemBId, sourcePointerIds, description,
                ConflictStatus.OPEN, null, null, false, null, now, null);
    }

    public boolean isRuleConflict() {
        return itemAId != null && itemBId != null;
    }

    /**
     * True when this conflict concerns the unordered pair {a, b}.
     */
    public boolean involvesPair(String a, String b) {
        return (Objects.equals(itemAId, a) && Objects.equals(itemBId, b))
                || (Objects.equals(itemAId, b) && Objects.equals(itemBId, a));
    }

    public RegulatoryConflict resolved(ConflictResolution newResolution, Double newConfidence, Instant now) {
        return new RegulatoryConflict(id, conflictType, itemAId, itemBId, sourcePointerIds, description,
                ConflictStatus.RESOLVED, newResolution, newConfidence, false, null, createdAt, now);
    }

    public RegulatoryConflict escalated(ConflictResolution newResolution, Double newConfidence,
                                        String reviewReason, Instant now) {
        return new RegulatoryConflict(id, conflictType, itemAId, itemBId, sourcePointerIds, description,
                ConflictStatus.ESCALATED, newResolution, newConfidence, true, reviewReason, createdAt, now);
    }
}
