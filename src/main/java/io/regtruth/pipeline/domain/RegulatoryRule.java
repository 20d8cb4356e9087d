package io.regtruth.pipeline.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record RegulatoryRule(
        String id,
        String conceptSlug,
        String title,
        String value,
        String valueType,
        AuthorityLevel authorityLevel,
        RiskTier riskTier,
        LocalDate effectiveFrom,
        LocalDate effectiveUntil,
        double confidence,
        RuleStatus status,
        Integer sourceHierarchy,
        List<SourcePointer> sourcePointers,
        String reviewerNotes,
        Instant updatedAt
) {
    public RegulatoryRule {
        sourcePointers = sourcePointers != null ? List.copyOf(sourcePointers) : List.of();
    }

    public RegulatoryRule withStatus(RuleStatus newStatus, String notes, Instant now) {
        return new RegulatoryRule(id, conceptSlug, title, value, valueType, authorityLevel, riskTier,
                effectiveFrom, effectiveUntil, confidence, newStatus, sourceHierarchy, sourcePointers,
                notes != null ? notes : reviewerNotes, now);
    }

    public RegulatoryRule withContent(String newTitle, String newValue, double newConfidence,
                                      String notes, Instant now) {
        return new RegulatoryRule(id, conceptSlug, newTitle, newValue, valueType, authorityLevel, riskTier,
                effectiveFrom, effectiveUntil, newConfidence, status, sourceHierarchy, sourcePointers,
                notes, now);
    }
}
