package io.regtruth.pipeline.conflict;

import io.regtruth.pipeline.domain.RegulatoryRule;

import java.time.LocalDate;

/**
 * Inclusive effective date range. A null bound is open.
 */
public record EffectiveWindow(LocalDate from, LocalDate until) {

    public static EffectiveWindow of(RegulatoryRule rule) {
        return new EffectiveWindow(rule.effectiveFrom(), rule.effectiveUntil());
    }

    public boolean overlaps(EffectiveWindow other) {
        boolean startsBeforeOtherEnds = from == null || other.until == null || !from.isAfter(other.until);
        boolean otherStartsBeforeThisEnds = other.from == null || until == null || !other.from.isAfter(until);
        return startsBeforeOtherEnds && otherStartsBeforeThisEnds;
    }
}
