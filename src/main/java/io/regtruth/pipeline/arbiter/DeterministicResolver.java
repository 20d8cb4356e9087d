package io.regtruth.pipeline.arbiter;

import io.regtruth.pipeline.domain.RegulatoryRule;
import io.regtruth.pipeline.domain.ResolutionStrategy;
import io.regtruth.pipeline.domain.RiskTier;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Pre-resolves a rule pair without the model: authority level first, then source hierarchy
 * (lower number wins), then the newer effective date. Pairs touching T0 or T1 only ever get a
 * recommendation.
 */
@Component
public class DeterministicResolver {

    public DeterministicResolution tryResolve(RegulatoryRule ruleA, RegulatoryRule ruleB) {
        RiskTier criticalTier = mostCriticalTier(ruleA, ruleB);
        boolean recommendationOnly = criticalTier.isCritical();

        if (ruleA.id().equals(ruleB.id())) {
            return DeterministicResolution.unresolved("Conflict unresolved: both sides are the same rule", recommendationOnly);
        }

        DeterministicResolution ladder = climbLadder(ruleA, ruleB);
        if (!recommendationOnly) {
            return ladder;
        }

        String reason = criticalTier + " rule involved, recommendation only: " + ladder.reason();
        return new DeterministicResolution(ladder.resolved(), ladder.winnerId(), ladder.loserId(), reason,
                true, ladder.strategy());
    }

    private DeterministicResolution climbLadder(RegulatoryRule ruleA, RegulatoryRule ruleB) {
        if (ruleA.authorityLevel() != ruleB.authorityLevel()) {
            RegulatoryRule winner = ruleA.authorityLevel().outranks(ruleB.authorityLevel()) ? ruleA : ruleB;
            RegulatoryRule loser = winner == ruleA ? ruleB : ruleA;
            return resolved(winner, loser, ResolutionStrategy.HIERARCHY, String.format(
                    "Resolved by authority: %s outranks %s", winner.authorityLevel(), loser.authorityLevel()));
        }

        Integer hierarchyA = ruleA.sourceHierarchy();
        Integer hierarchyB = ruleB.sourceHierarchy();
        if (hierarchyA != null && hierarchyB != null && !hierarchyA.equals(hierarchyB)) {
            RegulatoryRule winner = hierarchyA < hierarchyB ? ruleA : ruleB;
            RegulatoryRule loser = winner == ruleA ? ruleB : ruleA;
            return resolved(winner, loser, ResolutionStrategy.HIERARCHY, String.format(
                    "Resolved by source hierarchy: level %d prevails over level %d",
                    winner.sourceHierarchy(), loser.sourceHierarchy()));
        }

        LocalDate fromA = ruleA.effectiveFrom();
        LocalDate fromB = ruleB.effectiveFrom();
        if (fromA != null && fromB != null && !fromA.equals(fromB)) {
            RegulatoryRule winner = fromA.isAfter(fromB) ? ruleA : ruleB;
            RegulatoryRule loser = winner == ruleA ? ruleB : ruleA;
            return resolved(winner, loser, ResolutionStrategy.TEMPORAL, String.format(
                    "Resolved by temporal precedence: %s effective from %s is newer than %s from %s",
                    winner.id(), winner.effectiveFrom(), loser.id(), loser.effectiveFrom()));
        }

        return DeterministicResolution.unresolved(
                "Conflict unresolved: authority, source hierarchy and effective date are all equal", false);
    }

    private DeterministicResolution resolved(RegulatoryRule winner, RegulatoryRule loser,
                                             ResolutionStrategy strategy, String reason) {
        return new DeterministicResolution(true, winner.id(), loser.id(), reason, false, strategy);
    }

    private RiskTier mostCriticalTier(RegulatoryRule ruleA, RegulatoryRule ruleB) {
        return ruleA.riskTier().compareTo(ruleB.riskTier()) <= 0 ? ruleA.riskTier() : ruleB.riskTier();
    }
}
