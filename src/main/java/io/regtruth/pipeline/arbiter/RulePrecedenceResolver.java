package io.regtruth.pipeline.arbiter;

import io.regtruth.pipeline.domain.RegulatoryRule;
import io.regtruth.pipeline.store.RuleGraph;
import io.regtruth.pipeline.store.RuleStore;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Picks one rule when several match a concept at query time. The order is total: lex
 * specialis over explicit OVERRIDES edges, then authority, then recency, then rule id.
 */
@Service
public class RulePrecedenceResolver {

    private static final Comparator<RegulatoryRule> MOST_RECENT_FIRST = Comparator
            .comparing(RegulatoryRule::effectiveFrom, Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
            .thenComparing(RegulatoryRule::id);

    private final RuleStore ruleStore;
    private final RuleGraph ruleGraph;

    public RulePrecedenceResolver(RuleStore ruleStore, RuleGraph ruleGraph) {
        this.ruleStore = ruleStore;
        this.ruleGraph = ruleGraph;
    }

    public PrecedenceResult resolveRulePrecedence(List<String> ruleIds) {
        if (ruleIds == null || ruleIds.isEmpty()) {
            throw new IllegalArgumentException("No rules to resolve");
        }
        List<String> distinctIds = ruleIds.stream().distinct().sorted().toList();
        if (distinctIds.size() == 1) {
            return new PrecedenceResult(distinctIds.get(0), "Single rule matched", List.of());
        }

        List<RegulatoryRule> rules = distinctIds.stream()
                .map(id -> ruleStore.findById(id)
                        .orElseThrow(() -> new NoSuchElementException("Rule not found: " + id)))
                .toList();

        for (RegulatoryRule rule : rules) {
            boolean overridden = distinctIds.stream()
                    .anyMatch(other -> !other.equals(rule.id()) && ruleGraph.overrides(other, rule.id()));
            if (overridden) {
                continue;
            }
            List<String> displaced = distinctIds.stream()
                    .filter(other -> !other.equals(rule.id()) && ruleGraph.overrides(rule.id(), other))
                    .toList();
            if (!displaced.isEmpty()) {
                return new PrecedenceResult(rule.id(), String.format(
                        "Lex specialis: rule %s (%s) overrides %d general rule(s)",
                        rule.id(), rule.conceptSlug(), displaced.size()), displaced);
            }
        }

        List<RegulatoryRule> byAuthority = rules.stream()
                .sorted(Comparator.comparingInt((RegulatoryRule rule) -> rule.authorityLevel().rank())
                        .thenComparing(MOST_RECENT_FIRST))
                .toList();
        RegulatoryRule top = byAuthority.get(0);
        RegulatoryRule runnerUp = byAuthority.get(1);
        if (top.authorityLevel() != runnerUp.authorityLevel()) {
            return new PrecedenceResult(top.id(), String.format("Authority: %s takes precedence over %s",
                    top.authorityLevel(), runnerUp.authorityLevel()), idsExcept(byAuthority, top));
        }

        List<RegulatoryRule> highest = byAuthority.stream()
                .filter(rule -> rule.authorityLevel() == top.authorityLevel())
                .sorted(MOST_RECENT_FIRST)
                .toList();
        RegulatoryRule winner = highest.get(0);
        String reasoning = winner.effectiveFrom() != null && !winner.effectiveFrom().equals(highest.get(1).effectiveFrom())
                ? String.format("Recency: rule effective from %s is most recent", winner.effectiveFrom())
                : String.format("Tiebreak: equal authority and effective date, %s is first by id", winner.id());
        return new PrecedenceResult(winner.id(), reasoning, idsExcept(byAuthority, winner));
    }

    private List<String> idsExcept(List<RegulatoryRule> rules, RegulatoryRule winner) {
        List<String> ids = new ArrayList<>();
        for (RegulatoryRule rule : rules) {
            if (!rule.id().equals(winner.id())) {
                ids.add(rule.id());
            }
        }
        return ids;
    }
}
