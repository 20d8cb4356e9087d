package io.regtruth.pipeline.store.memory;

import io.regtruth.pipeline.domain.RegulatoryRule;
import io.regtruth.pipeline.domain.RuleStatus;
import io.regtruth.pipeline.domain.SourcePointer;
import io.regtruth.pipeline.store.BulkStatusUpdateNotAllowedException;
import io.regtruth.pipeline.store.RulePatch;
import io.regtruth.pipeline.store.RuleStore;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryRuleStore implements RuleStore {

    private final Map<String, RegulatoryRule> rules = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRuleStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public RegulatoryRule create(RegulatoryRule rule) {
        if (rules.putIfAbsent(rule.id(), rule) != null) {
            throw new IllegalArgumentException("Rule already exists: " + rule.id());
        }
        return rule;
    }

    @Override
    public Optional<RegulatoryRule> findById(String id) {
        return Optional.ofNullable(rules.get(id));
    }

    @Override
    public List<RegulatoryRule> findByConceptSlug(String conceptSlug, Set<RuleStatus> statuses) {
        return rules.values().stream()
                .filter(rule -> rule.conceptSlug().equals(conceptSlug))
                .filter(rule -> statuses.contains(rule.status()))
                .sorted(Comparator.comparing(RegulatoryRule::id))
                .toList();
    }

    @Override
    public List<RegulatoryRule> findAll() {
        return rules.values().stream()
                .sorted(Comparator.comparing(RegulatoryRule::id))
                .toList();
    }

    @Override
    public List<SourcePointer> findSourcePointers(Collection<String> pointerIds) {
        Set<String> wanted = Set.copyOf(pointerIds);
        return rules.values().stream()
                .flatMap(rule -> rule.sourcePointers().stream())
                .filter(pointer -> wanted.contains(pointer.id()))
                .collect(Collectors.toMap(SourcePointer::id, pointer -> pointer, (a, b) -> a))
                .values().stream()
                .sorted(Comparator.comparing(SourcePointer::id))
                .toList();
    }

    @Override
    public boolean compareAndSetStatus(String id, RuleStatus expectedStatus, RegulatoryRule updated) {
        boolean[] applied = {false};
        rules.computeIfPresent(id, (key, current) -> {
            if (current.status() != expectedStatus) {
                return current;
            }
            applied[0] = true;
            return updated;
        });
        return applied[0];
    }

    @Override
    public int updateMany(Collection<String> ids, RulePatch patch) {
        if (patch.touchesStatus()) {
            throw new BulkStatusUpdateNotAllowedException();
        }
        int updated = 0;
        for (String id : ids) {
            RegulatoryRule result = rules.computeIfPresent(id, (key, rule) -> rule.withContent(
                    patch.title() != null ? patch.title() : rule.title(),
                    patch.value() != null ? patch.value() : rule.value(),
                    patch.confidence() != null ? patch.confidence() : rule.confidence(),
                    patch.reviewerNotes() != null ? patch.reviewerNotes() : rule.reviewerNotes(),
                    clock.instant()));
            if (result != null) {
                updated++;
            }
        }
        return updated;
    }
}
