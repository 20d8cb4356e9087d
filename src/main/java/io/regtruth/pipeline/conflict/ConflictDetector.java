package io.regtruth.pipeline.conflict;

import io.regtruth.pipeline.audit.AuditLog;
import io.regtruth.pipeline.domain.ConflictType;
import io.regtruth.pipeline.domain.RegulatoryConflict;
import io.regtruth.pipeline.domain.RegulatoryRule;
import io.regtruth.pipeline.domain.RuleStatus;
import io.regtruth.pipeline.store.ConflictStore;
import io.regtruth.pipeline.store.RuleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.UUID;

/**
 * Structural conflicts between a candidate rule and the non-terminal rules for the same
 * concept. Disjoint effective windows never conflict.
 */
@Service
public class ConflictDetector {

    private static final Logger logger = LoggerFactory.getLogger(ConflictDetector.class);

    private static final Set<RuleStatus> COMPARABLE_STATUSES = EnumSet.of(
            RuleStatus.DRAFT, RuleStatus.PENDING_REVIEW, RuleStatus.APPROVED, RuleStatus.PUBLISHED);

    private final RuleStore ruleStore;
    private final ConflictStore conflictStore;
    private final ValueNormalizer valueNormalizer;
    private final AuditLog auditLog;
    private final Clock clock;

    public ConflictDetector(RuleStore ruleStore,
                            ConflictStore conflictStore,
                            ValueNormalizer valueNormalizer,
                            AuditLog auditLog,
                            Clock clock) {
        this.ruleStore = ruleStore;
        this.conflictStore = conflictStore;
        this.valueNormalizer = valueNormalizer;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    public List<ConflictSeed> detectStructuralConflicts(RegulatoryRule candidate) {
        List<ConflictSeed> seeds = new ArrayList<>();
        EffectiveWindow candidateWindow = EffectiveWindow.of(candidate);

        for (RegulatoryRule existing : ruleStore.findByConceptSlug(candidate.conceptSlug(), COMPARABLE_STATUSES)) {
            if (existing.id().equals(candidate.id())) {
                continue;
            }
            if (!candidateWindow.overlaps(EffectiveWindow.of(existing))) {
                continue;
            }

            if (valueNormalizer.differ(candidate.value(), existing.value())) {
                seeds.add(new ConflictSeed(ConflictType.VALUE_MISMATCH, existing.id(), candidate.id(),
                        String.format("Value mismatch for %s: existing %s has '%s', new %s has '%s' with overlapping effective dates",
                                candidate.conceptSlug(), existing.id(), existing.value(), candidate.id(), candidate.value())));
            }

            if (candidate.authorityLevel().outranks(existing.authorityLevel())) {
                seeds.add(new ConflictSeed(ConflictType.AUTHORITY_SUPERSEDE, existing.id(), candidate.id(),
                        String.format("New %s rule %s may supersede %s rule %s for %s",
                                candidate.authorityLevel(), candidate.id(), existing.authorityLevel(), existing.id(),
                                candidate.conceptSlug())));
            }
        }

        if (!seeds.isEmpty()) {
            logger.info("Detected {} structural conflict(s) for rule {} ({})", seeds.size(), candidate.id(), candidate.conceptSlug());
        }
        return seeds;
    }

    /**
     * Persist seeds as OPEN conflicts. A pair that already has an OPEN conflict, in either
     * orientation, is skipped.
     *
     * @return number of conflicts created
     */
    public int seedConflicts(List<ConflictSeed> seeds) {
        int created = 0;
        for (ConflictSeed seed : seeds) {
            RegulatoryConflict conflict = RegulatoryConflict.open(
                    UUID.randomUUID().toString(),
                    seed.type(),
                    seed.existingRuleId(),
                    seed.newRuleId(),
                    List.of(),
                    seed.description(),
                    clock.instant());

            var stored = conflictStore.createIfNoOpen(conflict);
            if (stored.isEmpty()) {
                logger.debug("Open conflict already exists for {} / {}", seed.existingRuleId(), seed.newRuleId());
                continue;
            }
            created++;
            auditLog.logEvent("CONFLICT_CREATED", "CONFLICT", conflict.id(), Map.of(
                    "conflictType", seed.type().name(),
                    "itemAId", seed.existingRuleId(),
                    "itemBId", seed.newRuleId()));
        }
        return created;
    }

    /**
     * Detect and seed conflicts for a stored rule.
     */
    public int detectAndSeed(String ruleId) {
        RegulatoryRule rule = ruleStore.findById(ruleId)
                .orElseThrow(() -> new NoSuchElementException("Rule not found: " + ruleId));
        return seedConflicts(detectStructuralConflicts(rule));
    }
}
