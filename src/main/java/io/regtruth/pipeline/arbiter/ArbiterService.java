package io.regtruth.pipeline.arbiter;

import io.regtruth.pipeline.agent.AgentInvocationException;
import io.regtruth.pipeline.agent.AgentInvoker;
import io.regtruth.pipeline.audit.AuditLog;
import io.regtruth.pipeline.config.ArbiterConfig;
import io.regtruth.pipeline.config.PipelineConfig;
import io.regtruth.pipeline.domain.AgentType;
import io.regtruth.pipeline.domain.ArbiterResolution;
import io.regtruth.pipeline.domain.ConflictResolution;
import io.regtruth.pipeline.domain.ConflictStatus;
import io.regtruth.pipeline.domain.ConflictType;
import io.regtruth.pipeline.domain.EscalationReason;
import io.regtruth.pipeline.domain.RegulatoryConflict;
import io.regtruth.pipeline.domain.RegulatoryRule;
import io.regtruth.pipeline.domain.ResolutionStrategy;
import io.regtruth.pipeline.domain.SourcePointer;
import io.regtruth.pipeline.status.RuleStatusService;
import io.regtruth.pipeline.store.ConflictStore;
import io.regtruth.pipeline.store.RuleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves OPEN conflicts. Rule pairs go through the deterministic ladder first and the
 * arbiter model second; escalation rules are applied on top of whatever the model says.
 * Source-level conflicts are never auto-resolved.
 */
@Service
public class ArbiterService {

    private static final Logger logger = LoggerFactory.getLogger(ArbiterService.class);

    static final String INSUFFICIENT_POINTERS = "Insufficient pointers for conflict";
    static final String SOURCE_CONFLICT_REVIEW_REASON =
            "SOURCE_CONFLICT detected - conflicting values in source data require human review to determine correct value";
    static final String BUSINESS_RULE_REVIEW_REASON = "Escalated by business rules";

    private final ConflictStore conflictStore;
    private final RuleStore ruleStore;
    private final DeterministicResolver deterministicResolver;
    private final EscalationPolicy escalationPolicy;
    private final AgentInvoker agentInvoker;
    private final ArbiterOutputValidator outputValidator;
    private final RuleStatusService ruleStatusService;
    private final HumanReviewService humanReviewService;
    private final AuditLog auditLog;
    private final ArbiterConfig config;
    private final Clock clock;

    public ArbiterService(ConflictStore conflictStore,
                          RuleStore ruleStore,
                          DeterministicResolver deterministicResolver,
                          EscalationPolicy escalationPolicy,
                          AgentInvoker agentInvoker,
                          ArbiterOutputValidator outputValidator,
                          RuleStatusService ruleStatusService,
                          HumanReviewService humanReviewService,
                          AuditLog auditLog,
                          PipelineConfig pipelineConfig,
                          Clock clock) {
        this.conflictStore = conflictStore;
        this.ruleStore = ruleStore;
        this.deterministicResolver = deterministicResolver;
        this.escalationPolicy = escalationPolicy;
        this.agentInvoker = agentInvoker;
        this.outputValidator = outputValidator;
        this.ruleStatusService = ruleStatusService;
        this.humanReviewService = humanReviewService;
        this.auditLog = auditLog;
        this.config = pipelineConfig.arbiter();
        this.clock = clock;
    }

    public ArbiterResult arbitrate(String conflictId) {
        Optional<RegulatoryConflict> found = conflictStore.findById(conflictId);
        if (found.isEmpty()) {
            return ArbiterResult.failure(conflictId, "Conflict not found: " + conflictId);
        }
        RegulatoryConflict conflict = found.get();
        if (conflict.status() != ConflictStatus.OPEN) {
            return ArbiterResult.failure(conflictId, "Conflict " + conflictId + " is " + conflict.status() + ", not OPEN");
        }

        if (conflict.conflictType() == ConflictType.SOURCE_CONFLICT) {
            return handleSourceConflict(conflict);
        }

        Optional<RegulatoryRule> ruleA = conflict.itemAId() != null ? ruleStore.findById(conflict.itemAId()) : Optional.empty();
        Optional<RegulatoryRule> ruleB = conflict.itemBId() != null ? ruleStore.findById(conflict.itemBId()) : Optional.empty();
        if (ruleA.isEmpty() || ruleB.isEmpty()) {
            return ArbiterResult.failure(conflictId, "One or both conflicting rules not found for conflict: " + conflictId);
        }

        return arbitrateRules(conflict, ruleA.get(), ruleB.get());
    }

    /**
     * Oldest OPEN conflicts first. A failing conflict is counted and skipped.
     */
    public ArbiterBatchResult runArbiterBatch(int limit) {
        List<RegulatoryConflict> conflicts = conflictStore.findOpen(limit);
        int processed = 0;
        int resolved = 0;
        int escalated = 0;
        int failed = 0;
        List<String> errors = new ArrayList<>();

        for (RegulatoryConflict conflict : conflicts) {
            logger.debug("Arbitrating conflict {} ({})", conflict.id(), conflict.conflictType());
            processed++;
            try {
                ArbiterResult result = arbitrate(conflict.id());
                if (!result.success()) {
                    failed++;
                    errors.add(conflict.id() + ": " + result.error());
                } else if (result.escalated()) {
                    escalated++;
                } else {
                    resolved++;
                }
            } catch (RuntimeException e) {
                failed++;
                errors.add(conflict.id() + ": " + e.getMessage());
                logger.error("Unexpected failure arbitrating conflict {}", conflict.id(), e);
            }
        }

        logger.info("Arbiter batch complete: {} processed, {} resolved, {} escalated, {} failed",
                processed, resolved, escalated, failed);
        return new ArbiterBatchResult(processed, resolved, escalated, failed, errors);
    }

    private ArbiterResult handleSourceConflict(RegulatoryConflict conflict) {
        List<SourcePointer> pointers = conflict.sourcePointerIds().isEmpty()
                ? List.of()
                : ruleStore.findSourcePointers(conflict.sourcePointerIds());

        if (pointers.size() < 2) {
            ConflictResolution resolution = new ConflictResolution(null, ResolutionStrategy.AUTO_RESOLVED,
                    INSUFFICIENT_POINTERS, null);
            if (!conflictStore.compareAndSet(conflict.id(), ConflictStatus.OPEN,
                    conflict.resolved(resolution, null, clock.instant()))) {
                return concurrentChange(conflict.id());
            }
            auditLog.logEvent("CONFLICT_RESOLVED", "CONFLICT", conflict.id(), Map.of(
                    "conflictType", ConflictType.SOURCE_CONFLICT.name(),
                    "strategy", ResolutionStrategy.AUTO_RESOLVED.wireName(),
                    "pointerCount", pointers.size()));
            logger.info("Source conflict {} closed: {} resolvable pointer(s)", conflict.id(), pointers.size());
            return ArbiterResult.success(conflict.id(), null, null);
        }

        ConflictResolution resolution = new ConflictResolution(null, null,
                "Conflicting values found in source data", ArbiterResolution.ESCALATE_TO_HUMAN);
        if (!conflictStore.compareAndSet(conflict.id(), ConflictStatus.OPEN,
                conflict.escalated(resolution, null, SOURCE_CONFLICT_REVIEW_REASON, clock.instant()))) {
            return concurrentChange(conflict.id());
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("conflictType", ConflictType.SOURCE_CONFLICT.name());
        Map<String, Object> pointerValues = new LinkedHashMap<>();
        pointers.forEach(pointer -> pointerValues.put(pointer.id(), String.valueOf(pointer.extractedValue())));
        context.put("pointerValues", pointerValues);
        humanReviewService.requestReview(conflict.id(), EscalationReason.SOURCE_DATA_CONFLICT, context);

        auditLog.logEvent("CONFLICT_ESCALATED", "CONFLICT", conflict.id(), Map.of(
                "conflictType", ConflictType.SOURCE_CONFLICT.name(),
                "pointerCount", pointers.size(),
                "reason", "Conflicting source pointer values require human review"));
        logger.info("Source conflict {} escalated with {} pointers", conflict.id(), pointers.size());
        return ArbiterResult.success(conflict.id(), ArbiterResolution.ESCALATE_TO_HUMAN, null);
    }

    private ArbiterResult arbitrateRules(RegulatoryConflict conflict, RegulatoryRule ruleA, RegulatoryRule ruleB) {
        DeterministicResolution deterministic = deterministicResolver.tryResolve(ruleA, ruleB);

        if (deterministic.canAutoApply() && !escalationPolicy.hasLowConfidenceRule(ruleA, ruleB)) {
            ArbiterResolution resolution = deterministic.winnerId().equals(ruleA.id())
                    ? ArbiterResolution.RULE_A_PREVAILS
                    : ArbiterResolution.RULE_B_PREVAILS;
            ConflictResolution conflictResolution = new ConflictResolution(deterministic.winnerId(),
                    deterministic.strategy(), deterministic.reason(), resolution);
            logger.info("Conflict {} pre-resolved deterministically: {}", conflict.id(), deterministic.reason());
            return applyResolution(conflict, conflictResolution, 1.0, deterministic.loserId(), true);
        }

        String recommendation = deterministic.recommendationOnly() && deterministic.resolved()
                ? deterministic.reason()
                : null;
        ArbiterInput input = new ArbiterInput(conflict.id(), conflict.conflictType().name(),
                List.of(toItem(ruleA), toItem(ruleB)), recommendation);

        Arbitration arbitration;
        try {
            arbitration = agentInvoker.invoke(AgentType.ARBITER, input, config.temperature(), conflict.id(),
                    outputValidator);
        } catch (AgentInvocationException e) {
            logger.warn("Arbitration of conflict {} failed, leaving it OPEN: {}", conflict.id(), e.getMessage());
            return ArbiterResult.failure(conflict.id(), e.getMessage());
        }

        ArbiterResolution resolution;
        if (arbitration.requiresHumanReview()) {
            resolution = ArbiterResolution.ESCALATE_TO_HUMAN;
        } else if (arbitration.winningItemId().equals(ruleA.id())) {
            resolution = ArbiterResolution.RULE_A_PREVAILS;
        } else if (arbitration.winningItemId().equals(ruleB.id())) {
            resolution = ArbiterResolution.RULE_B_PREVAILS;
        } else {
            resolution = ArbiterResolution.ESCALATE_TO_HUMAN;
        }

        boolean businessEscalation = escalationPolicy.shouldEscalate(ruleA, ruleB, arbitration);
        if (businessEscalation) {
            resolution = ArbiterResolution.ESCALATE_TO_HUMAN;
        }

        ConflictResolution conflictResolution = new ConflictResolution(arbitration.winningItemId(),
                arbitration.strategy(), arbitration.rationaleHr(), resolution);

        if (resolution == ArbiterResolution.ESCALATE_TO_HUMAN) {
            String reviewReason = arbitration.humanReviewReason() != null
                    ? arbitration.humanReviewReason()
                    : BUSINESS_RULE_REVIEW_REASON;
            return escalate(conflict, ruleA, ruleB, arbitration, conflictResolution, reviewReason);
        }

        String loserId = resolution == ArbiterResolution.RULE_A_PREVAILS ? ruleB.id() : ruleA.id();
        ArbiterResult result = applyResolution(conflict, conflictResolution, arbitration.confidence(), loserId, false);
        return result.success() ? ArbiterResult.success(conflict.id(), resolution, arbitration) : result;
    }

    private ArbiterResult applyResolution(RegulatoryConflict conflict, ConflictResolution resolution,
                                          double confidence, String loserId, boolean deterministic) {
        if (!conflictStore.compareAndSet(conflict.id(), ConflictStatus.OPEN,
                conflict.resolved(resolution, confidence, clock.instant()))) {
            return concurrentChange(conflict.id());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("resolution", resolution.resolution().name());
        metadata.put("strategy", resolution.strategy() != null ? resolution.strategy().wireName() : "");
        metadata.put("confidence", confidence);
        metadata.put("deterministic", deterministic);
        auditLog.logEvent("CONFLICT_RESOLVED", "CONFLICT", conflict.id(), metadata);

        try {
            ruleStatusService.deprecateSuperseded(loserId, resolution.winningItemId(), conflict.id(), resolution.rationale());
        } catch (RuntimeException e) {
            logger.error("Conflict {} resolved but deprecating losing rule {} failed: {}",
                    conflict.id(), loserId, e.getMessage());
            return ArbiterResult.failure(conflict.id(), "Losing rule " + loserId + " not deprecated: " + e.getMessage());
        }

        logger.info("Conflict {} resolved: {} ({} deprecated)", conflict.id(), resolution.resolution(), loserId);
        return ArbiterResult.success(conflict.id(), resolution.resolution(), null);
    }

    private ArbiterResult escalate(RegulatoryConflict conflict, RegulatoryRule ruleA, RegulatoryRule ruleB,
                                   Arbitration arbitration, ConflictResolution resolution, String reviewReason) {
        if (!conflictStore.compareAndSet(conflict.id(), ConflictStatus.OPEN,
                conflict.escalated(resolution, arbitration.confidence(), reviewReason, clock.instant()))) {
            return concurrentChange(conflict.id());
        }

        EscalationReason reason = escalationPolicy.reasonFor(ruleA, ruleB, arbitration.confidence());
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("conflictType", conflict.conflictType().name());
        context.put("ruleATier", ruleA.riskTier().name());
        context.put("ruleBTier", ruleB.riskTier().name());
        context.put("confidence", arbitration.confidence());
        humanReviewService.requestReview(conflict.id(), reason, context);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("resolution", ArbiterResolution.ESCALATE_TO_HUMAN.name());
        metadata.put("strategy", arbitration.strategy().wireName());
        metadata.put("confidence", arbitration.confidence());
        metadata.put("escalationReason", reason.name());
        auditLog.logEvent("CONFLICT_ESCALATED", "CONFLICT", conflict.id(), metadata);

        logger.info("Conflict {} escalated to human review ({}): {}", conflict.id(), reason, reviewReason);
        return ArbiterResult.success(conflict.id(), ArbiterResolution.ESCALATE_TO_HUMAN, arbitration);
    }

    private ArbiterResult concurrentChange(String conflictId) {
        logger.warn("Conflict {} changed concurrently, skipping", conflictId);
        return ArbiterResult.failure(conflictId, "Conflict " + conflictId + " is no longer OPEN");
    }

    private ConflictingItem toItem(RegulatoryRule rule) {
        String sources = rule.sourcePointers().stream()
                .map(pointer -> String.format("\"%s\" (evidence %s, confidence: %s)",
                        pointer.exactQuote(), pointer.evidenceId(), pointer.confidence()))
                .collect(Collectors.joining("; "));

        String claim = String.join("\n",
                "Rule: " + rule.title(),
                "Value: " + rule.value() + " (" + rule.valueType() + ")",
                "Authority Level: " + rule.authorityLevel(),
                "Effective: " + rule.effectiveFrom() + " to "
                        + (rule.effectiveUntil() != null ? rule.effectiveUntil() : "indefinite"),
                "Source Evidence: " + (sources.isEmpty() ? "none" : sources));
        return new ConflictingItem(rule.id(), "rule", claim);
    }
}
