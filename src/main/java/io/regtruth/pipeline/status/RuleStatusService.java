package io.regtruth.pipeline.status;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.regtruth.pipeline.audit.AuditLog;
import io.regtruth.pipeline.domain.RegulatoryRule;
import io.regtruth.pipeline.domain.RuleStatus;
import io.regtruth.pipeline.domain.SystemAction;
import io.regtruth.pipeline.store.RuleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Single write path for rule status. Every change is checked by {@link RuleStatusGate},
 * applied with a compare-and-set on the previous status and audited.
 */
@Service
public class RuleStatusService {

    private static final Logger logger = LoggerFactory.getLogger(RuleStatusService.class);

    private final RuleStore ruleStore;
    private final RuleStatusGate gate;
    private final AuditLog auditLog;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RuleStatusService(RuleStore ruleStore, RuleStatusGate gate, AuditLog auditLog,
                             ObjectMapper objectMapper, Clock clock) {
        this.ruleStore = ruleStore;
        this.gate = gate;
        this.auditLog = auditLog;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public RegulatoryRule transition(String ruleId, RuleStatus target, TransitionContext context) {
        return transition(ruleId, target, context, null);
    }

    /**
     * @throws NoSuchElementException           if the rule does not exist
     * @throws IllegalStatusTransitionException if the gate rejects the change
     * @throws ConcurrentModificationException  if the rule's status changed underneath
     */
    public RegulatoryRule transition(String ruleId, RuleStatus target, TransitionContext context, String reviewerNotes) {
        RegulatoryRule rule = ruleStore.findById(ruleId)
                .orElseThrow(() -> new NoSuchElementException("Rule not found: " + ruleId));
        RuleStatus from = rule.status();
        if (from == target) {
            return rule;
        }

        gate.enforce(ruleId, from, target, context);

        RegulatoryRule updated = rule.withStatus(target, reviewerNotes, clock.instant());
        if (!ruleStore.compareAndSetStatus(ruleId, from, updated)) {
            throw new ConcurrentModificationException("Rule " + ruleId + " changed status concurrently; expected " + from);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("from", from.name());
        metadata.put("to", target.name());
        metadata.put("source", context.source() != null ? context.source() : "");
        if (context.systemAction() != null) {
            metadata.put("systemAction", context.systemAction().name());
        }
        auditLog.logEvent("RULE_STATUS_CHANGED", "RULE", ruleId, metadata);

        logger.info("Rule {} status {} → {} (source: {})", ruleId, from, target, context.source());
        return updated;
    }

    /**
     * Publish APPROVED rules. Each rule succeeds or fails on its own.
     */
    public BatchTransitionResult publishRules(List<String> ruleIds, String source) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Publishing requires explicit source context.");
        }
        return applyToEach(ruleIds, RuleStatus.APPROVED, RuleStatus.PUBLISHED, TransitionContext.of(source));
    }

    /**
     * Roll PUBLISHED rules back to APPROVED.
     */
    public BatchTransitionResult revertRules(List<String> ruleIds, String source) {
        return applyToEach(ruleIds, RuleStatus.PUBLISHED, RuleStatus.APPROVED,
                TransitionContext.system(SystemAction.ROLLBACK, source));
    }

    /**
     * Send APPROVED or PUBLISHED rules back to review.
     */
    public BatchTransitionResult quarantineRules(List<String> ruleIds, String source) {
        return applyToEach(ruleIds, null, RuleStatus.PENDING_REVIEW,
                TransitionContext.system(SystemAction.QUARANTINE_DOWNGRADE, source));
    }

    /**
     * Deprecate the losing rule of a resolved conflict, recording why in its reviewer notes.
     */
    public RegulatoryRule deprecateSuperseded(String loserRuleId, String winnerRuleId, String conflictId, String rationale) {
        Map<String, Object> notes = new LinkedHashMap<>();
        notes.put("deprecated_reason", "Superseded by conflict resolution");
        notes.put("conflict_id", conflictId);
        notes.put("superseded_by", winnerRuleId);
        notes.put("arbiter_rationale", rationale);

        return transition(loserRuleId, RuleStatus.DEPRECATED,
                TransitionContext.system(SystemAction.CONFLICT_SUPERSEDE, "arbiter:" + conflictId),
                toJson(notes));
    }

    private BatchTransitionResult applyToEach(List<String> ruleIds, RuleStatus requiredStatus, RuleStatus target,
                                              TransitionContext context) {
        List<RuleTransitionResult> results = new ArrayList<>();
        for (String ruleId : ruleIds) {
            RuleStatus from = ruleStore.findById(ruleId).map(RegulatoryRule::status).orElse(null);
            try {
                if (from == null) {
                    throw new NoSuchElementException("Rule not found: " + ruleId);
                }
                if (requiredStatus != null && from != requiredStatus) {
                    throw new IllegalStatusTransitionException(ruleId, from, target,
                            "Rule must be " + requiredStatus + " but is " + from);
                }
                transition(ruleId, target, context);
                results.add(new RuleTransitionResult(ruleId, true, from, target, null));
            } catch (RuntimeException e) {
                logger.warn("Status change of rule {} to {} failed: {}", ruleId, target, e.getMessage());
                results.add(new RuleTransitionResult(ruleId, false, from, target, e.getMessage()));
            }
        }
        BatchTransitionResult result = new BatchTransitionResult(results);
        logger.info("Batch change to {}: {} succeeded, {} failed (source: {})",
                target, result.succeeded(), result.failed(), context.source());
        return result;
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize reviewer notes: {}", e.getMessage());
            return value.toString();
        }
    }
}
