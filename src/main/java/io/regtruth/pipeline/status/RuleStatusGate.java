package io.regtruth.pipeline.status;

import io.regtruth.pipeline.domain.RuleStatus;
import io.regtruth.pipeline.domain.SystemAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static io.regtruth.pipeline.domain.RuleStatus.*;

/**
 * The only definition of which rule status changes are legal.
 * <p>
 * Normal flow: DRAFT → PENDING_REVIEW → APPROVED → PUBLISHED → DEPRECATED, with
 * PENDING_REVIEW able to reject or return to DRAFT and APPROVED able to go back to review.
 * System actions open a few extra edges, each restricted to specific statuses.
 */
@Component
public class RuleStatusGate {

    private static final Logger logger = LoggerFactory.getLogger(RuleStatusGate.class);

    private static final Map<RuleStatus, Set<RuleStatus>> ALLOWED = new EnumMap<>(RuleStatus.class);

    static {
        ALLOWED.put(DRAFT, EnumSet.of(PENDING_REVIEW));
        ALLOWED.put(PENDING_REVIEW, EnumSet.of(APPROVED, REJECTED, DRAFT));
        ALLOWED.put(APPROVED, EnumSet.of(PUBLISHED, PENDING_REVIEW));
        ALLOWED.put(PUBLISHED, EnumSet.of(DEPRECATED));
        ALLOWED.put(DEPRECATED, EnumSet.noneOf(RuleStatus.class));
        ALLOWED.put(REJECTED, EnumSet.of(DRAFT));
    }

    public Set<RuleStatus> allowedTargets(RuleStatus from) {
        return EnumSet.copyOf(ALLOWED.get(from));
    }

    public TransitionDecision check(RuleStatus from, RuleStatus to, TransitionContext context) {
        if (from == to) {
            return new TransitionDecision.Allowed();
        }
        if (context.systemAction() != null) {
            return checkSystemAction(from, to, context);
        }
        if (context.bypassApproval()) {
            TransitionDecision bypass = checkBypass(from, to, context);
            if (bypass != null) {
                return bypass;
            }
        }

        if (!ALLOWED.get(from).contains(to)) {
            return new TransitionDecision.Denied(
                    "Illegal status transition: " + from + " → " + to + ". Allowed: " + ALLOWED.get(from));
        }
        if (to == PUBLISHED && !context.hasSource()) {
            return new TransitionDecision.Denied("Publishing requires explicit source context.");
        }
        return new TransitionDecision.Allowed();
    }

    /**
     * @throws IllegalStatusTransitionException when the transition is not allowed
     */
    public void enforce(String ruleId, RuleStatus from, RuleStatus to, TransitionContext context) {
        if (check(from, to, context) instanceof TransitionDecision.Denied denied) {
            logger.warn("Blocked status change of rule {}: {} → {} (source: {}, action: {}): {}",
                    ruleId, from, to, context.source(), context.systemAction(), denied.reason());
            throw new IllegalStatusTransitionException(ruleId, from, to, denied.reason());
        }
    }

    private TransitionDecision checkSystemAction(RuleStatus from, RuleStatus to, TransitionContext context) {
        SystemAction action = context.systemAction();
        if (!context.hasSource()) {
            return new TransitionDecision.Denied("System action " + action + " requires a source");
        }
        boolean permitted = switch (action) {
            case QUARANTINE_DOWNGRADE -> (from == APPROVED || from == PUBLISHED) && to == PENDING_REVIEW;
            case ROLLBACK -> from == PUBLISHED && to == APPROVED;
            case CONFLICT_SUPERSEDE -> !from.isTerminal() && to == DEPRECATED;
        };
        if (!permitted) {
            String allowed = switch (action) {
                case QUARANTINE_DOWNGRADE -> "APPROVED/PUBLISHED → PENDING_REVIEW";
                case ROLLBACK -> "PUBLISHED → APPROVED";
                case CONFLICT_SUPERSEDE -> "non-deprecated → DEPRECATED";
            };
            return new TransitionDecision.Denied(
                    action + " does not allow " + from + " → " + to + ". Only " + allowed + " is permitted.");
        }
        return new TransitionDecision.Allowed();
    }

    /**
     * @return a decision, or null to continue with the normal table
     */
    private TransitionDecision checkBypass(RuleStatus from, RuleStatus to, TransitionContext context) {
        if (!context.hasSource()) {
            return new TransitionDecision.Denied("bypassApproval requires a source");
        }
        if (to == APPROVED) {
            if (from == PUBLISHED && context.source().toLowerCase(Locale.ROOT).contains("rollback")) {
                logger.warn("Deprecated rollback via bypassApproval (source: {}); use SystemAction.ROLLBACK",
                        context.source());
                return new TransitionDecision.Allowed();
            }
            return new TransitionDecision.Denied(
                    "bypassApproval cannot be used for approval. Use the review flow, or SystemAction.ROLLBACK to revert a published rule.");
        }
        if (to == PUBLISHED) {
            return new TransitionDecision.Denied(
                    "bypassApproval cannot be used for publishing. Publishing requires normal approval flow.");
        }
        if (to == PENDING_REVIEW && (from == APPROVED || from == PUBLISHED)) {
            return new TransitionDecision.Allowed();
        }
        return null;
    }
}
