package io.regtruth.pipeline.status;

import io.regtruth.pipeline.domain.RuleStatus;
import io.regtruth.pipeline.domain.SystemAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static io.regtruth.pipeline.domain.RuleStatus.APPROVED;
import static io.regtruth.pipeline.domain.RuleStatus.DEPRECATED;
import static io.regtruth.pipeline.domain.RuleStatus.DRAFT;
import static io.regtruth.pipeline.domain.RuleStatus.PENDING_REVIEW;
import static io.regtruth.pipeline.domain.RuleStatus.PUBLISHED;
import static io.regtruth.pipeline.domain.RuleStatus.REJECTED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleStatusGateTest {

    private final RuleStatusGate gate = new RuleStatusGate();

    @Test
    @DisplayName("Should allow the normal review flow")
    void shouldAllowNormalFlow() {
        assertThat(gate.check(DRAFT, PENDING_REVIEW, TransitionContext.none()).isAllowed()).isTrue();
        assertThat(gate.check(PENDING_REVIEW, APPROVED, TransitionContext.none()).isAllowed()).isTrue();
        assertThat(gate.check(PENDING_REVIEW, REJECTED, TransitionContext.none()).isAllowed()).isTrue();
        assertThat(gate.check(APPROVED, PUBLISHED, TransitionContext.of("release:2025-03")).isAllowed()).isTrue();
        assertThat(gate.check(PUBLISHED, DEPRECATED, TransitionContext.none()).isAllowed()).isTrue();
        assertThat(gate.check(REJECTED, DRAFT, TransitionContext.none()).isAllowed()).isTrue();
    }

    @Test
    @DisplayName("Should deny skipping review and list the allowed targets")
    void shouldDenySkippingReview() {
        TransitionDecision decision = gate.check(DRAFT, APPROVED, TransitionContext.none());

        assertThat(decision).isInstanceOfSatisfying(TransitionDecision.Denied.class, denied ->
                assertThat(denied.reason()).isEqualTo("Illegal status transition: DRAFT → APPROVED. Allowed: [PENDING_REVIEW]"));
    }

    @Test
    @DisplayName("Should require a source to publish")
    void shouldRequireSourceToPublish() {
        assertThat(gate.check(APPROVED, PUBLISHED, TransitionContext.none()))
                .isEqualTo(new TransitionDecision.Denied("Publishing requires explicit source context."));
        assertThat(gate.check(APPROVED, PUBLISHED, TransitionContext.of("  ")).isAllowed()).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = RuleStatus.class, names = "DEPRECATED", mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("Should never leave DEPRECATED")
    void shouldNeverLeaveDeprecated(RuleStatus target) {
        assertThat(gate.check(DEPRECATED, target, TransitionContext.of("ops")).isAllowed()).isFalse();
        assertThat(gate.allowedTargets(DEPRECATED)).isEmpty();
    }

    @Test
    @DisplayName("Should treat a same-status change as a no-op")
    void shouldAllowSameStatus() {
        assertThat(gate.check(DEPRECATED, DEPRECATED, TransitionContext.none()).isAllowed()).isTrue();
    }

    @Test
    @DisplayName("Should restrict quarantine to approved or published rules going back to review")
    void shouldRestrictQuarantine() {
        TransitionContext quarantine = TransitionContext.system(SystemAction.QUARANTINE_DOWNGRADE, "monitor:drift");

        assertThat(gate.check(PUBLISHED, PENDING_REVIEW, quarantine).isAllowed()).isTrue();
        assertThat(gate.check(APPROVED, PENDING_REVIEW, quarantine).isAllowed()).isTrue();
        assertThat(gate.check(DRAFT, PENDING_REVIEW, quarantine)).isEqualTo(new TransitionDecision.Denied(
                "QUARANTINE_DOWNGRADE does not allow DRAFT → PENDING_REVIEW. Only APPROVED/PUBLISHED → PENDING_REVIEW is permitted."));
        assertThat(gate.check(PUBLISHED, DRAFT, quarantine).isAllowed()).isFalse();
    }

    @Test
    @DisplayName("Should restrict rollback to published rules going back to approved")
    void shouldRestrictRollback() {
        TransitionContext rollback = TransitionContext.system(SystemAction.ROLLBACK, "release:revert");

        assertThat(gate.check(PUBLISHED, APPROVED, rollback).isAllowed()).isTrue();
        assertThat(gate.check(APPROVED, DRAFT, rollback).isAllowed()).isFalse();
        assertThat(gate.check(PENDING_REVIEW, APPROVED, rollback).isAllowed()).isFalse();
    }

    @Test
    @DisplayName("Should let conflict resolution deprecate any non-deprecated rule")
    void shouldAllowConflictSupersede() {
        TransitionContext supersede = TransitionContext.system(SystemAction.CONFLICT_SUPERSEDE, "arbiter:c-1");

        assertThat(gate.check(DRAFT, DEPRECATED, supersede).isAllowed()).isTrue();
        assertThat(gate.check(APPROVED, DEPRECATED, supersede).isAllowed()).isTrue();
        assertThat(gate.check(APPROVED, REJECTED, supersede).isAllowed()).isFalse();
    }

    @Test
    @DisplayName("Should require a source for every system action")
    void shouldRequireSourceForSystemActions() {
        assertThat(gate.check(PUBLISHED, APPROVED, TransitionContext.system(SystemAction.ROLLBACK, null)))
                .isEqualTo(new TransitionDecision.Denied("System action ROLLBACK requires a source"));
    }

    @Test
    @SuppressWarnings("deprecation")
    @DisplayName("Should never let the bypass flag approve or publish")
    void shouldLimitBypass() {
        assertThat(gate.check(PENDING_REVIEW, APPROVED, TransitionContext.bypass("script")).isAllowed()).isFalse();
        assertThat(gate.check(APPROVED, PUBLISHED, TransitionContext.bypass("script")).isAllowed()).isFalse();
        assertThat(gate.check(PUBLISHED, PENDING_REVIEW, TransitionContext.bypass("script")).isAllowed()).isTrue();
        assertThat(gate.check(PUBLISHED, APPROVED, TransitionContext.bypass("legacy-rollback")).isAllowed()).isTrue();
        assertThat(gate.check(PUBLISHED, PENDING_REVIEW, TransitionContext.bypass(null)).isAllowed()).isFalse();
        assertThat(gate.check(DRAFT, REJECTED, TransitionContext.bypass("script")).isAllowed()).isFalse();
    }

    @Test
    @DisplayName("Should throw with the attempted transition when enforcing a denial")
    void shouldThrowOnEnforce() {
        assertThatThrownBy(() -> gate.enforce("rule-1", DRAFT, PUBLISHED, TransitionContext.of("release")))
                .isInstanceOfSatisfying(IllegalStatusTransitionException.class, e -> {
                    assertThat(e.getRuleId()).isEqualTo("rule-1");
                    assertThat(e.getFrom()).isEqualTo(DRAFT);
                    assertThat(e.getTo()).isEqualTo(PUBLISHED);
                    assertThat(e.getMessage()).endsWith("(rule rule-1)");
                });
    }
}
