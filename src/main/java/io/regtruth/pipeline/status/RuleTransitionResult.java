package io.regtruth.pipeline.status;

import io.regtruth.pipeline.domain.RuleStatus;

public record RuleTransitionResult(
        String ruleId,
        boolean success,
        RuleStatus from,
        RuleStatus to,
        String error
) {}
