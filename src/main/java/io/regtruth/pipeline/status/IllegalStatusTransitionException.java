package io.regtruth.pipeline.status;

import io.regtruth.pipeline.domain.RuleStatus;

public class IllegalStatusTransitionException extends RuntimeException {
    private final String ruleId;
    private final RuleStatus from;
    private final RuleStatus to;

    public IllegalStatusTransitionException(String ruleId, RuleStatus from, RuleStatus to, String reason) {
        super(reason + " (rule " + ruleId + ")");
        this.ruleId = ruleId;
        this.from = from;
        this.to = to;
    }

    public String getRuleId() {
        return ruleId;
    }

    public RuleStatus getFrom() {
        return from;
    }

    public RuleStatus getTo() {
        return to;
    }
}
