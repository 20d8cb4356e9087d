package io.regtruth.pipeline.arbiter;

import java.util.List;

public record PrecedenceResult(
        String winningRuleId,
        String reasoning,
        List<String> overriddenRuleIds
) {
    public PrecedenceResult {
        overriddenRuleIds = overriddenRuleIds != null ? List.copyOf(overriddenRuleIds) : List.of();
    }
}
