package io.regtruth.pipeline.status;

import java.util.List;

public record BatchTransitionResult(List<RuleTransitionResult> results) {

    public BatchTransitionResult {
        results = List.copyOf(results);
    }

    public long succeeded() {
        return results.stream().filter(RuleTransitionResult::success).count();
    }

    public long failed() {
        return results.size() - succeeded();
    }
}
