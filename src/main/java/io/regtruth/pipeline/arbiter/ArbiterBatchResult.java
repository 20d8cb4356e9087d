package io.regtruth.pipeline.arbiter;

import java.util.List;

public record ArbiterBatchResult(
        int processed,
        int resolved,
        int escalated,
        int failed,
        List<String> errors
) {
    public ArbiterBatchResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
