package io.regtruth.pipeline.arbiter;

import io.regtruth.pipeline.domain.EscalationReason;

import java.util.Map;

/**
 * Fire-and-forget review requests for escalated conflicts.
 */
public interface HumanReviewService {

    void requestReview(String conflictId, EscalationReason reason, Map<String, Object> context);
}
