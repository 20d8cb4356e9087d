package io.regtruth.pipeline.domain;

import java.time.Duration;
import java.time.Instant;

public record AgentRun(
        String id,
        AgentType agentType,
        AgentRunStatus status,
        Instant startedAt,
        Instant completedAt,
        Long durationMs,
        int attempts,
        String error,
        String evidenceId,
        String ruleId,
        String conflictId
) {
    public static AgentRun finished(String id, AgentType type, boolean success, Instant startedAt,
                                    Instant completedAt, int attempts, String error, String conflictId) {
        return new AgentRun(id, type, success ? AgentRunStatus.COMPLETED : AgentRunStatus.FAILED,
                startedAt, completedAt, Duration.between(startedAt, completedAt).toMillis(), attempts, error,
                null, null, conflictId);
    }
}
