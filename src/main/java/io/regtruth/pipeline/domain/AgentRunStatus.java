package io.regtruth.pipeline.domain;

public enum AgentRunStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
