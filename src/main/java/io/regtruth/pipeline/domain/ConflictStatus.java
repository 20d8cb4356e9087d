package io.regtruth.pipeline.domain;

public enum ConflictStatus {
    OPEN,
    RESOLVED,
    ESCALATED
}
