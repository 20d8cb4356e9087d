package io.regtruth.pipeline.domain;

public enum RuleStatus {
    DRAFT,
    PENDING_REVIEW,
    APPROVED,
    PUBLISHED,
    DEPRECATED,
    REJECTED;

    public boolean isTerminal() {
        return this == DEPRECATED;
    }
}
