package io.regtruth.pipeline.domain;

public enum ArbiterResolution {
    RULE_A_PREVAILS,
    RULE_B_PREVAILS,
    MERGE_RULES,
    ESCALATE_TO_HUMAN
}
