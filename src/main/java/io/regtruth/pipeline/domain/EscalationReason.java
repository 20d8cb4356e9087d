package io.regtruth.pipeline.domain;

public enum EscalationReason {
    BOTH_T0,
    LOW_CONFIDENCE,
    EQUAL_AUTHORITY,
    SOURCE_DATA_CONFLICT
}
