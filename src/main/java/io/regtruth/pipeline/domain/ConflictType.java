package io.regtruth.pipeline.domain;

public enum ConflictType {
    VALUE_MISMATCH,
    AUTHORITY_SUPERSEDE,
    TEMPORAL_CONFLICT,
    SOURCE_CONFLICT
}
