package io.regtruth.pipeline.conflict;

import io.regtruth.pipeline.domain.ConflictType;

/**
 * A detected but not yet persisted conflict between an existing rule and a candidate.
 */
public record ConflictSeed(
        ConflictType type,
        String existingRuleId,
        String newRuleId,
        String description
) {}
