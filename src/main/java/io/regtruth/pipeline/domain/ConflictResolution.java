package io.regtruth.pipeline.domain;

public record ConflictResolution(
        String winningItemId,
        ResolutionStrategy strategy,
        String rationale,
        ArbiterResolution resolution
) {}
