package io.regtruth.pipeline.arbiter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Model input for one rule-vs-rule conflict. {@code recommendation} carries the deterministic
 * winner for critical-tier pairs, which are never auto-resolved.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArbiterInput(
        @JsonProperty("conflict_id") String conflictId,
        @JsonProperty("conflict_type") String conflictType,
        @JsonProperty("conflicting_items") List<ConflictingItem> conflictingItems,
        @JsonProperty("recommendation") String recommendation
) {}
