package io.regtruth.pipeline.arbiter;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConflictingItem(
        @JsonProperty("item_id") String itemId,
        @JsonProperty("item_type") String itemType,
        @JsonProperty("claim") String claim
) {}
