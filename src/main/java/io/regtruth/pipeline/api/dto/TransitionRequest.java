package io.regtruth.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.regtruth.pipeline.domain.RuleStatus;
import io.regtruth.pipeline.domain.SystemAction;

public record TransitionRequest(
        @JsonProperty("targetStatus") RuleStatus targetStatus,
        @JsonProperty("source") String source,
        @JsonProperty("systemAction") SystemAction systemAction,
        @JsonProperty("reviewerNotes") String reviewerNotes
) {}
