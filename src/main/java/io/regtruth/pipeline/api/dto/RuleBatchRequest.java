package io.regtruth.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RuleBatchRequest(
        @JsonProperty("ruleIds") List<String> ruleIds,
        @JsonProperty("source") String source
) {}
