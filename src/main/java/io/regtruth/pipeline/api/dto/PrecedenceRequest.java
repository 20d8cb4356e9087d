package io.regtruth.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PrecedenceRequest(
        @JsonProperty("ruleIds") List<String> ruleIds
) {}
