package io.regtruth.pipeline.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.Map;

public record ReviewRequestedEvent(
        @JsonProperty("requestId") String requestId,
        @JsonProperty("conflictId") String conflictId,
        @JsonProperty("escalationReason") String escalationReason,
        @JsonProperty("context") Map<String, Object> context,
        @JsonProperty("requestedAt") @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime requestedAt
) {
    public static ReviewRequestedEvent create(String conflictId, String escalationReason,
                                              Map<String, Object> context) {
        return new ReviewRequestedEvent(
                "REVIEW-" + conflictId,
                conflictId,
                escalationReason,
                context != null ? context : Map.of(),
                LocalDateTime.now()
        );
    }
}
