package io.regtruth.pipeline.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

public record AuditEvent(
        @JsonProperty("eventId") String eventId,
        @JsonProperty("action") String action,
        @JsonProperty("entityType") String entityType,
        @JsonProperty("entityId") String entityId,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("occurredAt") @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime occurredAt
) {
    public static AuditEvent create(String action, String entityType, String entityId,
                                    Map<String, Object> metadata) {
        return new AuditEvent(
                UUID.randomUUID().toString(),
                action,
                entityType,
                entityId,
                metadata != null ? metadata : Map.of(),
                LocalDateTime.now()
        );
    }
}
