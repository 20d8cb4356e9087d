package io.regtruth.pipeline.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record EvidenceQueuedEvent(
        @JsonProperty("evidenceId") String evidenceId,
        @JsonProperty("url") String url,
        @JsonProperty("contentHash") String contentHash,
        @JsonProperty("contentClass") String contentClass,
        @JsonProperty("discoveredItemId") String discoveredItemId,
        @JsonProperty("queuedAt") @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime queuedAt
) {
    public static EvidenceQueuedEvent create(String evidenceId, String url, String contentHash,
                                             String contentClass, String discoveredItemId) {
        return new EvidenceQueuedEvent(
                evidenceId, url, contentHash, contentClass, discoveredItemId, LocalDateTime.now()
        );
    }
}
