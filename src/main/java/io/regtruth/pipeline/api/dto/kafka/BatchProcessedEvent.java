package io.regtruth.pipeline.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record BatchProcessedEvent(
        @JsonProperty("batchId") String batchId,
        @JsonProperty("stage") String stage,
        @JsonProperty("processed") int processed,
        @JsonProperty("succeeded") int succeeded,
        @JsonProperty("failed") int failed,
        @JsonProperty("processingDurationMs") long processingDurationMs,
        @JsonProperty("processedAt")
        @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime processedAt
) {
    public static BatchProcessedEvent create(String stage, int processed, int succeeded,
                                             int failed, long processingDurationMs) {
        return new BatchProcessedEvent(
                "BATCH-" + stage + "-" + System.currentTimeMillis(),
                stage,
                processed,
                succeeded,
                failed,
                processingDurationMs,
                LocalDateTime.now()
        );
    }
}
