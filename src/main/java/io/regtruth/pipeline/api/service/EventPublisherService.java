package io.regtruth.pipeline.api.service;

import io.regtruth.pipeline.api.dto.kafka.AuditEvent;
import io.regtruth.pipeline.api.dto.kafka.BatchProcessedEvent;
import io.regtruth.pipeline.api.dto.kafka.EvidenceQueuedEvent;
import io.regtruth.pipeline.api.dto.kafka.ReviewRequestedEvent;
import io.regtruth.pipeline.arbiter.HumanReviewService;
import io.regtruth.pipeline.audit.AuditLog;
import io.regtruth.pipeline.config.KafkaProperties;
import io.regtruth.pipeline.domain.Evidence;
import io.regtruth.pipeline.domain.EscalationReason;
import io.regtruth.pipeline.fetch.EvidenceQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka side of the pipeline: audit trail, review requests, evidence hand-off and batch
 * summaries. Every send is best-effort; failures are logged, never thrown.
 */
@Service
public class EventPublisherService implements AuditLog, HumanReviewService, EvidenceQueue {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties topics;

    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate, KafkaProperties topics) {
        this.kafkaTemplate = kafkaTemplate;
        this.topics = topics;
    }

    @Override
    public void logEvent(String action, String entityType, String entityId, Map<String, Object> metadata) {
        try {
            AuditEvent event = AuditEvent.create(action, entityType, entityId, metadata);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.audit(), entityId, event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Sent audit event {} for {} {}", action, entityType, entityId);
                } else {
                    logger.error("Failed to send audit event {} for {} {}", action, entityType, entityId, ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing audit event {} for {} {}", action, entityType, entityId, e);
        }
    }

    @Override
    public void requestReview(String conflictId, EscalationReason reason, Map<String, Object> context) {
        try {
            ReviewRequestedEvent event = ReviewRequestedEvent.create(conflictId, reason.name(), context);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.reviewRequested(), conflictId, event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Review requested for conflict {} ({})", conflictId, reason);
                } else {
                    logger.error("Failed to send review request for conflict {}", conflictId, ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing review request for conflict {}", conflictId, e);
        }
    }

    @Override
    public void queueForExtraction(Evidence evidence) {
        queueEvidence(topics.evidenceExtraction(), evidence);
    }

    @Override
    public void queueForOcr(Evidence evidence) {
        queueEvidence(topics.evidenceOcr(), evidence);
    }

    public void publishBatchProcessed(String stage, int processed, int succeeded, int failed, long durationMs) {
        try {
            BatchProcessedEvent event = BatchProcessedEvent.create(stage, processed, succeeded, failed, durationMs);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.batchProcessed(), event.batchId(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Sent batch processed event: {} ({} items, stage {})",
                            event.batchId(), processed, stage);
                } else {
                    logger.error("Failed to send batch processed event: {}", event.batchId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing batch processed event for stage: {}", stage, e);
        }
    }

    private void queueEvidence(String topic, Evidence evidence) {
        try {
            EvidenceQueuedEvent event = EvidenceQueuedEvent.create(
                    evidence.id(),
                    evidence.url(),
                    evidence.contentHash(),
                    evidence.contentClass().name(),
                    evidence.discoveredItemId()
            );

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topic, evidence.id(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Queued evidence {} on {} partition {}",
                            evidence.id(), topic, result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to queue evidence {} on {}", evidence.id(), topic, ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error queueing evidence {} on {}", evidence.id(), topic, e);
        }
    }
}
