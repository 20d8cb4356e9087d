package io.regtruth.pipeline.scheduler;

import io.regtruth.pipeline.config.PipelineConfig;
import io.regtruth.pipeline.config.ProcessingConfig;
import io.regtruth.pipeline.domain.DiscoveredItem;
import io.regtruth.pipeline.domain.DiscoveredItemStatus;
import io.regtruth.pipeline.store.DiscoveredItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Decides when each discovered item is due and owns every write to its status.
 */
@Service
public class AdaptiveScheduler {

    private static final Logger logger = LoggerFactory.getLogger(AdaptiveScheduler.class);

    private static final Set<DiscoveredItemStatus> RESCANNABLE =
            Set.of(DiscoveredItemStatus.FETCHED, DiscoveredItemStatus.PROCESSED);

    private static final Comparator<DiscoveredItem> BY_RISK_THEN_DUE = Comparator
            .comparing(DiscoveredItem::freshnessRisk)
            .thenComparing(DiscoveredItem::nextScanDue, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(DiscoveredItem::id);

    private final DiscoveredItemStore itemStore;
    private final ProcessingConfig processing;
    private final Clock clock;

    public AdaptiveScheduler(DiscoveredItemStore itemStore, PipelineConfig config, Clock clock) {
        this.itemStore = itemStore;
        this.processing = config.processing();
        this.clock = clock;
    }

    /**
     * Already-fetched items whose next scan is due, most critical first, then earliest due.
     */
    public List<DiscoveredItem> fetchDueItems(int limit) {
        return itemStore.findDue(RESCANNABLE, clock.instant()).stream()
                .sorted(BY_RISK_THEN_DUE)
                .limit(limit)
                .toList();
    }

    public List<DiscoveredItem> fetchPendingItems(int limit) {
        return itemStore.findByStatus(DiscoveredItemStatus.PENDING).stream()
                .sorted(BY_RISK_THEN_DUE)
                .limit(limit)
                .toList();
    }

    /**
     * Group preserving the incoming order, both of domains and of items within a domain.
     */
    public static Map<String, List<DiscoveredItem>> groupByDomain(List<DiscoveredItem> items) {
        Map<String, List<DiscoveredItem>> groups = new LinkedHashMap<>();
        for (DiscoveredItem item : items) {
            groups.computeIfAbsent(item.domain(), key -> new ArrayList<>()).add(item);
        }
        return groups;
    }

    /**
     * Store a newly discovered item unless its URL is already known.
     *
     * @return the stored item; compare ids with the candidate to tell whether it was new
     */
    public DiscoveredItem register(DiscoveredItem candidate) {
        if (candidate.status() != DiscoveredItemStatus.PENDING) {
            throw new IllegalArgumentException("New items start PENDING, got " + candidate.status());
        }
        return itemStore.insertIfAbsent(candidate);
    }

    /**
     * Put a fetched or processed item back in the fetch queue because discovery saw it again.
     */
    public Optional<DiscoveredItem> requeue(DiscoveredItem item) {
        if (!RESCANNABLE.contains(item.status())) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        return transition(item, DiscoveredItemStatus.PENDING, current -> current.requeued(now));
    }

    /**
     * Record a successful fetch or rescan. A pending item becomes FETCHED; a rescanned item
     * keeps its status. Velocity and next scan are recomputed either way.
     */
    public Optional<DiscoveredItem> recordScan(DiscoveredItem item, String contentHash, boolean changed) {
        DiscoveredItemStatus target = item.status() == DiscoveredItemStatus.PENDING
                ? DiscoveredItemStatus.FETCHED
                : item.status();
        Instant now = clock.instant();

        return transition(item, target, current -> {
            double frequency = VelocityModel.updateVelocity(current.changeFrequency(), current.scanCount(), changed);
            Instant nextDue = VelocityModel.calculateNextScan(frequency, current.freshnessRisk(), now);
            return current.withScan(target, contentHash, frequency, now, nextDue);
        });
    }

    public Optional<DiscoveredItem> markProcessed(DiscoveredItem item) {
        return transition(item, DiscoveredItemStatus.PROCESSED, current -> current.withStatus(DiscoveredItemStatus.PROCESSED));
    }

    public Optional<DiscoveredItem> markSkipped(DiscoveredItem item, String reason) {
        return transition(item, DiscoveredItemStatus.SKIPPED,
                current -> current.withFailure(DiscoveredItemStatus.SKIPPED, current.retryCount(), reason, null));
    }

    /**
     * Mark a fetch as failed. Retryable failures are scheduled for another attempt until the
     * retry budget is spent; content errors are terminal immediately.
     */
    public Optional<DiscoveredItem> recordFetchFailure(DiscoveredItem item, String error, boolean retryable) {
        Instant now = clock.instant();
        return transition(item, DiscoveredItemStatus.FAILED, current -> {
            int retries = current.retryCount() + 1;
            boolean retriesLeft = retryable && retries < processing.maxFetchRetries();
            Instant nextDue = retriesLeft ? now.plus(processing.failedRetryDelay()) : null;
            int recordedRetries = retryable ? retries : processing.maxFetchRetries();
            return current.withFailure(DiscoveredItemStatus.FAILED, recordedRetries, error, nextDue);
        });
    }

    /**
     * A rescan failed: keep the status, remember the error and push the next scan out by a
     * fixed cooldown.
     */
    public Optional<DiscoveredItem> recordScanError(DiscoveredItem item, String error) {
        Instant nextDue = clock.instant().plus(processing.scanErrorCooldown());
        return transition(item, item.status(),
                current -> current.withFailure(current.status(), current.retryCount(), error, nextDue));
    }

    /**
     * Move due FAILED items with retry budget left back to PENDING.
     *
     * @return number of items re-queued
     */
    public int retryFailedItems(int limit) {
        Instant now = clock.instant();
        List<DiscoveredItem> candidates = itemStore.findByStatus(DiscoveredItemStatus.FAILED).stream()
                .filter(item -> item.retryCount() < processing.maxFetchRetries())
                .filter(item -> item.nextScanDue() != null && !item.nextScanDue().isAfter(now))
                .sorted(BY_RISK_THEN_DUE)
                .limit(limit)
                .toList();

        int requeued = 0;
        for (DiscoveredItem item : candidates) {
            if (transition(item, DiscoveredItemStatus.PENDING, current -> current.withStatus(DiscoveredItemStatus.PENDING)).isPresent()) {
                requeued++;
            }
        }
        if (requeued > 0) {
            logger.info("Re-queued {} failed items for retry", requeued);
        }
        return requeued;
    }

    private Optional<DiscoveredItem> transition(DiscoveredItem item, DiscoveredItemStatus target,
                                                UnaryOperator<DiscoveredItem> change) {
        if (!item.status().canTransitionTo(target)) {
            throw new IllegalItemTransitionException(item.id(), item.status(), target);
        }
        Optional<DiscoveredItem> updated = itemStore.updateIfStatus(item.id(), item.status(), change);
        if (updated.isEmpty()) {
            logger.warn("Item {} changed concurrently; skipped {} → {}", item.id(), item.status(), target);
        }
        return updated;
    }
}
