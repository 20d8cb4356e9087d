package io.regtruth.pipeline.api.service;

import io.regtruth.pipeline.api.util.PipelineProps;
import io.regtruth.pipeline.arbiter.ArbiterBatchResult;
import io.regtruth.pipeline.arbiter.ArbiterService;
import io.regtruth.pipeline.config.PipelineConfig;
import io.regtruth.pipeline.discovery.DiscoveryRunResult;
import io.regtruth.pipeline.discovery.DiscoveryService;
import io.regtruth.pipeline.fetch.FetchRunResult;
import io.regtruth.pipeline.fetch.FetchService;
import io.regtruth.pipeline.scheduler.AdaptiveScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class ScheduledPipelineService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledPipelineService.class);

    private final DiscoveryService discoveryService;
    private final FetchService fetchService;
    private final AdaptiveScheduler scheduler;
    private final ArbiterService arbiterService;
    private final EventPublisherService eventPublisher;
    private final PipelineProps props;
    private final PipelineConfig config;

    public ScheduledPipelineService(DiscoveryService discoveryService,
                                    FetchService fetchService,
                                    AdaptiveScheduler scheduler,
                                    ArbiterService arbiterService,
                                    EventPublisherService eventPublisher,
                                    PipelineProps props,
                                    PipelineConfig config) {
        this.discoveryService = discoveryService;
        this.fetchService = fetchService;
        this.scheduler = scheduler;
        this.arbiterService = arbiterService;
        this.eventPublisher = eventPublisher;
        this.props = props;
        this.config = config;
    }

    @Scheduled(
            fixedRateString = "#{@pipelineProps.discoveryIntervalMs}",
            initialDelayString = "#{@pipelineProps.initialDelayMs}"
    )
    public void scheduledDiscovery() {
        if (!props.isSchedulingEnabled()) {
            return;
        }
        try {
            runDiscovery();
        } catch (Exception e) {
            logger.error("Scheduled discovery failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(
            fixedDelayString = "#{@pipelineProps.fetchIntervalMs}",
            initialDelayString = "#{@pipelineProps.initialDelayMs}"
    )
    public void scheduledFetch() {
        if (!props.isSchedulingEnabled()) {
            return;
        }
        try {
            runFetch();
        } catch (Exception e) {
            logger.error("Scheduled fetch failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(
            fixedDelayString = "#{@pipelineProps.arbiterIntervalMs}",
            initialDelayString = "#{@pipelineProps.initialDelayMs}"
    )
    public void scheduledArbiter() {
        if (!props.isSchedulingEnabled()) {
            return;
        }
        try {
            runArbiter();
        } catch (Exception e) {
            logger.error("Scheduled arbiter batch failed: {}", e.getMessage(), e);
        }
    }

    public DiscoveryRunResult runDiscovery() {
        DiscoveryRunResult result = discoveryService.runDiscovery();

        eventPublisher.publishBatchProcessed("discovery",
                result.endpointsProcessed(),
                result.endpointsProcessed() - result.endpointsFailed(),
                result.endpointsFailed(),
                result.durationMs());
        return result;
    }

    /**
     * One fetch cycle: revive retryable failures, fetch new items, then rescan due ones.
     */
    public FetchRunResult runFetch() {
        int maxItems = config.processing().maxItemsPerRun();
        long startTime = System.currentTimeMillis();

        int retried = scheduler.retryFailedItems(maxItems);
        FetchRunResult pending = fetchService.processPendingItems(maxItems);
        FetchRunResult rescanned = fetchService.rescanDueItems(maxItems);

        FetchRunResult total = new FetchRunResult(
                pending.processed() + rescanned.processed(),
                pending.fetched() + rescanned.fetched(),
                pending.changed() + rescanned.changed(),
                pending.unchanged() + rescanned.unchanged(),
                pending.skipped() + rescanned.skipped(),
                pending.failed() + rescanned.failed(),
                pending.deferred() + rescanned.deferred(),
                System.currentTimeMillis() - startTime);

        eventPublisher.publishBatchProcessed("fetch",
                total.processed(),
                total.processed() - total.failed(),
                total.failed(),
                total.durationMs());

        logger.info("Fetch cycle completed: {} retried, {} processed, {} changed, {} failed, {} deferred in {}ms",
                retried, total.processed(), total.changed(), total.failed(), total.deferred(), total.durationMs());
        return total;
    }

    public ArbiterBatchResult runArbiter() {
        long startTime = System.currentTimeMillis();
        ArbiterBatchResult result = arbiterService.runArbiterBatch(config.arbiter().batchSize());

        eventPublisher.publishBatchProcessed("arbiter",
                result.processed(),
                result.resolved() + result.escalated(),
                result.failed(),
                System.currentTimeMillis() - startTime);
        return result;
    }
}
