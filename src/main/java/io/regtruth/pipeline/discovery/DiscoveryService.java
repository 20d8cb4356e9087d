package io.regtruth.pipeline.discovery;

import io.regtruth.pipeline.config.PipelineConfig;
import io.regtruth.pipeline.discovery.listing.ListingResolver;
import io.regtruth.pipeline.domain.DiscoveredItem;
import io.regtruth.pipeline.domain.DiscoveredItemStatus;
import io.regtruth.pipeline.domain.DiscoveryEndpoint;
import io.regtruth.pipeline.domain.ListingStrategy;
import io.regtruth.pipeline.ratelimit.RateLimitedFetcher;
import io.regtruth.pipeline.scheduler.AdaptiveScheduler;
import io.regtruth.pipeline.store.DiscoveredItemStore;
import io.regtruth.pipeline.store.EndpointStore;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

@Service
public class DiscoveryService {

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryService.class);

    private final EndpointStore endpointStore;
    private final DiscoveredItemStore itemStore;
    private final AdaptiveScheduler scheduler;
    private final UrlClassifier urlClassifier;
    private final Map<ListingStrategy, ListingResolver> resolvers = new EnumMap<>(ListingStrategy.class);
    private final PipelineConfig config;
    private final Clock clock;

    public DiscoveryService(EndpointStore endpointStore,
                            DiscoveredItemStore itemStore,
                            AdaptiveScheduler scheduler,
                            UrlClassifier urlClassifier,
                            List<ListingResolver> listingResolvers,
                            PipelineConfig config,
                            Clock clock) {
        this.endpointStore = endpointStore;
        this.itemStore = itemStore;
        this.scheduler = scheduler;
        this.urlClassifier = urlClassifier;
        this.config = config;
        this.clock = clock;
        listingResolvers.forEach(resolver -> resolvers.put(resolver.strategy(), resolver));
    }

    /**
     * Discover every active endpoint that is due, highest priority first. A failing endpoint
     * never stops the run.
     */
    public DiscoveryRunResult runDiscovery() {
        Instant now = clock.instant();
        long startTime = System.currentTimeMillis();

        List<DiscoveryEndpoint> due = endpointStore.findAll().stream()
                .filter(endpoint -> endpoint.isDue(now))
                .sorted(Comparator.comparing(DiscoveryEndpoint::priority).thenComparing(DiscoveryEndpoint::id))
                .toList();

        logger.info("Starting discovery for {} due endpoints", due.size());

        List<EndpointDiscoveryResult> results = new ArrayList<>();
        for (DiscoveryEndpoint endpoint : due) {
            try {
                results.add(discoverEndpoint(endpoint));
            } catch (Exception e) {
                logger.error("Unexpected discovery failure for endpoint {}: {}", endpoint.id(), e.getMessage(), e);
                recordEndpointError(endpoint, e.getMessage());
                results.add(EndpointDiscoveryResult.failed(endpoint.id(), e.getMessage()));
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        DiscoveryRunResult summary = new DiscoveryRunResult(
                results.size(),
                (int) results.stream().filter(result -> !result.success()).count(),
                results.stream().mapToInt(EndpointDiscoveryResult::urlsFound).sum(),
                results.stream().mapToInt(EndpointDiscoveryResult::newItems).sum(),
                results.stream().mapToInt(EndpointDiscoveryResult::requeuedItems).sum(),
                duration,
                List.copyOf(results));

        logger.info("Discovery completed: {} endpoints ({} failed), {} URLs, {} new, {} re-queued in {}ms",
                summary.endpointsProcessed(), summary.endpointsFailed(), summary.urlsFound(),
                summary.newItems(), summary.requeuedItems(), duration);
        return summary;
    }

    public EndpointDiscoveryResult discoverEndpoint(DiscoveryEndpoint endpoint) {
        ListingResolver resolver = resolvers.get(endpoint.listingStrategy());
        if (resolver == null) {
            throw new IllegalStateException("No listing resolver for strategy " + endpoint.listingStrategy());
        }

        List<String> urls;
        try {
            urls = dedupe(resolver.listUrls(endpoint), endpoint.options().urlPattern());
        } catch (DiscoveryException e) {
            logger.warn("Discovery failed for {} ({}): {}", endpoint.id(), e.getCategory(), e.getMessage());
            recordEndpointError(endpoint, e.getMessage());
            return EndpointDiscoveryResult.failed(endpoint.id(), e.getMessage());
        }

        String listingHash = DigestUtils.sha256Hex(String.join("\n", urls.stream().sorted().toList()));
        Instant now = clock.instant();

        int created = 0;
        int requeued = 0;
        for (String url : urls) {
            Optional<DiscoveredItem> existing = itemStore.findByUrl(url);
            if (existing.isPresent()) {
                if (scheduler.requeue(existing.get()).isPresent()) {
                    requeued++;
                }
                continue;
            }

            DiscoveredItem candidate = newItem(endpoint, url, now);
            if (candidate == null) {
                continue;
            }
            if (scheduler.register(candidate).id().equals(candidate.id())) {
                created++;
            }
        }

        endpointStore.update(endpoint.id(), current -> current.withSuccess(now, listingHash));
        logger.info("Endpoint {} listed {} URLs: {} new, {} re-queued", endpoint.id(), urls.size(), created, requeued);
        return new EndpointDiscoveryResult(endpoint.id(), true, urls.size(), created, requeued, null);
    }

    private DiscoveredItem newItem(DiscoveryEndpoint endpoint, String url, Instant now) {
        String domain;
        try {
            domain = RateLimitedFetcher.domainOf(url);
        } catch (IllegalArgumentException e) {
            logger.debug("Ignoring URL without host: {}", url);
            return null;
        }
        UrlClassification classification = urlClassifier.classify(url);
        return new DiscoveredItem(
                UUID.randomUUID().toString(),
                endpoint.id(),
                url,
                domain,
                DiscoveredItemStatus.PENDING,
                null,
                0.5,
                0,
                classification.freshnessRisk(),
                classification.nodeType(),
                classification.nodeRole(),
                now,
                null,
                0,
                null,
                now
        );
    }

    private void recordEndpointError(DiscoveryEndpoint endpoint, String error) {
        int threshold = config.processing().maxEndpointErrors();
        endpointStore.update(endpoint.id(), current -> current.withError(error, clock.instant(), threshold))
                .filter(updated -> !updated.active() && endpoint.active())
                .ifPresent(updated -> logger.warn("Endpoint {} deactivated after {} consecutive errors",
                        updated.id(), updated.consecutiveErrors()));
    }

    private static List<String> dedupe(List<String> rawUrls, String urlPattern) {
        Pattern pattern = urlPattern == null || urlPattern.isBlank() ? null : Pattern.compile(urlPattern);
        Set<String> unique = new LinkedHashSet<>();
        for (String raw : rawUrls) {
            UrlNormalizer.normalize(raw)
                    .filter(url -> pattern == null || pattern.matcher(url).find())
                    .ifPresent(unique::add);
        }
        return List.copyOf(unique);
    }
}
