package io.regtruth.pipeline.fetch;

import io.regtruth.pipeline.domain.ContentClass;
import io.regtruth.pipeline.domain.DiscoveredItem;
import io.regtruth.pipeline.domain.DiscoveredItemStatus;
import io.regtruth.pipeline.domain.Evidence;
import io.regtruth.pipeline.fetch.parser.BinaryDocumentParser;
import io.regtruth.pipeline.fetch.parser.DocumentParseException;
import io.regtruth.pipeline.fetch.parser.ParsedDocument;
import io.regtruth.pipeline.fetch.parser.TextExtractor;
import io.regtruth.pipeline.http.FetchResponse;
import io.regtruth.pipeline.ratelimit.FetchOutcome;
import io.regtruth.pipeline.ratelimit.RateLimitedFetcher;
import io.regtruth.pipeline.scheduler.AdaptiveScheduler;
import io.regtruth.pipeline.store.EvidenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Fetches pending and due items, snapshots their content as evidence and routes new
 * evidence to extraction or OCR. Domains are processed concurrently, items within one
 * domain serially.
 */
@Service
public class FetchService {

    private static final Logger logger = LoggerFactory.getLogger(FetchService.class);

    private final RateLimitedFetcher fetcher;
    private final AdaptiveScheduler scheduler;
    private final EvidenceStore evidenceStore;
    private final EvidenceQueue evidenceQueue;
    private final ContentClassifier contentClassifier;
    private final TextExtractor textExtractor;
    private final List<BinaryDocumentParser> documentParsers;
    private final Executor executor;
    private final Clock clock;

    public FetchService(RateLimitedFetcher fetcher,
                        AdaptiveScheduler scheduler,
                        EvidenceStore evidenceStore,
                        EvidenceQueue evidenceQueue,
                        ContentClassifier contentClassifier,
                        TextExtractor textExtractor,
                        List<BinaryDocumentParser> documentParsers,
                        @Qualifier("pipelineExecutor") Executor executor,
                        Clock clock) {
        this.fetcher = fetcher;
        this.scheduler = scheduler;
        this.evidenceStore = evidenceStore;
        this.evidenceQueue = evidenceQueue;
        this.contentClassifier = contentClassifier;
        this.textExtractor = textExtractor;
        this.documentParsers = documentParsers;
        this.executor = executor;
        this.clock = clock;
    }

    public FetchRunResult processPendingItems(int limit) {
        return run("pending", scheduler.fetchPendingItems(limit), false);
    }

    public FetchRunResult rescanDueItems(int limit) {
        return run("rescan", scheduler.fetchDueItems(limit), true);
    }

    private FetchRunResult run(String label, List<DiscoveredItem> items, boolean rescan) {
        long startTime = System.currentTimeMillis();
        Map<String, List<DiscoveredItem>> byDomain = AdaptiveScheduler.groupByDomain(items);

        logger.info("Starting {} fetch of {} items across {} domains", label, items.size(), byDomain.size());

        List<CompletableFuture<List<ItemOutcome>>> futures = byDomain.values().stream()
                .map(domainItems -> CompletableFuture.supplyAsync(() -> processDomain(domainItems, rescan), executor))
                .toList();

        Map<ItemOutcome, Integer> counts = new EnumMap<>(ItemOutcome.class);
        for (CompletableFuture<List<ItemOutcome>> future : futures) {
            future.join().forEach(outcome -> counts.merge(outcome, 1, Integer::sum));
        }

        long duration = System.currentTimeMillis() - startTime;
        FetchRunResult result = new FetchRunResult(
                items.size(),
                counts.getOrDefault(ItemOutcome.FETCHED, 0),
                counts.getOrDefault(ItemOutcome.CHANGED, 0),
                counts.getOrDefault(ItemOutcome.UNCHANGED, 0),
                counts.getOrDefault(ItemOutcome.SKIPPED, 0),
                counts.getOrDefault(ItemOutcome.FAILED, 0),
                counts.getOrDefault(ItemOutcome.DEFERRED, 0),
                duration);

        logger.info("Completed {} fetch: {} fetched, {} changed, {} unchanged, {} skipped, {} failed, {} deferred in {}ms",
                label, result.fetched(), result.changed(), result.unchanged(), result.skipped(),
                result.failed(), result.deferred(), duration);
        return result;
    }

    private List<ItemOutcome> processDomain(List<DiscoveredItem> items, boolean rescan) {
        List<ItemOutcome> outcomes = new ArrayList<>(items.size());
        for (DiscoveredItem item : items) {
            try {
                outcomes.add(processItem(item, rescan));
            } catch (Exception e) {
                logger.error("Unexpected failure processing item {} ({}): {}", item.id(), item.url(), e.getMessage(), e);
                outcomes.add(ItemOutcome.FAILED);
            }
        }
        return outcomes;
    }

    ItemOutcome processItem(DiscoveredItem item, boolean rescan) {
        FetchOutcome outcome = fetcher.fetch(item.url());

        if (outcome instanceof FetchOutcome.Success success) {
            return handleContent(item, success.response(), rescan);
        }
        if (outcome instanceof FetchOutcome.CircuitOpen open) {
            logger.debug("Deferring {}: {}", item.url(), open.message());
            return ItemOutcome.DEFERRED;
        }

        FetchOutcome.Failure failure = (FetchOutcome.Failure) outcome;
        logger.warn("Fetch failed for item {} ({}) after {} attempt(s): {} ({})",
                item.id(), item.url(), failure.attempts(), failure.message(), failure.category());
        return fail(item, failure.message(), failure.retryable(), rescan);
    }

    private ItemOutcome handleContent(DiscoveredItem item, FetchResponse response, boolean rescan) {
        ContentClass contentClass = contentClassifier.classify(item.url(), response.contentType(), response.body());
        String text;
        String hash;

        if (contentClass.isBinaryDocument()) {
            Optional<BinaryDocumentParser> parser = parserFor(contentClass);
            if (parser.isEmpty()) {
                return skip(item, "Unsupported document type: " + contentClass, rescan);
            }
            try {
                ParsedDocument document = parser.get().parse(response.body(), contentClass);
                if (document.scanned()) {
                    contentClass = ContentClass.PDF_SCANNED;
                    text = null;
                } else {
                    text = document.text();
                }
            } catch (DocumentParseException e) {
                logger.warn("Content error for item {} ({}): {}", item.id(), item.url(), e.getMessage());
                return fail(item, e.getMessage(), false, rescan);
            }
            hash = ContentHasher.hashBytes(response.body());

        } else if (contentClass == ContentClass.UNKNOWN) {
            return skip(item, "Unsupported content type: " + response.contentType(), rescan);

        } else {
            String body = response.bodyAsString();
            text = textExtractor.extract(body, contentClass);
            hash = ContentHasher.hashContent(body, response.contentType());
        }

        if (contentClass != ContentClass.PDF_SCANNED && (text == null || text.isBlank())) {
            return fail(item, "Empty text extraction", false, rescan);
        }

        if (!ContentHasher.hasChanged(item.contentHash(), hash)) {
            scheduler.recordScan(item, hash, false).ifPresent(this::completeProcessing);
            return ItemOutcome.UNCHANGED;
        }

        boolean previouslySeen = item.contentHash() != null;
        String summary = ChangeSummarizer.summarize(
                evidenceStore.findLatestByUrl(item.url()).map(Evidence::derivedText).orElse(null), text);

        Evidence evidence = new Evidence(
                UUID.randomUUID().toString(),
                item.url(),
                hash,
                contentClass,
                response.body(),
                response.contentType(),
                clock.instant(),
                previouslySeen,
                summary,
                text,
                item.id()
        );

        EvidenceStore.Upsert upsert = evidenceStore.upsert(evidence);
        if (upsert.created()) {
            route(upsert.evidence());
        }
        scheduler.recordScan(item, hash, previouslySeen).ifPresent(this::completeProcessing);

        if (previouslySeen) {
            logger.info("Content changed for {} ({})", item.url(), summary);
        }
        return rescan ? ItemOutcome.CHANGED : ItemOutcome.FETCHED;
    }

    private void route(Evidence evidence) {
        if (evidence.contentClass() == ContentClass.PDF_SCANNED) {
            evidenceQueue.queueForOcr(evidence);
        } else {
            evidenceQueue.queueForExtraction(evidence);
        }
    }

    private void completeProcessing(DiscoveredItem item) {
        if (item.status() == DiscoveredItemStatus.FETCHED) {
            scheduler.markProcessed(item);
        }
    }

    private ItemOutcome skip(DiscoveredItem item, String reason, boolean rescan) {
        logger.info("Skipping item {} ({}): {}", item.id(), item.url(), reason);
        if (rescan) {
            scheduler.recordScanError(item, reason);
        } else {
            scheduler.markSkipped(item, reason);
        }
        return ItemOutcome.SKIPPED;
    }

    private ItemOutcome fail(DiscoveredItem item, String error, boolean retryable, boolean rescan) {
        if (rescan) {
            scheduler.recordScanError(item, error);
        } else {
            scheduler.recordFetchFailure(item, error, retryable);
        }
        return ItemOutcome.FAILED;
    }

    private Optional<BinaryDocumentParser> parserFor(ContentClass contentClass) {
        return documentParsers.stream()
                .filter(parser -> parser.supports(contentClass))
                .findFirst();
    }

    enum ItemOutcome {
        FETCHED,
        CHANGED,
        UNCHANGED,
        SKIPPED,
        FAILED,
        DEFERRED
    }
}
