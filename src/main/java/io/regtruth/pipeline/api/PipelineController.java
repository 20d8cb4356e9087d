package io.regtruth.pipeline.api;

import io.regtruth.pipeline.api.dto.PrecedenceRequest;
import io.regtruth.pipeline.api.dto.RuleBatchRequest;
import io.regtruth.pipeline.api.dto.TransitionRequest;
import io.regtruth.pipeline.api.service.ScheduledPipelineService;
import io.regtruth.pipeline.arbiter.ArbiterBatchResult;
import io.regtruth.pipeline.arbiter.ArbiterResult;
import io.regtruth.pipeline.arbiter.ArbiterService;
import io.regtruth.pipeline.arbiter.PrecedenceResult;
import io.regtruth.pipeline.arbiter.RulePrecedenceResolver;
import io.regtruth.pipeline.discovery.DiscoveryRunResult;
import io.regtruth.pipeline.domain.ConflictStatus;
import io.regtruth.pipeline.domain.DiscoveredItem;
import io.regtruth.pipeline.domain.RegulatoryConflict;
import io.regtruth.pipeline.domain.RegulatoryRule;
import io.regtruth.pipeline.fetch.FetchRunResult;
import io.regtruth.pipeline.ratelimit.DomainHealth;
import io.regtruth.pipeline.ratelimit.DomainRateLimiter;
import io.regtruth.pipeline.ratelimit.HealthStatus;
import io.regtruth.pipeline.scheduler.AdaptiveScheduler;
import io.regtruth.pipeline.status.BatchTransitionResult;
import io.regtruth.pipeline.status.RuleStatusService;
import io.regtruth.pipeline.status.TransitionContext;
import io.regtruth.pipeline.store.ConflictStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private static final Logger logger = LoggerFactory.getLogger(PipelineController.class);

    private final DomainRateLimiter rateLimiter;
    private final ScheduledPipelineService pipeline;
    private final AdaptiveScheduler scheduler;
    private final ConflictStore conflictStore;
    private final ArbiterService arbiterService;
    private final RuleStatusService ruleStatusService;
    private final RulePrecedenceResolver precedenceResolver;

    public PipelineController(DomainRateLimiter rateLimiter,
                              ScheduledPipelineService pipeline,
                              AdaptiveScheduler scheduler,
                              ConflictStore conflictStore,
                              ArbiterService arbiterService,
                              RuleStatusService ruleStatusService,
                              RulePrecedenceResolver precedenceResolver) {
        this.rateLimiter = rateLimiter;
        this.pipeline = pipeline;
        this.scheduler = scheduler;
        this.conflictStore = conflictStore;
        this.arbiterService = arbiterService;
        this.ruleStatusService = ruleStatusService;
        this.precedenceResolver = precedenceResolver;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        HealthStatus status = rateLimiter.getHealthStatus();

        var healthInfo = Map.of(
                "status", status.healthy() ? "UP" : "DEGRADED",
                "service", "Regulatory Truth Pipeline",
                "timestamp", LocalDateTime.now(),
                "domains", status.domains(),
                "openConflicts", conflictStore.findByStatus(ConflictStatus.OPEN).size()
        );

        return status.healthy() ?
                ResponseEntity.ok(healthInfo) :
                ResponseEntity.status(503).body(healthInfo);
    }

    @GetMapping("/domains/{domain}/health")
    public DomainHealth domainHealth(@PathVariable String domain) {
        return rateLimiter.getDomainHealth(domain);
    }

    @PostMapping("/domains/{domain}/circuit/reset")
    public DomainHealth resetCircuit(@PathVariable String domain) {
        logger.info("Manual circuit reset for {}", domain);
        rateLimiter.resetCircuitBreaker(domain);
        return rateLimiter.getDomainHealth(domain);
    }

    @PostMapping("/runs/discovery")
    public DiscoveryRunResult triggerDiscovery() {
        return pipeline.runDiscovery();
    }

    @PostMapping("/runs/fetch")
    public FetchRunResult triggerFetch() {
        return pipeline.runFetch();
    }

    @PostMapping("/runs/arbiter")
    public ArbiterBatchResult triggerArbiter() {
        return pipeline.runArbiter();
    }

    @GetMapping("/items/due")
    public List<DiscoveredItem> dueItems(@RequestParam(defaultValue = "50") int limit) {
        return scheduler.fetchDueItems(requirePositive(limit));
    }

    @GetMapping("/conflicts/open")
    public List<RegulatoryConflict> openConflicts(@RequestParam(defaultValue = "50") int limit) {
        return conflictStore.findOpen(requirePositive(limit));
    }

    @GetMapping("/conflicts/{conflictId}")
    public RegulatoryConflict conflict(@PathVariable String conflictId) {
        return conflictStore.findById(conflictId)
                .orElseThrow(() -> new NoSuchElementException("Conflict not found: " + conflictId));
    }

    @PostMapping("/conflicts/{conflictId}/arbitrate")
    public ResponseEntity<ArbiterResult> arbitrate(@PathVariable String conflictId) {
        ArbiterResult result = arbiterService.arbitrate(conflictId);
        return result.success() ?
                ResponseEntity.ok(result) :
                ResponseEntity.unprocessableEntity().body(result);
    }

    @PostMapping("/rules/{ruleId}/transition")
    public RegulatoryRule transition(@PathVariable String ruleId, @RequestBody TransitionRequest request) {
        if (request.targetStatus() == null) {
            throw new IllegalArgumentException("targetStatus is required");
        }
        TransitionContext context = request.systemAction() != null
                ? TransitionContext.system(request.systemAction(), request.source())
                : TransitionContext.of(request.source());
        return ruleStatusService.transition(ruleId, request.targetStatus(), context, request.reviewerNotes());
    }

    @PostMapping("/rules/publish")
    public BatchTransitionResult publish(@RequestBody RuleBatchRequest request) {
        return ruleStatusService.publishRules(requireIds(request.ruleIds()), request.source());
    }

    @PostMapping("/rules/revert")
    public BatchTransitionResult revert(@RequestBody RuleBatchRequest request) {
        return ruleStatusService.revertRules(requireIds(request.ruleIds()), request.source());
    }

    @PostMapping("/rules/quarantine")
    public BatchTransitionResult quarantine(@RequestBody RuleBatchRequest request) {
        return ruleStatusService.quarantineRules(requireIds(request.ruleIds()), request.source());
    }

    @PostMapping("/rules/precedence")
    public PrecedenceResult precedence(@RequestBody PrecedenceRequest request) {
        return precedenceResolver.resolveRulePrecedence(request.ruleIds());
    }

    private int requirePositive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return limit;
    }

    private List<String> requireIds(List<String> ruleIds) {
        if (ruleIds == null || ruleIds.isEmpty()) {
            throw new IllegalArgumentException("ruleIds is required");
        }
        return ruleIds;
    }
}
