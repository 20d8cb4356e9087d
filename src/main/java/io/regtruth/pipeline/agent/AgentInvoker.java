package io.regtruth.pipeline.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.regtruth.pipeline.api.service.AgentResultCache;
import io.regtruth.pipeline.domain.AgentRun;
import io.regtruth.pipeline.domain.AgentType;
import io.regtruth.pipeline.store.AgentRunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an agent with bounded retries and schema validation, records an {@link AgentRun}
 * for every invocation and reuses validated outputs for identical inputs.
 */
@Service
public class AgentInvoker {

    private static final Logger logger = LoggerFactory.getLogger(AgentInvoker.class);

    private final AgentRunner agentRunner;
    private final AgentRunStore agentRunStore;
    private final AgentResultCache resultCache;
    private final RetryTemplate retryTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AgentInvoker(AgentRunner agentRunner,
                        AgentRunStore agentRunStore,
                        AgentResultCache resultCache,
                        @Qualifier("agentRetryTemplate") RetryTemplate retryTemplate,
                        ObjectMapper objectMapper,
                        Clock clock) {
        this.agentRunner = agentRunner;
        this.agentRunStore = agentRunStore;
        this.resultCache = resultCache;
        this.retryTemplate = retryTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @throws AgentInvocationException when every attempt failed or produced invalid output
     */
    public <T> T invoke(AgentType agentType, Object input, double temperature, String conflictId,
                        AgentOutputParser<T> parser) {
        String inputJson = toJson(input);

        Optional<T> cached = fromCache(agentType, inputJson, parser);
        if (cached.isPresent()) {
            logger.debug("Reusing cached {} output for conflict {}", agentType, conflictId);
            return cached.get();
        }

        Instant startedAt = clock.instant();
        AtomicInteger attempts = new AtomicInteger();

        try {
            T result = retryTemplate.execute(context -> {
                attempts.incrementAndGet();
                AgentResult agentResult = agentRunner.runAgent(new AgentRequest(agentType, inputJson, temperature));

                if (agentResult instanceof AgentResult.Failure failure) {
                    logger.warn("{} attempt {} failed: {}", agentType, attempts.get(), failure.error());
                    throw new AgentInvocationException(failure.error());
                }
                String output = ((AgentResult.Success) agentResult).output();
                T parsed = parser.parse(readTree(output));
                resultCache.put(agentType, inputJson, output);
                return parsed;
            });

            agentRunStore.append(AgentRun.finished(UUID.randomUUID().toString(), agentType, true,
                    startedAt, clock.instant(), attempts.get(), null, conflictId));
            return result;

        } catch (AgentInvocationException | InvalidAgentOutputException e) {
            agentRunStore.append(AgentRun.finished(UUID.randomUUID().toString(), agentType, false,
                    startedAt, clock.instant(), attempts.get(), e.getMessage(), conflictId));
            logger.error("{} failed after {} attempt(s) for conflict {}: {}",
                    agentType, attempts.get(), conflictId, e.getMessage());
            throw e instanceof AgentInvocationException invocation
                    ? invocation
                    : new AgentInvocationException("Invalid agent output: " + e.getMessage(), e);
        }
    }

    private <T> Optional<T> fromCache(AgentType agentType, String inputJson, AgentOutputParser<T> parser) {
        Optional<String> cached = resultCache.get(agentType, inputJson);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parser.parse(readTree(cached.get())));
        } catch (InvalidAgentOutputException e) {
            logger.warn("Discarding invalid cached {} output: {}", agentType, e.getMessage());
            resultCache.evict(agentType, inputJson);
            return Optional.empty();
        }
    }

    private JsonNode readTree(String output) {
        try {
            return objectMapper.readTree(output);
        } catch (JsonProcessingException e) {
            throw new InvalidAgentOutputException("Output is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String toJson(Object input) {
        try {
            return objectMapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Agent input cannot be serialized: " + e.getMessage(), e);
        }
    }
}
