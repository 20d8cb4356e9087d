package io.regtruth.pipeline.config;

import io.regtruth.pipeline.agent.AgentInvocationException;
import io.regtruth.pipeline.agent.AgentRunner;
import io.regtruth.pipeline.agent.InvalidAgentOutputException;
import io.regtruth.pipeline.agent.UnconfiguredAgentRunner;
import io.regtruth.pipeline.http.ContentFetcher;
import io.regtruth.pipeline.ratelimit.DomainErrorRetryListener;
import io.regtruth.pipeline.ratelimit.DomainRateLimiter;
import io.regtruth.pipeline.ratelimit.JitteredBackOffPolicy;
import io.regtruth.pipeline.ratelimit.RateLimitedFetcher;
import io.regtruth.pipeline.ratelimit.RetryableFetchPolicy;
import io.regtruth.pipeline.ratelimit.Sleeper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class PipelineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean
    public DomainRateLimiter domainRateLimiter(PipelineConfig config, Clock clock, Sleeper sleeper) {
        return new DomainRateLimiter(config.rateLimit(), clock, sleeper);
    }

    @Bean
    public RateLimitedFetcher rateLimitedFetcher(ContentFetcher contentFetcher,
                                                 DomainRateLimiter rateLimiter,
                                                 @Qualifier("fetchRetryTemplate") RetryTemplate fetchRetryTemplate) {
        return new RateLimitedFetcher(contentFetcher, rateLimiter, fetchRetryTemplate);
    }

    /**
     * One attempt plus {@code http.maxRetries} retries, only for retryable categories, with
     * jittered exponential backoff. Each retryable failure counts against the domain.
     */
    @Bean(name = "fetchRetryTemplate")
    public RetryTemplate fetchRetryTemplate(PipelineConfig config, DomainRateLimiter rateLimiter, Sleeper sleeper) {
        HttpConfig http = config.http();

        return RetryTemplate.builder()
                .customPolicy(new RetryableFetchPolicy(http.maxRetries() + 1))
                .customBackoff(new JitteredBackOffPolicy(http.baseRetryDelay(), http.maxRetryDelay(), sleeper))
                .withListener(new DomainErrorRetryListener(rateLimiter))
                .build();
    }

    /**
     * Runs one task per domain; items of the same domain stay sequential inside it.
     */
    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor(PipelineConfig config) {
        int concurrency = config.processing().fetchConcurrency();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("fetch-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "agentRetryTemplate")
    public RetryTemplate agentRetryTemplate(PipelineConfig config) {
        ArbiterConfig arbiter = config.arbiter();
        long initialInterval = arbiter.agentRetryDelay().toMillis();

        return RetryTemplate.builder()
                .maxAttempts(arbiter.agentMaxAttempts())
                .exponentialBackoff(initialInterval, 2.0, initialInterval * 8)
                .retryOn(AgentInvocationException.class)
                .retryOn(InvalidAgentOutputException.class)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(AgentRunner.class)
    public AgentRunner agentRunner() {
        return new UnconfiguredAgentRunner();
    }
}
