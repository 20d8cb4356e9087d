package io.regtruth.pipeline.config;

import java.time.Duration;

public record ArbiterConfig(
        int batchSize,
        double minModelConfidence,
        double minRuleConfidence,
        double temperature,
        int agentMaxAttempts,
        Duration agentRetryDelay,
        Duration cacheTtl
) {
    public ArbiterConfig {
        batchSize = batchSize > 0 ? batchSize : 10;
        minModelConfidence = minModelConfidence > 0 ? minModelConfidence : 0.8;
        minRuleConfidence = minRuleConfidence > 0 ? minRuleConfidence : 0.85;
        temperature = temperature > 0 ? temperature : 0.1;
        agentMaxAttempts = agentMaxAttempts > 0 ? agentMaxAttempts : 3;
        agentRetryDelay = agentRetryDelay != null ? agentRetryDelay : Duration.ofSeconds(2);
        cacheTtl = cacheTtl != null ? cacheTtl : Duration.ofDays(7);
    }

    public static ArbiterConfig defaults() {
        return new ArbiterConfig(0, 0, 0, 0, 0, null, null);
    }
}
