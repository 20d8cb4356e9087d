package io.regtruth.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "kafka.topics")
public record KafkaProperties(
        String audit,
        String reviewRequested,
        String evidenceExtraction,
        String evidenceOcr,
        String batchProcessed
) {}
