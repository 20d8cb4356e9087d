package io.regtruth.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "pipeline")
public record PipelineConfig(
        List<EndpointSource> endpoints,
        HttpConfig http,
        RateLimitConfig rateLimit,
        ProcessingConfig processing,
        ArbiterConfig arbiter
) {
    public PipelineConfig {
        endpoints = endpoints != null ? List.copyOf(endpoints) : List.of();
        http = http != null ? http : HttpConfig.defaults();
        rateLimit = rateLimit != null ? rateLimit : RateLimitConfig.defaults();
        processing = processing != null ? processing : ProcessingConfig.defaults();
        arbiter = arbiter != null ? arbiter : ArbiterConfig.defaults();
    }

    public List<EndpointSource> getEnabledEndpoints() {
        return endpoints.stream()
                .filter(EndpointSource::enabled)
                .toList();
    }
}
