package io.regtruth.pipeline.api.util;

import io.regtruth.pipeline.config.PipelineConfig;
import org.springframework.stereotype.Component;

@Component
public class PipelineProps {
    private final long discoveryIntervalMs;
    private final long fetchIntervalMs;
    private final long arbiterIntervalMs;
    private final long initialDelayMs;
    private final boolean schedulingEnabled;

    public PipelineProps(PipelineConfig config) {
        this.discoveryIntervalMs = config.processing().getDiscoveryIntervalMs();
        this.fetchIntervalMs = config.processing().getFetchIntervalMs();
        this.arbiterIntervalMs = config.processing().getArbiterIntervalMs();
        this.initialDelayMs = config.processing().getInitialDelayMs();
        this.schedulingEnabled = config.processing().enableScheduling();
    }

    // schedule
    public long getDiscoveryIntervalMs() { return discoveryIntervalMs; }
    public long getFetchIntervalMs() { return fetchIntervalMs; }
    public long getArbiterIntervalMs() { return arbiterIntervalMs; }
    public long getInitialDelayMs() { return initialDelayMs; }

    public boolean isSchedulingEnabled() { return schedulingEnabled; }
}
