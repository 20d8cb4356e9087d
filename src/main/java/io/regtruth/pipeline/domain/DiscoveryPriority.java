package io.regtruth.pipeline.domain;

/**
 * Ordering of endpoints within a discovery run. Declaration order is the run order.
 */
public enum DiscoveryPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
