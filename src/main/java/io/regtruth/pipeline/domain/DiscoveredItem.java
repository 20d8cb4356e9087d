package io.regtruth.pipeline.domain;

import java.time.Instant;

public record DiscoveredItem(
        String id,
        String endpointId,
        String url,
        String domain,
        DiscoveredItemStatus status,
        String contentHash,
        double changeFrequency,
        int scanCount,
        FreshnessRisk freshnessRisk,
        NodeType nodeType,
        NodeRole nodeRole,
        Instant nextScanDue,
        Instant lastScannedAt,
        int retryCount,
        String lastError,
        Instant createdAt
) {
    public DiscoveredItem withStatus(DiscoveredItemStatus newStatus) {
        return new DiscoveredItem(id, endpointId, url, domain, newStatus, contentHash, changeFrequency, scanCount,
                freshnessRisk, nodeType, nodeRole, nextScanDue, lastScannedAt, retryCount, lastError, createdAt);
    }

    public DiscoveredItem withScan(DiscoveredItemStatus newStatus, String hash, double frequency,
                                   Instant scannedAt, Instant nextDue) {
        return new DiscoveredItem(id, endpointId, url, domain, newStatus, hash, frequency, scanCount + 1,
                freshnessRisk, nodeType, nodeRole, nextDue, scannedAt, 0, null, createdAt);
    }

    public DiscoveredItem withFailure(DiscoveredItemStatus newStatus, int retries, String error, Instant nextDue) {
        return new DiscoveredItem(id, endpointId, url, domain, newStatus, contentHash, changeFrequency, scanCount,
                freshnessRisk, nodeType, nodeRole, nextDue, lastScannedAt, retries, error, createdAt);
    }

    public DiscoveredItem requeued(Instant nextDue) {
        return new DiscoveredItem(id, endpointId, url, domain, DiscoveredItemStatus.PENDING, contentHash,
                changeFrequency, scanCount, freshnessRisk, nodeType, nodeRole, nextDue, lastScannedAt, 0, null,
                createdAt);
    }
}
