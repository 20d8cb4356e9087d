package io.regtruth.pipeline.audit;

import java.util.Map;

/**
 * Best-effort audit trail. Implementations must not throw.
 */
public interface AuditLog {

    void logEvent(String action, String entityType, String entityId, Map<String, Object> metadata);
}
