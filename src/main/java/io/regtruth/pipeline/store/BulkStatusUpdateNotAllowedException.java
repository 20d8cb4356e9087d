package io.regtruth.pipeline.store;

public class BulkStatusUpdateNotAllowedException extends RuntimeException {

    public BulkStatusUpdateNotAllowedException() {
        super("Bulk updates cannot change rule status; use RuleStatusService so every transition is gated and audited");
    }
}
