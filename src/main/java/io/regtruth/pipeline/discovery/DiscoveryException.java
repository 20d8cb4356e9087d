package io.regtruth.pipeline.discovery;

import io.regtruth.pipeline.api.exception.ErrorCategory;

public class DiscoveryException extends Exception {
    private final ErrorCategory category;

    public DiscoveryException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public DiscoveryException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
