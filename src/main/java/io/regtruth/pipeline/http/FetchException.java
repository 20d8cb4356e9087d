package io.regtruth.pipeline.http;

import io.regtruth.pipeline.api.exception.ErrorCategory;

public class FetchException extends Exception {
    private final ErrorCategory category;
    private final Integer statusCode;

    public FetchException(String message, ErrorCategory category) {
        this(message, null, category, null);
    }

    public FetchException(String message, Throwable cause, ErrorCategory category) {
        this(message, cause, category, null);
    }

    public FetchException(String message, Throwable cause, ErrorCategory category, Integer statusCode) {
        super(message, cause);
        this.category = category;
        this.statusCode = statusCode;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return category.isRetryable();
    }
}
