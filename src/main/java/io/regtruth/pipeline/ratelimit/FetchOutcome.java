package io.regtruth.pipeline.ratelimit;

import io.regtruth.pipeline.api.exception.ErrorCategory;
import io.regtruth.pipeline.http.FetchResponse;

public sealed interface FetchOutcome {

    record Success(FetchResponse response, int attempts) implements FetchOutcome {}

    record Failure(
            String url,
            ErrorCategory category,
            boolean retryable,
            int attempts,
            String message,
            Integer statusCode
    ) implements FetchOutcome {}

    record CircuitOpen(String domain, String message) implements FetchOutcome {}
}
