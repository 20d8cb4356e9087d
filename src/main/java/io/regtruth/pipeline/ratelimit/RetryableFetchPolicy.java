package io.regtruth.pipeline.ratelimit;

import io.regtruth.pipeline.http.FetchException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

/**
 * Retries a fetch only while the last failure is a {@link FetchException} whose category is
 * retryable. Anything else, including an open circuit, ends the attempt loop at once.
 */
public class RetryableFetchPolicy extends SimpleRetryPolicy {

    public RetryableFetchPolicy(int maxAttempts) {
        super(maxAttempts);
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable lastError = context.getLastThrowable();
        if (lastError != null && !isRetryable(lastError)) {
            return false;
        }
        return super.canRetry(context);
    }

    static boolean isRetryable(Throwable error) {
        return error instanceof FetchException && ((FetchException) error).isRetryable();
    }
}
