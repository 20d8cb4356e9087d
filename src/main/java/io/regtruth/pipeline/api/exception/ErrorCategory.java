package io.regtruth.pipeline.api.exception;

import java.io.IOException;
import java.net.ConnectException;
import java.net.MalformedURLException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;

public enum ErrorCategory {
    TIMEOUT,              // Connection/read timeout, 408
    CONNECTION_REFUSED,   // Connection refused
    CONNECTION_RESET,     // Reset or hang-up mid-response
    DNS_ERROR,            // Unknown host
    NETWORK_ERROR,        // Other network issues
    IO_ERROR,             // I/O problems
    INVALID_URL,          // Malformed URL
    NOT_FOUND,            // 404 error
    ACCESS_FORBIDDEN,     // 403 error
    AUTH_REQUIRED,        // 401 error
    SERVER_ERROR,         // 500, 501
    SERVER_UNAVAILABLE,   // 502, 503, 504
    HTTP_ERROR,           // Other HTTP errors
    PARSE_ERROR,          // Malformed content
    UNSUPPORTED_CONTENT,  // Content kind we cannot process
    RATE_LIMITED,         // 429 Too Many Requests
    CIRCUIT_OPEN,         // Domain circuit breaker is open
    UNKNOWN;              // Unexpected errors

    private static final List<String> RETRYABLE_MESSAGES = List.of(
            "econnreset", "etimedout", "enotfound", "econnrefused", "eai_again",
            "socket hang up", "connection reset", "network", "timeout", "timed out"
    );

    /**
     * Transient failures worth another attempt after a backoff.
     */
    public boolean isRetryable() {
        return switch (this) {
            case TIMEOUT, CONNECTION_REFUSED, CONNECTION_RESET, DNS_ERROR, NETWORK_ERROR,
                 SERVER_ERROR, SERVER_UNAVAILABLE, RATE_LIMITED -> true;
            default -> false;
        };
    }

    public static ErrorCategory fromStatus(int statusCode) {
        if (statusCode == 408) return TIMEOUT;
        if (statusCode == 429) return RATE_LIMITED;
        if (statusCode == 401) return AUTH_REQUIRED;
        if (statusCode == 403) return ACCESS_FORBIDDEN;
        if (statusCode == 404 || statusCode == 410) return NOT_FOUND;
        if (statusCode == 500 || statusCode == 501) return SERVER_ERROR;
        if (statusCode >= 502 && statusCode <= 504) return SERVER_UNAVAILABLE;
        if (statusCode >= 400) return HTTP_ERROR;
        return UNKNOWN;
    }

    public static ErrorCategory fromException(Throwable error) {
        if (error instanceof MalformedURLException || error instanceof IllegalArgumentException) return INVALID_URL;
        if (error instanceof SocketTimeoutException) return TIMEOUT;
        if (error instanceof ConnectException) return CONNECTION_REFUSED;
        if (error instanceof UnknownHostException) return DNS_ERROR;
        if (error instanceof SocketException) return classifyMessage(error.getMessage(), CONNECTION_RESET);
        if (error instanceof IOException) return classifyMessage(error.getMessage(), IO_ERROR);
        return classifyMessage(error.getMessage(), UNKNOWN);
    }

    private static ErrorCategory classifyMessage(String message, ErrorCategory fallback) {
        if (message == null) return fallback;

        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("timeout") || lower.contains("timed out") || lower.contains("etimedout")) return TIMEOUT;
        if (lower.contains("econnrefused")) return CONNECTION_REFUSED;
        if (lower.contains("enotfound") || lower.contains("eai_again")) return DNS_ERROR;
        if (RETRYABLE_MESSAGES.stream().anyMatch(lower::contains)) return CONNECTION_RESET;
        return fallback;
    }
}
