package io.regtruth.pipeline.config;

import java.time.Duration;
import java.util.List;

public record HttpConfig(
        int connectTimeout,
        int readTimeout,
        int maxRetries,
        Duration baseRetryDelay,
        Duration maxRetryDelay,
        List<String> userAgents
) {
    public HttpConfig {
        connectTimeout = connectTimeout > 0 ? connectTimeout : 30_000;
        readTimeout = readTimeout > 0 ? readTimeout : 30_000;
        maxRetries = Math.max(0, maxRetries);
        baseRetryDelay = baseRetryDelay != null ? baseRetryDelay : Duration.ofSeconds(1);
        maxRetryDelay = maxRetryDelay != null ? maxRetryDelay : Duration.ofSeconds(30);
        userAgents = userAgents == null || userAgents.isEmpty()
                ? List.of("RegulatoryTruthBot/1.0")
                : List.copyOf(userAgents);
    }

    public static HttpConfig defaults() {
        return new HttpConfig(30_000, 30_000, 3, null, null, null);
    }
}
