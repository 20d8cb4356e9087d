package io.regtruth.pipeline.domain;

import java.util.Locale;

public enum ResolutionStrategy {
    HIERARCHY,
    TEMPORAL,
    SPECIFICITY,
    CONSERVATIVE,
    AUTO_RESOLVED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ResolutionStrategy fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("resolution_strategy is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
