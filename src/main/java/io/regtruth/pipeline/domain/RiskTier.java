package io.regtruth.pipeline.domain;

/**
 * Blast radius of a wrong rule. T0 is the most critical.
 */
public enum RiskTier {
    T0,
    T1,
    T2,
    T3;

    public boolean isCritical() {
        return this == T0 || this == T1;
    }
}
