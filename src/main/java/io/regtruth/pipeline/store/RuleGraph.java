package io.regtruth.pipeline.store;

/**
 * OVERRIDES edges between rules: a more specific provision displacing a general one.
 */
public interface RuleGraph {

    void addOverride(String overridingRuleId, String overriddenRuleId);

    /**
     * True when {@code a} overrides {@code b} directly or through a chain of overrides.
     */
    boolean overrides(String a, String b);
}
