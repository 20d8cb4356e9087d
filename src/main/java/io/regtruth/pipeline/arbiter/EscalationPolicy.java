package io.regtruth.pipeline.arbiter;

import io.regtruth.pipeline.config.ArbiterConfig;
import io.regtruth.pipeline.config.PipelineConfig;
import io.regtruth.pipeline.domain.EscalationReason;
import io.regtruth.pipeline.domain.RegulatoryRule;
import io.regtruth.pipeline.domain.ResolutionStrategy;
import io.regtruth.pipeline.domain.RiskTier;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Business rules that send a verdict to a human whatever the model concluded.
 */
@Component
public class EscalationPolicy {

    private final ArbiterConfig config;

    public EscalationPolicy(PipelineConfig pipelineConfig) {
        this.config = pipelineConfig.arbiter();
    }

    public boolean shouldEscalate(RegulatoryRule ruleA, RegulatoryRule ruleB, Arbitration arbitration) {
        if (arbitration.confidence() < config.minModelConfidence()) {
            return true;
        }
        if (bothT0(ruleA, ruleB)) {
            return true;
        }
        // hierarchy cannot break a tie between equal authorities
        if (ruleA.authorityLevel() == ruleB.authorityLevel()
                && arbitration.strategy() == ResolutionStrategy.HIERARCHY) {
            return true;
        }
        if (Objects.equals(ruleA.effectiveFrom(), ruleB.effectiveFrom())
                && arbitration.strategy() == ResolutionStrategy.TEMPORAL) {
            return true;
        }
        return hasLowConfidenceRule(ruleA, ruleB);
    }

    public EscalationReason reasonFor(RegulatoryRule ruleA, RegulatoryRule ruleB, double modelConfidence) {
        if (bothT0(ruleA, ruleB)) {
            return EscalationReason.BOTH_T0;
        }
        if (modelConfidence < config.minModelConfidence()) {
            return EscalationReason.LOW_CONFIDENCE;
        }
        return EscalationReason.EQUAL_AUTHORITY;
    }

    public boolean hasLowConfidenceRule(RegulatoryRule ruleA, RegulatoryRule ruleB) {
        return ruleA.confidence() < config.minRuleConfidence() || ruleB.confidence() < config.minRuleConfidence();
    }

    private boolean bothT0(RegulatoryRule ruleA, RegulatoryRule ruleB) {
        return ruleA.riskTier() == RiskTier.T0 && ruleB.riskTier() == RiskTier.T0;
    }
}
