package io.regtruth.pipeline.support;

import io.regtruth.pipeline.domain.AuthorityLevel;
import io.regtruth.pipeline.domain.RegulatoryRule;
import io.regtruth.pipeline.domain.RiskTier;
import io.regtruth.pipeline.domain.RuleStatus;
import io.regtruth.pipeline.domain.SourcePointer;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Builder for rules in tests. Defaults describe an approved, confident T2 law effective from 2025-01-01.
 */
public final class RuleFixture {

    private final String id;
    private String conceptSlug = "pdv-standardna-stopa";
    private String value = "25%";
    private AuthorityLevel authority = AuthorityLevel.LAW;
    private RiskTier tier = RiskTier.T2;
    private LocalDate effectiveFrom = LocalDate.of(2025, 1, 1);
    private LocalDate effectiveUntil;
    private double confidence = 0.95;
    private RuleStatus status = RuleStatus.APPROVED;
    private Integer sourceHierarchy;
    private final List<SourcePointer> pointers = new ArrayList<>();

    private RuleFixture(String id) {
        this.id = id;
    }

    public static RuleFixture rule(String id) {
        return new RuleFixture(id);
    }

    public RuleFixture concept(String slug) {
        this.conceptSlug = slug;
        return this;
    }

    public RuleFixture value(String value) {
        this.value = value;
        return this;
    }

    public RuleFixture authority(AuthorityLevel authority) {
        this.authority = authority;
        return this;
    }

    public RuleFixture tier(RiskTier tier) {
        this.tier = tier;
        return this;
    }

    public RuleFixture effective(LocalDate from, LocalDate until) {
        this.effectiveFrom = from;
        this.effectiveUntil = until;
        return this;
    }

    public RuleFixture confidence(double confidence) {
        this.confidence = confidence;
        return this;
    }

    public RuleFixture status(RuleStatus status) {
        this.status = status;
        return this;
    }

    public RuleFixture sourceHierarchy(Integer level) {
        this.sourceHierarchy = level;
        return this;
    }

    public RuleFixture pointer(String pointerId, String extractedValue) {
        pointers.add(new SourcePointer(pointerId, "ev-" + pointerId, "quote " + pointerId, extractedValue, 0.9));
        return this;
    }

    public RegulatoryRule build() {
        return new RegulatoryRule(id, conceptSlug, "Rule " + id, value, "percentage", authority, tier,
                effectiveFrom, effectiveUntil, confidence, status, sourceHierarchy, pointers, null,
                Instant.parse("2025-01-01T00:00:00Z"));
    }
}
