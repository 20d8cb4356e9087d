package io.regtruth.pipeline.arbiter;

import io.regtruth.pipeline.domain.AuthorityLevel;
import io.regtruth.pipeline.store.memory.InMemoryRuleGraph;
import io.regtruth.pipeline.store.memory.InMemoryRuleStore;
import io.regtruth.pipeline.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;

import static io.regtruth.pipeline.support.RuleFixture.rule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RulePrecedenceResolverTest {

    private InMemoryRuleStore ruleStore;
    private InMemoryRuleGraph ruleGraph;
    private RulePrecedenceResolver resolver;

    @BeforeEach
    void setUp() {
        ruleStore = new InMemoryRuleStore(new MutableClock(Instant.parse("2025-03-01T00:00:00Z")));
        ruleGraph = new InMemoryRuleGraph();
        resolver = new RulePrecedenceResolver(ruleStore, ruleGraph);
    }

    @Test
    @DisplayName("Should prefer the specific rule that overrides the general ones")
    void shouldApplyLexSpecialis() {
        ruleStore.create(rule("general").authority(AuthorityLevel.LAW).build());
        ruleStore.create(rule("special").concept("pdv-turizam").authority(AuthorityLevel.GUIDANCE).build());
        ruleGraph.addOverride("special", "general");

        PrecedenceResult result = resolver.resolveRulePrecedence(List.of("general", "special"));

        assertThat(result.winningRuleId()).isEqualTo("special");
        assertThat(result.reasoning()).isEqualTo("Lex specialis: rule special (pdv-turizam) overrides 1 general rule(s)");
        assertThat(result.overriddenRuleIds()).containsExactly("general");
    }

    @Test
    @DisplayName("Should follow override chains")
    void shouldFollowOverrideChains() {
        ruleStore.create(rule("a").build());
        ruleStore.create(rule("b").build());
        ruleStore.create(rule("c").build());
        ruleGraph.addOverride("c", "b");
        ruleGraph.addOverride("b", "a");

        assertThat(resolver.resolveRulePrecedence(List.of("a", "b", "c")).winningRuleId()).isEqualTo("c");
    }

    @Test
    @DisplayName("Should fall back to authority without override edges")
    void shouldResolveByAuthority() {
        ruleStore.create(rule("practice").authority(AuthorityLevel.PRACTICE).effective(LocalDate.of(2025, 6, 1), null).build());
        ruleStore.create(rule("law").authority(AuthorityLevel.LAW).build());

        PrecedenceResult result = resolver.resolveRulePrecedence(List.of("practice", "law"));

        assertThat(result.winningRuleId()).isEqualTo("law");
        assertThat(result.reasoning()).isEqualTo("Authority: LAW takes precedence over PRACTICE");
        assertThat(result.overriddenRuleIds()).containsExactly("practice");
    }

    @Test
    @DisplayName("Should pick the most recent rule among equal authorities")
    void shouldResolveByRecency() {
        ruleStore.create(rule("old").effective(LocalDate.of(2013, 1, 1), null).build());
        ruleStore.create(rule("new").effective(LocalDate.of(2025, 1, 1), null).build());

        PrecedenceResult result = resolver.resolveRulePrecedence(List.of("old", "new"));

        assertThat(result.winningRuleId()).isEqualTo("new");
        assertThat(result.reasoning()).isEqualTo("Recency: rule effective from 2025-01-01 is most recent");
    }

    @Test
    @DisplayName("Should break full ties by id regardless of input order")
    void shouldBreakTiesById() {
        ruleStore.create(rule("rule-b").build());
        ruleStore.create(rule("rule-a").build());

        PrecedenceResult first = resolver.resolveRulePrecedence(List.of("rule-b", "rule-a"));
        PrecedenceResult second = resolver.resolveRulePrecedence(List.of("rule-a", "rule-b"));

        assertThat(first).isEqualTo(second);
        assertThat(first.winningRuleId()).isEqualTo("rule-a");
        assertThat(first.reasoning()).isEqualTo("Tiebreak: equal authority and effective date, rule-a is first by id");
    }

    @Test
    @DisplayName("Should short-circuit a single rule and reject empty or unknown input")
    void shouldHandleEdgeCases() {
        assertThat(resolver.resolveRulePrecedence(List.of("x", "x")))
                .isEqualTo(new PrecedenceResult("x", "Single rule matched", List.of()));
        assertThatThrownBy(() -> resolver.resolveRulePrecedence(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No rules to resolve");
        assertThatThrownBy(() -> resolver.resolveRulePrecedence(List.of("x", "y")))
                .isInstanceOf(NoSuchElementException.class);
    }
}
