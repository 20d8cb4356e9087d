package io.regtruth.pipeline.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DiscoveredItemStatusTest {

    @Test
    @DisplayName("Should treat SKIPPED as terminal, including towards itself")
    void shouldKeepSkippedTerminal() {
        for (DiscoveredItemStatus target : DiscoveredItemStatus.values()) {
            assertThat(DiscoveredItemStatus.SKIPPED.canTransitionTo(target)).as("SKIPPED -> %s", target).isFalse();
        }
    }

    @Test
    @DisplayName("Should allow the sanctioned backward moves to PENDING")
    void shouldAllowRequeueAndRetry() {
        assertThat(DiscoveredItemStatus.FETCHED.canTransitionTo(DiscoveredItemStatus.PENDING)).isTrue();
        assertThat(DiscoveredItemStatus.PROCESSED.canTransitionTo(DiscoveredItemStatus.PENDING)).isTrue();
        assertThat(DiscoveredItemStatus.FAILED.canTransitionTo(DiscoveredItemStatus.PENDING)).isTrue();
        assertThat(DiscoveredItemStatus.PROCESSED.canTransitionTo(DiscoveredItemStatus.FETCHED)).isFalse();
        assertThat(DiscoveredItemStatus.FAILED.canTransitionTo(DiscoveredItemStatus.PROCESSED)).isFalse();
    }

    @Test
    @DisplayName("Should let a rescan keep the current live status")
    void shouldAllowRescanInPlace() {
        assertThat(DiscoveredItemStatus.FETCHED.canTransitionTo(DiscoveredItemStatus.FETCHED)).isTrue();
        assertThat(DiscoveredItemStatus.PROCESSED.canTransitionTo(DiscoveredItemStatus.PROCESSED)).isTrue();
    }
}
