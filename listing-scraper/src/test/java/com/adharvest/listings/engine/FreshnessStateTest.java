package com.adharvest.listings.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FreshnessStateTest {

    @Test
    void shouldCountBackToBackStaleListings() {
        FreshnessState state = new FreshnessState();
        state.observe(Freshness.STALE);
        state.observe(Freshness.STALE);

        assertThat(state.consecutiveStale()).isEqualTo(2);
        assertThat(state.limitExceeded(2)).isFalse();
        assertThat(state.limitExceeded(1)).isTrue();
    }

    @Test
    void shouldResetOnFreshListing() {
        FreshnessState state = new FreshnessState();
        state.observe(Freshness.STALE);
        state.observe(Freshness.STALE);
        state.observe(Freshness.FRESH);

        assertThat(state.consecutiveStale()).isZero();
    }

    @Test
    void shouldNeverTriggerWithZeroLimit() {
        FreshnessState state = new FreshnessState();
        for (int i = 0; i < 100; i++) {
            state.observe(Freshness.STALE);
        }

        assertThat(state.limitExceeded(0)).isFalse();
    }
}
