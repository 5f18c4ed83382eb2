package com.gapfill.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FetcherPropertiesTest {

    @Test
    void ceilingScalesWithProcessors() {
        FetcherProperties.BackfillProperties backfill = new FetcherProperties.BackfillProperties();

        assertThat(backfill.resolveConcurrencyCeiling(4)).isEqualTo(40);
        assertThat(backfill.resolveConcurrencyCeiling(0)).isEqualTo(10);
    }

    @Test
    void explicitMaximumWins() {
        FetcherProperties.BackfillProperties backfill = new FetcherProperties.BackfillProperties();
        backfill.setMaxConcurrency(3);

        assertThat(backfill.resolveConcurrencyCeiling(16)).isEqualTo(3);
    }

    @Test
    void queryStartIsOptional() {
        FetcherProperties properties = new FetcherProperties();
        assertThat(properties.hasQueryStart()).isFalse();

        properties.setQueryStart("  ");
        assertThat(properties.hasQueryStart()).isFalse();

        properties.setQueryStart("2021-01-04");
        assertThat(properties.hasQueryStart()).isTrue();
    }
}
