package com.gapfill.config;

import com.gapfill.error.ConfigurationException;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriptionTest {

    @Test
    void wildcardChannelsWhenNoSymbolsConfigured() {
        Subscription subscription = new Subscription(EnumSet.of(DataType.BARS, DataType.QUOTES), List.of());

        assertThat(subscription.isAllSymbols()).isTrue();
        assertThat(subscription.admits("anything")).isTrue();
        assertThat(subscription.channels()).isEqualTo("AM.*,Q.*");
    }

    @Test
    void perSymbolChannels() {
        Subscription subscription = new Subscription(EnumSet.of(DataType.BARS), List.of("aapl", " msft "));

        assertThat(subscription.channels()).isEqualTo("AM.AAPL,AM.MSFT");
        assertThat(subscription.admits("AAPL")).isTrue();
        assertThat(subscription.admits("msft")).isTrue();
        assertThat(subscription.admits("TSLA")).isFalse();
    }

    @Test
    void explicitWildcardAdmitsAll() {
        Subscription subscription = new Subscription(EnumSet.of(DataType.TRADES), List.of("*"));

        assertThat(subscription.channels()).isEqualTo("T.*");
    }

    @Test
    void unknownDataTypesAreDropped() {
        FetcherProperties properties = new FetcherProperties();
        properties.setDataTypes(List.of("bars", "Quotes", "options"));

        Subscription subscription = Subscription.from(properties);

        assertThat(subscription.getDataTypes()).containsExactly(DataType.BARS, DataType.QUOTES);
    }

    @Test
    void noValidDataTypeIsRejected() {
        assertThatThrownBy(() -> DataType.resolve(List.of("options", "forex")))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> DataType.resolve(List.of()))
                .isInstanceOf(ConfigurationException.class);
    }
}
