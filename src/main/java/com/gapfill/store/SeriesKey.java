package com.gapfill.store;

import java.util.Locale;
import java.util.Objects;

/**
 * Canonical key of one time series, rendered as {@code SYMBOL/TIMEFRAME/GROUP}.
 */
public final class SeriesKey {

    public static final String BAR_TIMEFRAME = "1Min";
    public static final String TICK_TIMEFRAME = "1Sec";

    private final String symbol;
    private final String timeframe;
    private final String attributeGroup;

    public SeriesKey(String symbol, String timeframe, String attributeGroup) {
        this.symbol = Objects.requireNonNull(symbol, "symbol").toUpperCase(Locale.ROOT);
        this.timeframe = Objects.requireNonNull(timeframe, "timeframe");
        this.attributeGroup = Objects.requireNonNull(attributeGroup, "attributeGroup").toUpperCase(Locale.ROOT);
    }

    public static SeriesKey bars(String symbol) {
        return new SeriesKey(symbol, BAR_TIMEFRAME, "OHLCV");
    }

    public static SeriesKey quotes(String symbol) {
        return new SeriesKey(symbol, TICK_TIMEFRAME, "QUOTE");
    }

    public static SeriesKey trades(String symbol) {
        return new SeriesKey(symbol, TICK_TIMEFRAME, "TRADE");
    }

    public String getSymbol() {
        return symbol;
    }

    public String getTimeframe() {
        return timeframe;
    }

    public String getAttributeGroup() {
        return attributeGroup;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SeriesKey)) {
            return false;
        }
        SeriesKey other = (SeriesKey) o;
        return symbol.equals(other.symbol)
                && timeframe.equals(other.timeframe)
                && attributeGroup.equals(other.attributeGroup);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, timeframe, attributeGroup);
    }

    @Override
    public String toString() {
        return symbol + "/" + timeframe + "/" + attributeGroup;
    }
}
