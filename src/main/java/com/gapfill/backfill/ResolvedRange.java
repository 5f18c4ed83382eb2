package com.gapfill.backfill;

import java.time.Instant;

/**
 * Range handed to a {@link BarBackfiller}. A null {@code to} means "through now".
 */
public final class ResolvedRange {

    private final String symbol;
    private final Instant from;
    private final Instant to;

    public ResolvedRange(String symbol, Instant from, Instant to) {
        this.symbol = symbol;
        this.from = from;
        this.to = to;
    }

    public static ResolvedRange openEnded(String symbol, Instant from) {
        return new ResolvedRange(symbol, from, null);
    }

    public String getSymbol() {
        return symbol;
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    public boolean isOpenEnded() {
        return to == null;
    }

    @Override
    public String toString() {
        return symbol + "[" + from + ", " + (to == null ? "now" : to) + ")";
    }
}
