package com.gapfill.backfill;

import java.time.Instant;

public final class GapClaim {

    private final String symbol;
    private final Instant lastKnownTimestamp;

    public GapClaim(String symbol, Instant lastKnownTimestamp) {
        this.symbol = symbol;
        this.lastKnownTimestamp = lastKnownTimestamp;
    }

    public String getSymbol() {
        return symbol;
    }

    public Instant getLastKnownTimestamp() {
        return lastKnownTimestamp;
    }

    @Override
    public String toString() {
        return symbol + "@" + lastKnownTimestamp;
    }
}
