package com.gapfill.backfill;

import java.time.Instant;
import java.util.Objects;

/**
 * Value held by {@link GapRegistry} for a symbol. A symbol absent from the registry is clean.
 */
public final class GapMarker {

    public static final GapMarker IN_FLIGHT = new GapMarker(null);

    private final Instant lastKnownTimestamp;

    private GapMarker(Instant lastKnownTimestamp) {
        this.lastKnownTimestamp = lastKnownTimestamp;
    }

    public static GapMarker pending(Instant lastKnownTimestamp) {
        return new GapMarker(Objects.requireNonNull(lastKnownTimestamp, "lastKnownTimestamp"));
    }

    public boolean isPending() {
        return lastKnownTimestamp != null;
    }

    public boolean isInFlight() {
        return lastKnownTimestamp == null;
    }

    public Instant getLastKnownTimestamp() {
        return lastKnownTimestamp;
    }

    @Override
    public String toString() {
        return isPending() ? "Pending(" + lastKnownTimestamp + ")" : "InFlight";
    }
}
