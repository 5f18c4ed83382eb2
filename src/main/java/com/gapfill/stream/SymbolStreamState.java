package com.gapfill.stream;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Start time of the last streamed bar per symbol, for the current websocket session.
 */
@Component
public class SymbolStreamState {

    public enum Continuity {
        /** First bar of the symbol in this session. */
        FIRST,
        /** Directly follows the previous bar. */
        CONTIGUOUS,
        /** More than one period after the previous bar. */
        GAP,
        /** Not newer than the previous bar; dropped. */
        STALE
    }

    private final Map<String, AtomicLong> lastBarStartBySymbol = new ConcurrentHashMap<>();

    public long getLastBarStartMs(String symbol) {
        AtomicLong value = lastBarStartBySymbol.get(symbol);
        return value == null ? -1L : value.get();
    }

    public Continuity observe(String symbol, long barStartMs, long periodMs) {
        AtomicLong current = lastBarStartBySymbol.computeIfAbsent(symbol, key -> new AtomicLong(-1L));
        while (true) {
            long existing = current.get();
            if (barStartMs <= existing) {
                return Continuity.STALE;
            }
            if (current.compareAndSet(existing, barStartMs)) {
                if (existing < 0) {
                    return Continuity.FIRST;
                }
                return barStartMs - existing > periodMs ? Continuity.GAP : Continuity.CONTIGUOUS;
            }
        }
    }

    /**
     * Forgets all symbols, so each one signals a possible gap on its next bar.
     */
    public void reset() {
        lastBarStartBySymbol.clear();
    }
}
