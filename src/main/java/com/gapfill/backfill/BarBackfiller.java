package com.gapfill.backfill;

import com.gapfill.error.FetchException;
import java.time.Instant;

/**
 * Fetches and persists the bars of one symbol for {@code [from, to)}.
 */
public interface BarBackfiller {

    /**
     * @param to exclusive end, or null for "through now"
     * @return number of bars written
     * @throws FetchException when fetching or writing fails
     */
    int backfill(String symbol, Instant from, Instant to);
}
