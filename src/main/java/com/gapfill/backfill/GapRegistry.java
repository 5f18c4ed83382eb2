package com.gapfill.backfill;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Symbols with a pending backfill. Written by the stream router, drained by
 * {@link BackfillScheduler}.
 *
 * <p>Every state transition of a symbol is a single {@code compute*} call on the backing map,
 * so a claim can never overwrite a marker written after it was read: a {@link #markPending}
 * racing with a claim either lands before it (and is claimed) or after it (and replaces the
 * in-flight sentinel, to be claimed on the next scan).
 *
 * <p>Symbols are claimed in the order they became pending. A symbol marked again while still
 * pending keeps its place; one marked again after being claimed goes to the back.
 */
@Component
public class GapRegistry {

    private static final Logger log = LoggerFactory.getLogger(GapRegistry.class);

    private final Map<String, GapMarker> markers = new ConcurrentHashMap<>();
    private final Map<String, Integer> requeueAttempts = new ConcurrentHashMap<>();
    private final Queue<String> pendingOrder = new ConcurrentLinkedQueue<>();

    /**
     * Registers a possible gap for {@code symbol} ending at {@code lastKnownTimestamp}. Last write wins.
     */
    public void markPending(String symbol, Instant lastKnownTimestamp) {
        String key = normalize(symbol);
        GapMarker previous = markers.put(key, GapMarker.pending(lastKnownTimestamp));
        if (previous == null || !previous.isPending()) {
            pendingOrder.offer(key);
        }
        log.debug("GAP_MARKED symbol={} lastKnown={} previous={}", key, lastKnownTimestamp, previous);
    }

    /**
     * Moves up to {@code limit} pending symbols to in-flight and returns them.
     */
    public List<GapClaim> claimAll(int limit) {
        List<GapClaim> claims = new ArrayList<>();
        if (limit <= 0) {
            return claims;
        }
        String symbol;
        while (claims.size() < limit && (symbol = pendingOrder.poll()) != null) {
            AtomicReference<GapMarker> claimed = new AtomicReference<>();
            markers.computeIfPresent(symbol, (key, marker) -> {
                if (!marker.isPending()) {
                    return marker;
                }
                claimed.set(marker);
                return GapMarker.IN_FLIGHT;
            });
            GapMarker marker = claimed.get();
            if (marker != null) {
                claims.add(new GapClaim(symbol, marker.getLastKnownTimestamp()));
            }
        }
        return claims;
    }

    /**
     * Ends an in-flight claim. A marker written while the task ran is kept.
     */
    public void release(String symbol) {
        markers.computeIfPresent(normalize(symbol), (key, marker) -> marker.isInFlight() ? null : marker);
    }

    /**
     * Ends an in-flight claim and a successful run: clears the retry budget as well.
     */
    public void complete(String symbol) {
        String key = normalize(symbol);
        requeueAttempts.remove(key);
        release(key);
    }

    /**
     * Puts a failed claim back to pending so the next scan retries it, unless a fresher
     * marker arrived meanwhile or the symbol already used {@code maxAttempts} re-queues.
     *
     * @return true if the claim was put back; false when the budget is spent or a fresher
     *         marker already took its place
     */
    public boolean requeue(GapClaim claim, int maxAttempts) {
        String key = normalize(claim.getSymbol());
        int attempts = requeueAttempts.merge(key, 1, Integer::sum);
        if (attempts > maxAttempts) {
            requeueAttempts.remove(key);
            release(key);
            return false;
        }
        AtomicBoolean requeued = new AtomicBoolean();
        markers.computeIfPresent(key, (k, marker) -> {
            if (!marker.isInFlight()) {
                return marker;
            }
            requeued.set(true);
            return GapMarker.pending(claim.getLastKnownTimestamp());
        });
        if (requeued.get()) {
            pendingOrder.offer(key);
        }
        return requeued.get();
    }

    public Optional<GapMarker> marker(String symbol) {
        return Optional.ofNullable(markers.get(normalize(symbol)));
    }

    public int pendingCount() {
        int count = 0;
        for (GapMarker marker : markers.values()) {
            if (marker.isPending()) {
                count++;
            }
        }
        return count;
    }

    private String normalize(String symbol) {
        return Objects.requireNonNull(symbol, "symbol").toUpperCase(Locale.ROOT);
    }
}
