package com.gapfill.stream;

import com.gapfill.backfill.GapRegistry;
import com.gapfill.config.DataType;
import com.gapfill.config.Subscription;
import com.gapfill.store.BarRecord;
import com.gapfill.store.QuoteRecord;
import com.gapfill.store.SeriesKey;
import com.gapfill.store.TimeSeriesStore;
import com.gapfill.store.TradeRecord;
import com.gapfill.ws.AggregateEvent;
import com.gapfill.ws.PolygonEvent;
import com.gapfill.ws.QuoteEvent;
import com.gapfill.ws.StatusEvent;
import com.gapfill.ws.TradeEvent;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Dispatches live events to the store and reports possible gaps to {@link GapRegistry}.
 * A symbol is reported when its first bar of a session arrives, and whenever a bar starts
 * more than one period after the previous one. Bars already written by a backfill are not
 * written again.
 */
@Component
public class StreamRouter {

    private static final Logger log = LoggerFactory.getLogger(StreamRouter.class);
    private static final long BAR_PERIOD_MS = Duration.ofMinutes(1).toMillis();

    private final TimeSeriesStore store;
    private final GapRegistry gapRegistry;
    private final SymbolStreamState streamState;
    private final StreamRecordBuilder recordBuilder;
    private final Subscription subscription;
    private final Clock clock;

    @Autowired
    public StreamRouter(
            TimeSeriesStore store,
            GapRegistry gapRegistry,
            SymbolStreamState streamState,
            StreamRecordBuilder recordBuilder,
            Subscription subscription
    ) {
        this(store, gapRegistry, streamState, recordBuilder, subscription, Clock.systemUTC());
    }

    public StreamRouter(
            TimeSeriesStore store,
            GapRegistry gapRegistry,
            SymbolStreamState streamState,
            StreamRecordBuilder recordBuilder,
            Subscription subscription,
            Clock clock
    ) {
        this.store = store;
        this.gapRegistry = gapRegistry;
        this.streamState = streamState;
        this.recordBuilder = recordBuilder;
        this.subscription = subscription;
        this.clock = clock;
    }

    public void route(PolygonEvent event) {
        if (event instanceof StatusEvent) {
            onStatus((StatusEvent) event);
            return;
        }
        if (!subscription.admits(event.getSymbol())) {
            return;
        }
        if (event instanceof AggregateEvent && subscription.includes(DataType.BARS)) {
            onBar((AggregateEvent) event);
        } else if (event instanceof QuoteEvent && subscription.includes(DataType.QUOTES)) {
            onQuote((QuoteEvent) event);
        } else if (event instanceof TradeEvent && subscription.includes(DataType.TRADES)) {
            onTrade((TradeEvent) event);
        }
    }

    void onStatus(StatusEvent event) {
        if (event.isConnected()) {
            streamState.reset();
            log.info("WS_SESSION_START message={}", event.getMessage());
        } else if (event.isAuthFailure()) {
            log.error("WS_AUTH_FAIL message={}", event.getMessage());
        } else {
            log.info("WS_STATUS status={} message={}", event.getStatus(), event.getMessage());
        }
    }

    void onBar(AggregateEvent event) {
        BarRecord record = recordBuilder.buildBar(event, clock.millis());
        if (record == null) {
            return;
        }
        String symbol = record.getSymbol();
        SymbolStreamState.Continuity continuity = streamState.observe(symbol, record.getEpochMs(), BAR_PERIOD_MS);
        if (continuity == SymbolStreamState.Continuity.STALE) {
            log.info("SKIP_DUP symbol={} epochMs={} last={}",
                    symbol,
                    record.getEpochMs(),
                    streamState.getLastBarStartMs(symbol));
            return;
        }
        if (store.appendMissing(SeriesKey.bars(symbol), List.of(record)) == 0) {
            log.debug("SKIP_STORED symbol={} epochMs={}", symbol, record.getEpochMs());
        }
        if (continuity == SymbolStreamState.Continuity.FIRST || continuity == SymbolStreamState.Continuity.GAP) {
            Instant lastKnown = Instant.ofEpochMilli(record.getEpochMs());
            gapRegistry.markPending(symbol, lastKnown);
            log.info("GAP_SUSPECTED symbol={} reason={} lastKnown={}", symbol, continuity, lastKnown);
        }
    }

    void onQuote(QuoteEvent event) {
        QuoteRecord record = recordBuilder.buildQuote(event);
        if (record == null) {
            return;
        }
        store.append(SeriesKey.quotes(record.getSymbol()), List.of(record));
    }

    void onTrade(TradeEvent event) {
        TradeRecord record = recordBuilder.buildTrade(event);
        if (record == null) {
            return;
        }
        store.append(SeriesKey.trades(record.getSymbol()), List.of(record));
    }
}
