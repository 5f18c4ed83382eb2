package com.gapfill.backfill;

import com.gapfill.config.FetcherProperties;
import com.gapfill.error.FetchException;
import com.gapfill.error.TransientStoreException;
import com.gapfill.rest.AggregateBar;
import com.gapfill.rest.PolygonRestClient;
import com.gapfill.store.BarRecord;
import com.gapfill.store.SeriesKey;
import com.gapfill.store.TimeSeriesStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Requests minute bars window by window and appends the ones the store does not hold yet,
 * so replaying a range leaves existing data untouched.
 */
@Component
public class PolygonBarBackfiller implements BarBackfiller {

    private static final Logger log = LoggerFactory.getLogger(PolygonBarBackfiller.class);

    private final PolygonRestClient restClient;
    private final TimeSeriesStore store;
    private final FetcherProperties properties;
    private final Clock clock;

    @Autowired
    public PolygonBarBackfiller(PolygonRestClient restClient, TimeSeriesStore store, FetcherProperties properties) {
        this(restClient, store, properties, Clock.systemUTC());
    }

    public PolygonBarBackfiller(
            PolygonRestClient restClient,
            TimeSeriesStore store,
            FetcherProperties properties,
            Clock clock
    ) {
        this.restClient = restClient;
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public int backfill(String symbol, Instant from, Instant to) {
        String normalized = symbol.toUpperCase(Locale.ROOT);
        Instant end = to == null ? clock.instant() : to;
        if (!from.isBefore(end)) {
            return 0;
        }
        SeriesKey key = SeriesKey.bars(normalized);
        Duration window = Duration.ofDays(properties.getBackfill().getChunkDays());
        int written = 0;
        Instant windowStart = from;
        while (windowStart.isBefore(end)) {
            Instant windowEnd = windowStart.plus(window);
            if (windowEnd.isAfter(end)) {
                windowEnd = end;
            }
            List<AggregateBar> bars = restClient.fetchMinuteBars(normalized, windowStart, windowEnd);
            List<BarRecord> records = toRecords(normalized, bars);
            try {
                written += store.appendMissing(key, records);
            } catch (TransientStoreException ex) {
                throw new FetchException(normalized, "write failed for " + key, ex);
            }
            log.debug("BACKFILL_WINDOW key={} from={} to={} fetched={}", key, windowStart, windowEnd, bars.size());
            windowStart = windowEnd;
        }
        return written;
    }

    private List<BarRecord> toRecords(String symbol, List<AggregateBar> bars) {
        long receivedAt = clock.millis();
        List<BarRecord> records = new ArrayList<>(bars.size());
        for (AggregateBar bar : bars) {
            if (bar.getOpen() == null || bar.getHigh() == null || bar.getLow() == null || bar.getClose() == null) {
                continue;
            }
            BarRecord record = new BarRecord();
            record.setSymbol(symbol);
            record.setTf(SeriesKey.BAR_TIMEFRAME);
            record.setEpochMs(bar.getStartMs());
            record.setOpen(bar.getOpen());
            record.setHigh(bar.getHigh());
            record.setLow(bar.getLow());
            record.setClose(bar.getClose());
            record.setVolume(bar.getVolume() == null ? 0.0d : bar.getVolume());
            record.setVwap(bar.getVwap());
            if (properties.isAddBarTickCount()) {
                record.setTickCount(bar.getTradeCount() == null ? 0L : bar.getTradeCount());
            }
            record.setSource(BarRecord.SOURCE_BACKFILL);
            record.setReceivedAtMs(receivedAt);
            records.add(record);
        }
        return records;
    }
}
