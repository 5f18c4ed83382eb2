package com.gapfill.backfill;

import com.gapfill.config.FetcherProperties;
import com.gapfill.error.ConfigurationException;
import com.gapfill.error.TransientStoreException;
import com.gapfill.store.SeriesKey;
import com.gapfill.store.TimeSeriesStore;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RangeResolver {

    private static final Logger log = LoggerFactory.getLogger(RangeResolver.class);

    /**
     * One bar period, kept between the query cutoff and the bar that revealed the gap. The
     * cutoff is exclusive, so a bar starting exactly one period before the end time is not
     * used as the gap start; the backfill then begins one stored bar earlier and the
     * overlap is skipped on write.
     */
    static final Duration SAFETY_MARGIN = Duration.ofMinutes(1);

    private final TimeSeriesStore store;
    private final FetcherProperties properties;

    public RangeResolver(TimeSeriesStore store, FetcherProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    /**
     * Determines where the gap of {@code symbol} ending at {@code endTime} starts.
     *
     * @return the range to backfill, or empty when there is nothing to backfill
     * @throws ConfigurationException when the configured fallback start cannot be parsed
     * @throws TransientStoreException when the store cannot be queried
     */
    public Optional<ResolvedRange> resolve(String symbol, Instant endTime) {
        if (properties.hasQueryStart()) {
            Instant from = QueryStartParser.parse(properties.getQueryStart());
            log.debug("RANGE_FALLBACK symbol={} from={}", symbol, from);
            return Optional.of(ResolvedRange.openEnded(symbol, from));
        }
        SeriesKey key = SeriesKey.bars(symbol);
        Instant cutoff = endTime.minus(SAFETY_MARGIN);
        Optional<Instant> last;
        try {
            last = store.findLastRecordBefore(key, cutoff);
        } catch (TransientStoreException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new TransientStoreException("query failed for " + key, ex);
        }
        if (last.isEmpty()) {
            log.debug("RANGE_NO_HISTORY key={} cutoff={}", key, cutoff);
            return Optional.empty();
        }
        return Optional.of(ResolvedRange.openEnded(symbol, last.get()));
    }
}
