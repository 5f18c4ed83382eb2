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
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PolygonBarBackfillerTest {

    private static final Instant FROM = Instant.parse("2021-01-04T15:00:00Z");
    private static final Instant NOW = Instant.parse("2021-01-04T15:10:00Z");

    private PolygonRestClient restClient;
    private TimeSeriesStore store;
    private FetcherProperties properties;
    private PolygonBarBackfiller backfiller;

    @BeforeEach
    void setUp() {
        restClient = mock(PolygonRestClient.class);
        store = mock(TimeSeriesStore.class);
        properties = new FetcherProperties();
        properties.getBackfill().setChunkDays(5);
        backfiller = new PolygonBarBackfiller(restClient, store, properties, Clock.fixed(NOW, ZoneOffset.UTC));
        when(restClient.fetchMinuteBars(anyString(), any(), any())).thenReturn(List.of());
    }

    @Test
    void splitsLongRangeIntoChunks() {
        Instant to = FROM.plus(Duration.ofDays(12));

        backfiller.backfill("aapl", FROM, to);

        verify(restClient).fetchMinuteBars("AAPL", FROM, FROM.plus(Duration.ofDays(5)));
        verify(restClient).fetchMinuteBars("AAPL", FROM.plus(Duration.ofDays(5)), FROM.plus(Duration.ofDays(10)));
        verify(restClient).fetchMinuteBars("AAPL", FROM.plus(Duration.ofDays(10)), to);
        verify(restClient, times(3)).fetchMinuteBars(anyString(), any(), any());
    }

    @Test
    void openEndedRangeRunsUntilNow() {
        backfiller.backfill("AAPL", FROM, null);

        verify(restClient).fetchMinuteBars("AAPL", FROM, NOW);
    }

    @Test
    void emptyRangeFetchesNothing() {
        assertThat(backfiller.backfill("AAPL", NOW, NOW)).isZero();
        assertThat(backfiller.backfill("AAPL", NOW.plusSeconds(60), null)).isZero();

        verifyNoInteractions(restClient, store);
    }

    @Test
    @SuppressWarnings("unchecked")
    void writesBackfillRecordsAndReportsCount() {
        when(restClient.fetchMinuteBars(anyString(), any(), any()))
                .thenReturn(List.of(bar(FROM, 12L), bar(FROM.plusSeconds(60), null), incompleteBar(FROM.plusSeconds(120))));
        when(store.appendMissing(eq(SeriesKey.bars("AAPL")), anyList())).thenReturn(2);

        int written = backfiller.backfill("AAPL", FROM, NOW);

        ArgumentCaptor<List<BarRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(store).appendMissing(eq(SeriesKey.bars("AAPL")), captor.capture());
        List<BarRecord> records = captor.getValue();
        assertThat(written).isEqualTo(2);
        assertThat(records).hasSize(2);
        assertThat(records).allSatisfy(record -> {
            assertThat(record.getSource()).isEqualTo(BarRecord.SOURCE_BACKFILL);
            assertThat(record.getTf()).isEqualTo(SeriesKey.BAR_TIMEFRAME);
            assertThat(record.getTickCount()).isNull();
            assertThat(record.getReceivedAtMs()).isEqualTo(NOW.toEpochMilli());
        });
        assertThat(records.get(0).getEpochMs()).isEqualTo(FROM.toEpochMilli());
        assertThat(records.get(0).getVwap()).isEqualTo(10.2);
    }

    @Test
    @SuppressWarnings("unchecked")
    void tickCountIsWrittenWhenEnabled() {
        properties.setAddBarTickCount(true);
        when(restClient.fetchMinuteBars(anyString(), any(), any()))
                .thenReturn(List.of(bar(FROM, 12L), bar(FROM.plusSeconds(60), null)));

        backfiller.backfill("AAPL", FROM, NOW);

        ArgumentCaptor<List<BarRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(store).appendMissing(eq(SeriesKey.bars("AAPL")), captor.capture());
        assertThat(captor.getValue()).extracting(BarRecord::getTickCount).containsExactly(12L, 0L);
    }

    @Test
    void storeFailureBecomesFetchFailure() {
        when(restClient.fetchMinuteBars(anyString(), any(), any())).thenReturn(List.of(bar(FROM, 1L)));
        when(store.appendMissing(any(), anyList())).thenThrow(new TransientStoreException("disk full", null));

        assertThatThrownBy(() -> backfiller.backfill("AAPL", FROM, NOW))
                .isInstanceOf(FetchException.class)
                .hasCauseInstanceOf(TransientStoreException.class)
                .hasMessageContaining("[AAPL]");
    }

    @Test
    void restFailurePropagates() {
        when(restClient.fetchMinuteBars(anyString(), any(), any())).thenThrow(new FetchException("AAPL", "HTTP 429"));

        assertThatThrownBy(() -> backfiller.backfill("AAPL", FROM, NOW))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("HTTP 429");
        verifyNoInteractions(store);
    }

    private static AggregateBar bar(Instant start, Long tradeCount) {
        AggregateBar bar = new AggregateBar();
        bar.setStartMs(start.toEpochMilli());
        bar.setOpen(10.0);
        bar.setHigh(11.0);
        bar.setLow(9.5);
        bar.setClose(10.5);
        bar.setVolume(1200.0);
        bar.setVwap(10.2);
        bar.setTradeCount(tradeCount);
        return bar;
    }

    private static AggregateBar incompleteBar(Instant start) {
        AggregateBar bar = new AggregateBar();
        bar.setStartMs(start.toEpochMilli());
        bar.setOpen(10.0);
        return bar;
    }
}
