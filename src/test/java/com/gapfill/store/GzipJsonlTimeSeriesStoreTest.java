package com.gapfill.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gapfill.config.FetcherProperties;
import com.gapfill.error.TransientStoreException;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GzipJsonlTimeSeriesStoreTest {

    private static final Instant DAY1 = Instant.parse("2021-01-04T15:00:00Z");
    private static final Instant DAY2 = Instant.parse("2021-01-05T15:00:00Z");

    @TempDir
    Path dataDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private GzipJsonlTimeSeriesStore store;

    @BeforeEach
    void setUp() {
        FetcherProperties properties = new FetcherProperties();
        properties.setDataDir(dataDir);
        store = new GzipJsonlTimeSeriesStore(objectMapper, properties, new DailyPartitionResolver(properties));
    }

    @Test
    void emptyStoreHasNoHistory() {
        assertThat(store.findLastRecordBefore(SeriesKey.bars("AAPL"), DAY2)).isEmpty();
    }

    @Test
    void lastRecordBeforeIsStrict() {
        SeriesKey key = SeriesKey.bars("AAPL");
        store.append(key, List.of(bar("AAPL", DAY1), bar("AAPL", DAY1.plusSeconds(60))));

        assertThat(store.findLastRecordBefore(key, DAY1.plusSeconds(60))).contains(DAY1);
        assertThat(store.findLastRecordBefore(key, DAY1.plusSeconds(61))).contains(DAY1.plusSeconds(60));
        assertThat(store.findLastRecordBefore(key, DAY1)).isEmpty();
    }

    @Test
    void lastRecordBeforeSearchesOlderPartitions() {
        SeriesKey key = SeriesKey.bars("AAPL");
        store.append(key, List.of(bar("AAPL", DAY1), bar("AAPL", DAY2)));

        assertThat(store.findLastRecordBefore(key, DAY2)).contains(DAY1);
        assertThat(store.findLastRecordBefore(key, DAY2.plusSeconds(3600))).contains(DAY2);
    }

    @Test
    void seriesAreIsolatedBySymbol() {
        store.append(SeriesKey.bars("AAPL"), List.of(bar("AAPL", DAY1)));

        assertThat(store.findLastRecordBefore(SeriesKey.bars("MSFT"), DAY2)).isEmpty();
    }

    @Test
    void appendWritesDailyPartitionFile() throws Exception {
        SeriesKey key = SeriesKey.bars("AAPL");
        store.append(key, List.of(bar("AAPL", DAY1)));

        Path file = dataDir.resolve("ohlcv").resolve("AAPL").resolve("AAPL-1Min-20210104.jsonl.gz");
        assertThat(file).isEqualTo(store.resolveFile(key, "20210104"));
        List<JsonNode> lines = readLines(file);
        assertThat(lines).hasSize(1);
        assertThat(lines.get(0).get("epochMs").asLong()).isEqualTo(DAY1.toEpochMilli());
        assertThat(lines.get(0).get("source").asText()).isEqualTo(BarRecord.SOURCE_STREAM);
    }

    @Test
    void appendMissingSkipsStoredTimestamps() throws Exception {
        SeriesKey key = SeriesKey.bars("AAPL");
        store.append(key, List.of(bar("AAPL", DAY1)));

        int written = store.appendMissing(key, List.of(
                bar("AAPL", DAY1),
                bar("AAPL", DAY1.plusSeconds(60)),
                bar("AAPL", DAY1.plusSeconds(60))));
        int replay = store.appendMissing(key, List.of(bar("AAPL", DAY1.plusSeconds(60))));

        assertThat(written).isEqualTo(1);
        assertThat(replay).isZero();
        assertThat(readLines(store.resolveFile(key, "20210104"))).hasSize(2);
    }

    @Test
    void unreadablePartitionIsTransient() throws Exception {
        SeriesKey key = SeriesKey.bars("AAPL");
        Path file = store.resolveFile(key, "20210104");
        Files.createDirectories(file.getParent());
        Files.write(file, "not gzip".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> store.findLastRecordBefore(key, DAY2))
                .isInstanceOf(TransientStoreException.class)
                .hasMessageContaining("read failed");
    }

    private BarRecord bar(String symbol, Instant start) {
        BarRecord record = new BarRecord();
        record.setSymbol(symbol);
        record.setTf(SeriesKey.BAR_TIMEFRAME);
        record.setEpochMs(start.toEpochMilli());
        record.setOpen(1.0);
        record.setHigh(2.0);
        record.setLow(0.5);
        record.setClose(1.5);
        record.setVolume(100);
        record.setSource(BarRecord.SOURCE_STREAM);
        record.setReceivedAtMs(start.toEpochMilli() + 61_000L);
        return record;
    }

    private List<JsonNode> readLines(Path file) throws Exception {
        List<JsonNode> nodes = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                new GZIPInputStream(Files.newInputStream(file)), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                nodes.add(objectMapper.readTree(line));
            }
        }
        return nodes;
    }
}
