package com.gapfill.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gapfill.config.FetcherProperties;
import com.gapfill.error.TransientStoreException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Time-series store laid out as one gzip JSON-lines file per series and day:
 * {@code <dataDir>/<group>/<SYMBOL>/<SYMBOL>-<tf>-<yyyyMMdd>.jsonl.gz}. Each append adds a
 * gzip member, so files can be appended to without rewriting. Writes to one file are
 * serialized; different files are written concurrently.
 */
@Component
public class GzipJsonlTimeSeriesStore implements TimeSeriesStore {

    private static final Logger log = LoggerFactory.getLogger(GzipJsonlTimeSeriesStore.class);
    private static final String SUFFIX = ".jsonl.gz";
    private static final String EPOCH_FIELD = "epochMs";

    private final ObjectMapper objectMapper;
    private final FetcherProperties properties;
    private final DailyPartitionResolver partitionResolver;
    private final Map<Path, Object> fileLocks = new ConcurrentHashMap<>();

    public GzipJsonlTimeSeriesStore(
            ObjectMapper objectMapper,
            FetcherProperties properties,
            DailyPartitionResolver partitionResolver
    ) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.partitionResolver = partitionResolver;
    }

    @Override
    public Optional<Instant> findLastRecordBefore(SeriesKey key, Instant before) {
        long beforeMs = before.toEpochMilli();
        String lastDate = partitionResolver.resolveDate(beforeMs);
        for (Path file : listPartitionsNewestFirst(key)) {
            if (partitionDate(key, file).compareTo(lastDate) > 0) {
                continue;
            }
            long best = Long.MIN_VALUE;
            for (long epochMs : readEpochs(file)) {
                if (epochMs < beforeMs && epochMs > best) {
                    best = epochMs;
                }
            }
            if (best != Long.MIN_VALUE) {
                return Optional.of(Instant.ofEpochMilli(best));
            }
        }
        return Optional.empty();
    }

    @Override
    public void append(SeriesKey key, List<? extends TimestampedRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        for (Map.Entry<String, List<TimestampedRecord>> partition : byPartition(records).entrySet()) {
            Path file = resolveFile(key, partition.getKey());
            synchronized (lockFor(file)) {
                writeLines(file, partition.getValue());
            }
        }
    }

    @Override
    public int appendMissing(SeriesKey key, List<? extends TimestampedRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        int written = 0;
        for (Map.Entry<String, List<TimestampedRecord>> partition : byPartition(records).entrySet()) {
            Path file = resolveFile(key, partition.getKey());
            synchronized (lockFor(file)) {
                Set<Long> present = new HashSet<>(readEpochs(file));
                List<TimestampedRecord> missing = new ArrayList<>();
                for (TimestampedRecord record : partition.getValue()) {
                    if (present.add(record.getEpochMs())) {
                        missing.add(record);
                    }
                }
                writeLines(file, missing);
                written += missing.size();
            }
        }
        log.debug("STORE_APPEND_MISSING key={} offered={} written={}", key, records.size(), written);
        return written;
    }

    Path resolveFile(SeriesKey key, String date) {
        return symbolDir(key).resolve(filePrefix(key) + date + SUFFIX);
    }

    private Map<String, List<TimestampedRecord>> byPartition(List<? extends TimestampedRecord> records) {
        Map<String, List<TimestampedRecord>> partitions = new TreeMap<>();
        for (TimestampedRecord record : records) {
            partitions.computeIfAbsent(partitionResolver.resolveDate(record.getEpochMs()), date -> new ArrayList<>())
                    .add(record);
        }
        return partitions;
    }

    private void writeLines(Path file, List<TimestampedRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        try {
            Files.createDirectories(file.getParent());
            try (GZIPOutputStream gzip = new GZIPOutputStream(Files.newOutputStream(file,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND));
                 BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(gzip, StandardCharsets.UTF_8))) {
                for (TimestampedRecord record : records) {
                    writer.write(objectMapper.writeValueAsString(record));
                    writer.newLine();
                }
            }
        } catch (IOException ex) {
            throw new TransientStoreException("write failed for " + file, ex);
        }
    }

    private List<Long> readEpochs(Path file) {
        List<Long> epochs = new ArrayList<>();
        if (!Files.exists(file)) {
            return epochs;
        }
        try (GZIPInputStream gzip = new GZIPInputStream(Files.newInputStream(file));
             BufferedReader reader = new BufferedReader(new InputStreamReader(gzip, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node = objectMapper.readTree(line);
                JsonNode epoch = node.get(EPOCH_FIELD);
                if (epoch == null || !epoch.isNumber()) {
                    continue;
                }
                epochs.add(epoch.asLong());
            }
        } catch (IOException ex) {
            throw new TransientStoreException("read failed for " + file, ex);
        }
        return epochs;
    }

    private List<Path> listPartitionsNewestFirst(SeriesKey key) {
        Path dir = symbolDir(key);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        String prefix = filePrefix(key);
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                    .filter(path -> {
                        String name = path.getFileName().toString();
                        return name.startsWith(prefix) && name.endsWith(SUFFIX);
                    })
                    .sorted(Comparator.comparing(Path::getFileName).reversed())
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new TransientStoreException("cannot list " + dir, ex);
        }
    }

    private String partitionDate(SeriesKey key, Path file) {
        String name = file.getFileName().toString();
        return name.substring(filePrefix(key).length(), name.length() - SUFFIX.length());
    }

    private Path symbolDir(SeriesKey key) {
        return properties.getDataDir()
                .resolve(key.getAttributeGroup().toLowerCase(Locale.ROOT))
                .resolve(key.getSymbol());
    }

    private String filePrefix(SeriesKey key) {
        return key.getSymbol() + "-" + key.getTimeframe() + "-";
    }

    private Object lockFor(Path file) {
        return fileLocks.computeIfAbsent(file, path -> new Object());
    }
}
