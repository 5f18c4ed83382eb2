package com.gapfill.store;

import com.gapfill.error.TransientStoreException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface TimeSeriesStore {

    /**
     * Timestamp of the most recent record of {@code key} strictly before {@code before}.
     *
     * @throws TransientStoreException when the series cannot be read
     */
    Optional<Instant> findLastRecordBefore(SeriesKey key, Instant before);

    /**
     * Appends records as-is.
     */
    void append(SeriesKey key, List<? extends TimestampedRecord> records);

    /**
     * Appends only the records whose epoch is not already stored for {@code key}.
     *
     * @return number of records written
     */
    int appendMissing(SeriesKey key, List<? extends TimestampedRecord> records);
}
