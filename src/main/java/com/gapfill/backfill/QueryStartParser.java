package com.gapfill.backfill;

import com.gapfill.error.ConfigurationException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Parses the configured fallback start. Layouts are tried in order and the first match
 * wins; values are read as UTC.
 */
public final class QueryStartParser {

    private static final List<DateTimeFormatter> DATE_TIME_LAYOUTS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm")
    );
    private static final DateTimeFormatter DATE_LAYOUT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private QueryStartParser() {
    }

    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("query_start is empty");
        }
        String trimmed = value.trim();
        DateTimeParseException lastFailure = null;
        for (DateTimeFormatter layout : DATE_TIME_LAYOUTS) {
            try {
                return LocalDateTime.parse(trimmed, layout).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ex) {
                lastFailure = ex;
            }
        }
        try {
            return LocalDate.parse(trimmed, DATE_LAYOUT).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException ex) {
            lastFailure = ex;
        }
        throw new ConfigurationException("query_start '" + value + "' matches no accepted layout", lastFailure);
    }
}
