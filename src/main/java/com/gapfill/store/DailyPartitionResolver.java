package com.gapfill.store;

import com.gapfill.config.FetcherProperties;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

@Component
public class DailyPartitionResolver {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.BASIC_ISO_DATE;

    private final FetcherProperties properties;

    public DailyPartitionResolver(FetcherProperties properties) {
        this.properties = properties;
    }

    public LocalDate resolveLocalDate(long epochMs) {
        return Instant.ofEpochMilli(epochMs)
                .atZone(properties.getPartitionZone())
                .toLocalDate();
    }

    public String resolveDate(long epochMs) {
        return format(resolveLocalDate(epochMs));
    }

    public String format(LocalDate date) {
        return FORMATTER.format(date);
    }
}
