package com.gapfill.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Data types and symbol allowlist the stream is subscribed to. An empty allowlist, or one
 * containing {@code *}, admits every symbol.
 */
public class Subscription {

    private static final String WILDCARD = "*";

    private final Set<DataType> dataTypes;
    private final Set<String> symbols;

    public Subscription(Set<DataType> dataTypes, List<String> symbols) {
        this.dataTypes = Collections.unmodifiableSet(dataTypes);
        Set<String> normalized = new LinkedHashSet<>();
        if (symbols != null) {
            for (String symbol : symbols) {
                if (symbol != null && !symbol.isBlank()) {
                    normalized.add(symbol.trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        this.symbols = Collections.unmodifiableSet(normalized);
    }

    public static Subscription from(FetcherProperties properties) {
        return new Subscription(DataType.resolve(properties.getDataTypes()), properties.getSymbols());
    }

    public Set<DataType> getDataTypes() {
        return dataTypes;
    }

    public boolean includes(DataType type) {
        return dataTypes.contains(type);
    }

    public boolean isAllSymbols() {
        return symbols.isEmpty() || symbols.contains(WILDCARD);
    }

    public boolean admits(String symbol) {
        return isAllSymbols() || (symbol != null && symbols.contains(symbol.toUpperCase(Locale.ROOT)));
    }

    /**
     * Channel list for the subscribe message, e.g. {@code AM.*,Q.*} or {@code AM.AAPL,AM.MSFT}.
     */
    public String channels() {
        List<String> channels = new ArrayList<>();
        for (DataType type : dataTypes) {
            if (isAllSymbols()) {
                channels.add(type.getChannelPrefix() + "." + WILDCARD);
                continue;
            }
            for (String symbol : symbols) {
                channels.add(type.getChannelPrefix() + "." + symbol);
            }
        }
        return String.join(",", channels);
    }
}
