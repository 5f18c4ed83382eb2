package com.gapfill.config;

import com.gapfill.error.ConfigurationException;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum DataType {

    BARS("bars", "AM"),
    QUOTES("quotes", "Q"),
    TRADES("trades", "T");

    private final String configName;
    private final String channelPrefix;

    DataType(String configName, String channelPrefix) {
        this.configName = configName;
        this.channelPrefix = channelPrefix;
    }

    public String getConfigName() {
        return configName;
    }

    public String getChannelPrefix() {
        return channelPrefix;
    }

    /**
     * Keeps the recognised names and drops the rest. At least one must survive.
     */
    public static Set<DataType> resolve(Collection<String> names) {
        Set<DataType> types = EnumSet.noneOf(DataType.class);
        if (names != null) {
            for (String name : names) {
                if (name == null) {
                    continue;
                }
                String normalized = name.trim().toLowerCase(Locale.ROOT);
                for (DataType type : values()) {
                    if (type.configName.equals(normalized)) {
                        types.add(type);
                    }
                }
            }
        }
        if (types.isEmpty()) {
            throw new ConfigurationException("at least one valid data_type is required, got " + names);
        }
        return types;
    }
}
