package com.gapfill.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class PolygonEvent {

    public static final String AGGREGATE_MINUTE = "AM";
    public static final String QUOTE = "Q";
    public static final String TRADE = "T";
    public static final String STATUS = "status";

    @JsonProperty("ev")
    private String eventType;

    @JsonProperty("sym")
    private String symbol;

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public String getSymbol() {
        return symbol;
    }

    public void setSymbol(String symbol) {
        this.symbol = symbol;
    }
}
