package com.gapfill.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({
        "symbol",
        "tf",
        "epochMs",
        "open",
        "high",
        "low",
        "close",
        "volume",
        "vwap",
        "tickCount",
        "source",
        "receivedAtMs"
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BarRecord implements TimestampedRecord {

    public static final String SOURCE_STREAM = "stream";
    public static final String SOURCE_BACKFILL = "backfill";

    private String symbol;
    private String tf;
    private long epochMs;
    private double open;
    private double high;
    private double low;
    private double close;
    private double volume;
    private Double vwap;
    private Long tickCount;
    private String source;
    private long receivedAtMs;

    @Override
    public String getSymbol() {
        return symbol;
    }

    public void setSymbol(String symbol) {
        this.symbol = symbol;
    }

    public String getTf() {
        return tf;
    }

    public void setTf(String tf) {
        this.tf = tf;
    }

    @Override
    public long getEpochMs() {
        return epochMs;
    }

    public void setEpochMs(long epochMs) {
        this.epochMs = epochMs;
    }

    public double getOpen() {
        return open;
    }

    public void setOpen(double open) {
        this.open = open;
    }

    public double getHigh() {
        return high;
    }

    public void setHigh(double high) {
        this.high = high;
    }

    public double getLow() {
        return low;
    }

    public void setLow(double low) {
        this.low = low;
    }

    public double getClose() {
        return close;
    }

    public void setClose(double close) {
        this.close = close;
    }

    public double getVolume() {
        return volume;
    }

    public void setVolume(double volume) {
        this.volume = volume;
    }

    public Double getVwap() {
        return vwap;
    }

    public void setVwap(Double vwap) {
        this.vwap = vwap;
    }

    public Long getTickCount() {
        return tickCount;
    }

    public void setTickCount(Long tickCount) {
        this.tickCount = tickCount;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public long getReceivedAtMs() {
        return receivedAtMs;
    }

    public void setReceivedAtMs(long receivedAtMs) {
        this.receivedAtMs = receivedAtMs;
    }
}
