package com.gapfill.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AggregateEvent extends PolygonEvent {

    @JsonProperty("v")
    private Double volume;

    @JsonProperty("av")
    private Double accumulatedVolume;

    @JsonProperty("op")
    private Double dayOpen;

    @JsonProperty("vw")
    private Double vwap;

    @JsonProperty("o")
    private Double open;

    @JsonProperty("h")
    private Double high;

    @JsonProperty("l")
    private Double low;

    @JsonProperty("c")
    private Double close;

    @JsonProperty("a")
    private Double dayVwap;

    @JsonProperty("z")
    private Long averageTradeSize;

    @JsonProperty("n")
    private Long tradeCount;

    @JsonProperty("s")
    private Long startMs;

    @JsonProperty("e")
    private Long endMs;

    public Double getVolume() {
        return volume;
    }

    public void setVolume(Double volume) {
        this.volume = volume;
    }

    public Double getAccumulatedVolume() {
        return accumulatedVolume;
    }

    public void setAccumulatedVolume(Double accumulatedVolume) {
        this.accumulatedVolume = accumulatedVolume;
    }

    public Double getDayOpen() {
        return dayOpen;
    }

    public void setDayOpen(Double dayOpen) {
        this.dayOpen = dayOpen;
    }

    public Double getVwap() {
        return vwap;
    }

    public void setVwap(Double vwap) {
        this.vwap = vwap;
    }

    public Double getOpen() {
        return open;
    }

    public void setOpen(Double open) {
        this.open = open;
    }

    public Double getHigh() {
        return high;
    }

    public void setHigh(Double high) {
        this.high = high;
    }

    public Double getLow() {
        return low;
    }

    public void setLow(Double low) {
        this.low = low;
    }

    public Double getClose() {
        return close;
    }

    public void setClose(Double close) {
        this.close = close;
    }

    public Double getDayVwap() {
        return dayVwap;
    }

    public void setDayVwap(Double dayVwap) {
        this.dayVwap = dayVwap;
    }

    public Long getAverageTradeSize() {
        return averageTradeSize;
    }

    public void setAverageTradeSize(Long averageTradeSize) {
        this.averageTradeSize = averageTradeSize;
    }

    public Long getTradeCount() {
        return tradeCount;
    }

    public void setTradeCount(Long tradeCount) {
        this.tradeCount = tradeCount;
    }

    public Long getStartMs() {
        return startMs;
    }

    public void setStartMs(Long startMs) {
        this.startMs = startMs;
    }

    public Long getEndMs() {
        return endMs;
    }

    public void setEndMs(Long endMs) {
        this.endMs = endMs;
    }
}
