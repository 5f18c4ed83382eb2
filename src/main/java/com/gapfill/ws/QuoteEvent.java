package com.gapfill.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class QuoteEvent extends PolygonEvent {

    @JsonProperty("bx")
    private Integer bidExchange;

    @JsonProperty("bp")
    private Double bidPrice;

    @JsonProperty("bs")
    private Long bidSize;

    @JsonProperty("ax")
    private Integer askExchange;

    @JsonProperty("ap")
    private Double askPrice;

    @JsonProperty("as")
    private Long askSize;

    @JsonProperty("c")
    private Integer condition;

    @JsonProperty("t")
    private Long timestampMs;

    public Integer getBidExchange() {
        return bidExchange;
    }

    public void setBidExchange(Integer bidExchange) {
        this.bidExchange = bidExchange;
    }

    public Double getBidPrice() {
        return bidPrice;
    }

    public void setBidPrice(Double bidPrice) {
        this.bidPrice = bidPrice;
    }

    public Long getBidSize() {
        return bidSize;
    }

    public void setBidSize(Long bidSize) {
        this.bidSize = bidSize;
    }

    public Integer getAskExchange() {
        return askExchange;
    }

    public void setAskExchange(Integer askExchange) {
        this.askExchange = askExchange;
    }

    public Double getAskPrice() {
        return askPrice;
    }

    public void setAskPrice(Double askPrice) {
        this.askPrice = askPrice;
    }

    public Long getAskSize() {
        return askSize;
    }

    public void setAskSize(Long askSize) {
        this.askSize = askSize;
    }

    public Integer getCondition() {
        return condition;
    }

    public void setCondition(Integer condition) {
        this.condition = condition;
    }

    public Long getTimestampMs() {
        return timestampMs;
    }

    public void setTimestampMs(Long timestampMs) {
        this.timestampMs = timestampMs;
    }
}
