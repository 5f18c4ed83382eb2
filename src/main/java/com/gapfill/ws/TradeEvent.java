package com.gapfill.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TradeEvent extends PolygonEvent {

    @JsonProperty("x")
    private Integer exchange;

    @JsonProperty("i")
    private String tradeId;

    @JsonProperty("z")
    private Integer tape;

    @JsonProperty("p")
    private Double price;

    @JsonProperty("s")
    private Long size;

    @JsonProperty("c")
    private List<Integer> conditions;

    @JsonProperty("t")
    private Long timestampMs;

    public Integer getExchange() {
        return exchange;
    }

    public void setExchange(Integer exchange) {
        this.exchange = exchange;
    }

    public String getTradeId() {
        return tradeId;
    }

    public void setTradeId(String tradeId) {
        this.tradeId = tradeId;
    }

    public Integer getTape() {
        return tape;
    }

    public void setTape(Integer tape) {
        this.tape = tape;
    }

    public Double getPrice() {
        return price;
    }

    public void setPrice(Double price) {
        this.price = price;
    }

    public Long getSize() {
        return size;
    }

    public void setSize(Long size) {
        this.size = size;
    }

    public List<Integer> getConditions() {
        return conditions;
    }

    public void setConditions(List<Integer> conditions) {
        this.conditions = conditions;
    }

    public Long getTimestampMs() {
        return timestampMs;
    }

    public void setTimestampMs(Long timestampMs) {
        this.timestampMs = timestampMs;
    }
}
