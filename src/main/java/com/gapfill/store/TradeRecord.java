package com.gapfill.store;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

@JsonPropertyOrder({
        "symbol",
        "epochMs",
        "exchange",
        "tradeId",
        "tape",
        "price",
        "size",
        "conditions"
})
public class TradeRecord implements TimestampedRecord {

    private String symbol;
    private long epochMs;
    private int exchange;
    private String tradeId;
    private int tape;
    private double price;
    private long size;
    private List<Integer> conditions;

    @Override
    public String getSymbol() {
        return symbol;
    }

    public void setSymbol(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public long getEpochMs() {
        return epochMs;
    }

    public void setEpochMs(long epochMs) {
        this.epochMs = epochMs;
    }

    public int getExchange() {
        return exchange;
    }

    public void setExchange(int exchange) {
        this.exchange = exchange;
    }

    public String getTradeId() {
        return tradeId;
    }

    public void setTradeId(String tradeId) {
        this.tradeId = tradeId;
    }

    public int getTape() {
        return tape;
    }

    public void setTape(int tape) {
        this.tape = tape;
    }

    public double getPrice() {
        return price;
    }

    public void setPrice(double price) {
        this.price = price;
    }

    public long getSize() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    public List<Integer> getConditions() {
        return conditions;
    }

    public void setConditions(List<Integer> conditions) {
        this.conditions = conditions;
    }
}
