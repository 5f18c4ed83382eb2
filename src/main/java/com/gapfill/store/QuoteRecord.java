package com.gapfill.store;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({
        "symbol",
        "epochMs",
        "bidExchange",
        "bidPrice",
        "bidSize",
        "askExchange",
        "askPrice",
        "askSize",
        "condition"
})
public class QuoteRecord implements TimestampedRecord {

    private String symbol;
    private long epochMs;
    private int bidExchange;
    private double bidPrice;
    private long bidSize;
    private int askExchange;
    private double askPrice;
    private long askSize;
    private int condition;

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

    public int getBidExchange() {
        return bidExchange;
    }

    public void setBidExchange(int bidExchange) {
        this.bidExchange = bidExchange;
    }

    public double getBidPrice() {
        return bidPrice;
    }

    public void setBidPrice(double bidPrice) {
        this.bidPrice = bidPrice;
    }

    public long getBidSize() {
        return bidSize;
    }

    public void setBidSize(long bidSize) {
        this.bidSize = bidSize;
    }

    public int getAskExchange() {
        return askExchange;
    }

    public void setAskExchange(int askExchange) {
        this.askExchange = askExchange;
    }

    public double getAskPrice() {
        return askPrice;
    }

    public void setAskPrice(double askPrice) {
        this.askPrice = askPrice;
    }

    public long getAskSize() {
        return askSize;
    }

    public void setAskSize(long askSize) {
        this.askSize = askSize;
    }

    public int getCondition() {
        return condition;
    }

    public void setCondition(int condition) {
        this.condition = condition;
    }
}
