package com.gapfill.stream;

import com.gapfill.config.FetcherProperties;
import com.gapfill.store.BarRecord;
import com.gapfill.store.QuoteRecord;
import com.gapfill.store.SeriesKey;
import com.gapfill.store.TradeRecord;
import com.gapfill.ws.AggregateEvent;
import com.gapfill.ws.QuoteEvent;
import com.gapfill.ws.TradeEvent;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class StreamRecordBuilder {

    private final FetcherProperties properties;

    public StreamRecordBuilder(FetcherProperties properties) {
        this.properties = properties;
    }

    public BarRecord buildBar(AggregateEvent event, long receivedAtMs) {
        if (event == null || event.getSymbol() == null || event.getStartMs() == null) {
            return null;
        }
        if (event.getOpen() == null || event.getHigh() == null || event.getLow() == null || event.getClose() == null) {
            return null;
        }
        BarRecord record = new BarRecord();
        record.setSymbol(event.getSymbol().toUpperCase(Locale.ROOT));
        record.setTf(SeriesKey.BAR_TIMEFRAME);
        record.setEpochMs(event.getStartMs());
        record.setOpen(event.getOpen());
        record.setHigh(event.getHigh());
        record.setLow(event.getLow());
        record.setClose(event.getClose());
        record.setVolume(safeDouble(event.getVolume()));
        record.setVwap(event.getVwap());
        if (properties.isAddBarTickCount()) {
            record.setTickCount(safeLong(event.getTradeCount()));
        }
        record.setSource(BarRecord.SOURCE_STREAM);
        record.setReceivedAtMs(receivedAtMs);
        return record;
    }

    public QuoteRecord buildQuote(QuoteEvent event) {
        if (event == null || event.getSymbol() == null || event.getTimestampMs() == null) {
            return null;
        }
        QuoteRecord record = new QuoteRecord();
        record.setSymbol(event.getSymbol().toUpperCase(Locale.ROOT));
        record.setEpochMs(event.getTimestampMs());
        record.setBidExchange(safeInt(event.getBidExchange()));
        record.setBidPrice(safeDouble(event.getBidPrice()));
        record.setBidSize(safeLong(event.getBidSize()));
        record.setAskExchange(safeInt(event.getAskExchange()));
        record.setAskPrice(safeDouble(event.getAskPrice()));
        record.setAskSize(safeLong(event.getAskSize()));
        record.setCondition(safeInt(event.getCondition()));
        return record;
    }

    public TradeRecord buildTrade(TradeEvent event) {
        if (event == null || event.getSymbol() == null || event.getTimestampMs() == null) {
            return null;
        }
        TradeRecord record = new TradeRecord();
        record.setSymbol(event.getSymbol().toUpperCase(Locale.ROOT));
        record.setEpochMs(event.getTimestampMs());
        record.setExchange(safeInt(event.getExchange()));
        record.setTradeId(event.getTradeId());
        record.setTape(safeInt(event.getTape()));
        record.setPrice(safeDouble(event.getPrice()));
        record.setSize(safeLong(event.getSize()));
        record.setConditions(event.getConditions() == null ? List.of() : event.getConditions());
        return record;
    }

    private double safeDouble(Double value) {
        return value == null ? 0.0d : value;
    }

    private long safeLong(Long value) {
        return value == null ? 0L : value;
    }

    private int safeInt(Integer value) {
        return value == null ? 0 : value;
    }
}
