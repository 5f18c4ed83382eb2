package com.gapfill.error;

/**
 * Remote fetch or write of a backfill range failed.
 */
public class FetchException extends GapfillException {

    private final String symbol;

    public FetchException(String symbol, String message) {
        super("[" + symbol + "] " + message);
        this.symbol = symbol;
    }

    public FetchException(String symbol, String message, Throwable cause) {
        super("[" + symbol + "] " + message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
