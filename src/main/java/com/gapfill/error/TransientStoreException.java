package com.gapfill.error;

/**
 * Failure to read or query the persisted time-series store.
 */
public class TransientStoreException extends GapfillException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
