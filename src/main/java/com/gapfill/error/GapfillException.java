package com.gapfill.error;

public class GapfillException extends RuntimeException {

    public GapfillException(String message) {
        super(message);
    }

    public GapfillException(String message, Throwable cause) {
        super(message, cause);
    }
}
