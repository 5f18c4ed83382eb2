package com.gapfill.error;

/**
 * Invalid configuration. Fatal at startup; when raised while resolving a gap it abandons
 * that symbol's attempt only.
 */
public class ConfigurationException extends GapfillException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
