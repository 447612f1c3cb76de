package com.osint.correlation.source;

/**
 * Malformed input or response, authentication failure. Never retried.
 */
public class PermanentSourceException extends SourceException {

    public PermanentSourceException(String sourceName, String message) {
        super(sourceName, message);
    }

    public PermanentSourceException(String sourceName, String message, Throwable cause) {
        super(sourceName, message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
