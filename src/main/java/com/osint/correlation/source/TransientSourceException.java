package com.osint.correlation.source;

/**
 * Network failure, timeout or rate limiting. Retried with backoff.
 */
public class TransientSourceException extends SourceException {

    public TransientSourceException(String sourceName, String message) {
        super(sourceName, message);
    }

    public TransientSourceException(String sourceName, String message, Throwable cause) {
        super(sourceName, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
