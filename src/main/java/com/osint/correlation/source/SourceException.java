package com.osint.correlation.source;

/**
 * Failure raised by a source adapter. Subclasses decide whether the aggregator retries.
 */
public abstract class SourceException extends RuntimeException {

    private final String sourceName;

    protected SourceException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    protected SourceException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * Returns true if retrying the same call may succeed.
     */
    public abstract boolean isTransient();
}
