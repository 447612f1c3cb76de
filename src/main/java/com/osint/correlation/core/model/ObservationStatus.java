package com.osint.correlation.core.model;

/**
 * Outcome of a single source query.
 */
public enum ObservationStatus {
    /**
     * The source reported a matching profile or record.
     */
    FOUND,

    /**
     * The source answered and reported no match.
     */
    NOT_FOUND,

    /**
     * The source could not answer (timeout, transport failure, malformed response).
     * Recorded only after retries are exhausted or for non-retryable failures.
     */
    ERROR
}
