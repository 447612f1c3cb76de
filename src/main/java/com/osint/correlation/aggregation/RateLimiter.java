package com.osint.correlation.aggregation;

/**
 * Per-source request throttle consulted before every adapter attempt.
 */
public interface RateLimiter {

    /**
     * Blocks until the source may be queried again.
     *
     * @throws InterruptedException when the waiting thread is interrupted (batch cancelled)
     */
    void acquire(String sourceName) throws InterruptedException;
}
