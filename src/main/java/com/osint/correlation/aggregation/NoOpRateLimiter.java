package com.osint.correlation.aggregation;

/**
 * Never throttles.
 */
public class NoOpRateLimiter implements RateLimiter {

    @Override
    public void acquire(String sourceName) {
    }
}
