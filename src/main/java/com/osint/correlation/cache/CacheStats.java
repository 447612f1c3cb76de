package com.osint.correlation.cache;

/**
 * Snapshot of cache counters.
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }

    public double hitRate() {
        long requests = hitCount + missCount;
        return requests == 0 ? 0.0 : (double) hitCount / requests;
    }
}
