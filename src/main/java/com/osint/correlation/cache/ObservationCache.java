package com.osint.correlation.cache;

import com.osint.correlation.core.model.Observation;

import java.util.List;
import java.util.Optional;

/**
 * Cache of successful source answers, keyed by adapter name and query value.
 * Error observations are never cached.
 */
public interface ObservationCache {

    Optional<List<Observation>> get(String sourceName, String queryValue);

    void put(String sourceName, String queryValue, List<Observation> observations);

    /**
     * Drops every cached answer of one source.
     */
    void invalidateSource(String sourceName);

    void invalidateAll();

    CacheStats getStats();
}
