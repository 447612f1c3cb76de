package com.osint.correlation.cache;

import com.osint.correlation.core.model.Observation;

import java.util.List;
import java.util.Optional;

/**
 * Cache that never stores anything. Default when caching is not configured.
 */
public class NoOpObservationCache implements ObservationCache {

    @Override
    public Optional<List<Observation>> get(String sourceName, String queryValue) {
        return Optional.empty();
    }

    @Override
    public void put(String sourceName, String queryValue, List<Observation> observations) {
    }

    @Override
    public void invalidateSource(String sourceName) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
