package com.osint.correlation.metrics;

import com.osint.correlation.core.model.EntityType;
import com.osint.correlation.core.model.ObservationStatus;

import java.time.Duration;

/**
 * Metrics service that discards everything.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordSourceQuery(String sourceName, ObservationStatus status, Duration duration) {
    }

    @Override
    public void incrementSourceRetry(String sourceName) {
    }

    @Override
    public void incrementSourceTimeout(String sourceName) {
    }

    @Override
    public void recordComparisons(long comparisons) {
    }

    @Override
    public void recordEdgeConfidence(double confidence) {
    }

    @Override
    public void incrementEntityCreated(EntityType type) {
    }

    @Override
    public void incrementEntityMerged(EntityType type) {
    }

    @Override
    public void incrementWriteRejected() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
