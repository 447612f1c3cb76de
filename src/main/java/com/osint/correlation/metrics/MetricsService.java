package com.osint.correlation.metrics;

import com.osint.correlation.core.model.EntityType;
import com.osint.correlation.core.model.ObservationStatus;

import java.time.Duration;

/**
 * Records pipeline metrics. {@link NoOpMetricsService} is the default so the pipeline
 * works without a metrics registry.
 */
public interface MetricsService {

    void recordSourceQuery(String sourceName, ObservationStatus status, Duration duration);

    void incrementSourceRetry(String sourceName);

    void incrementSourceTimeout(String sourceName);

    void recordComparisons(long comparisons);

    void recordEdgeConfidence(double confidence);

    void incrementEntityCreated(EntityType type);

    void incrementEntityMerged(EntityType type);

    void incrementWriteRejected();

    void recordCacheHit();

    void recordCacheMiss();
}
