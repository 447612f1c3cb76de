package com.osint.correlation.metrics;

import com.osint.correlation.core.model.EntityType;
import com.osint.correlation.core.model.ObservationStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code osint.source.query.duration} - Timer (tags: source, status)</li>
 *   <li>{@code osint.source.retry} - Counter (tag: source)</li>
 *   <li>{@code osint.source.timeout} - Counter (tag: source)</li>
 *   <li>{@code osint.correlation.comparisons} - DistributionSummary, pairwise comparisons per run</li>
 *   <li>{@code osint.correlation.edge.confidence} - DistributionSummary</li>
 *   <li>{@code osint.entity.created} - Counter (tag: entityType)</li>
 *   <li>{@code osint.entity.merged} - Counter (tag: entityType)</li>
 *   <li>{@code osint.graph.write.rejected} - Counter</li>
 *   <li>{@code osint.cache.hit} / {@code osint.cache.miss} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary comparisonSummary;
    private final DistributionSummary edgeConfidenceSummary;
    private final Counter writeRejectedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.comparisonSummary = DistributionSummary.builder("osint.correlation.comparisons")
                .description("Pairwise comparisons performed per correlation run")
                .register(registry);
        this.edgeConfidenceSummary = DistributionSummary.builder("osint.correlation.edge.confidence")
                .description("Combined confidence of emitted correlation edges")
                .register(registry);
        this.writeRejectedCounter = Counter.builder("osint.graph.write.rejected")
                .description("Graph writes rejected for invariant violations")
                .register(registry);
        this.cacheHitCounter = Counter.builder("osint.cache.hit")
                .description("Observation cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("osint.cache.miss")
                .description("Observation cache misses")
                .register(registry);
    }

    @Override
    public void recordSourceQuery(String sourceName, ObservationStatus status, Duration duration) {
        String key = sourceName + ":" + status.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("osint.source.query.duration")
                        .description("Duration of settled source queries, retries included")
                        .tag("source", sourceName)
                        .tag("status", status.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementSourceRetry(String sourceName) {
        sourceCounter("osint.source.retry", "Source call retries", sourceName).increment();
    }

    @Override
    public void incrementSourceTimeout(String sourceName) {
        sourceCounter("osint.source.timeout", "Source calls cancelled on timeout", sourceName).increment();
    }

    @Override
    public void recordComparisons(long comparisons) {
        comparisonSummary.record(comparisons);
    }

    @Override
    public void recordEdgeConfidence(double confidence) {
        edgeConfidenceSummary.record(confidence);
    }

    @Override
    public void incrementEntityCreated(EntityType type) {
        entityCounter("osint.entity.created", "New entities written to the graph", type).increment();
    }

    @Override
    public void incrementEntityMerged(EntityType type) {
        entityCounter("osint.entity.merged", "Entities absorbed by another entity", type).increment();
    }

    @Override
    public void incrementWriteRejected() {
        writeRejectedCounter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter sourceCounter(String name, String description, String sourceName) {
        return counterCache.computeIfAbsent(name + ":" + sourceName, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("source", sourceName)
                        .register(registry));
    }

    private Counter entityCounter(String name, String description, EntityType type) {
        return counterCache.computeIfAbsent(name + ":" + type.name(), k ->
                Counter.builder(name)
                        .description(description)
                        .tag("entityType", type.name())
                        .register(registry));
    }
}
