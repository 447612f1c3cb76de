package com.osint.correlation.metrics;

import com.osint.correlation.core.model.EntityType;
import com.osint.correlation.core.model.ObservationStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordSourceQuery("github", ObservationStatus.FOUND, Duration.ofMillis(100));
                noOp.incrementSourceRetry("github");
                noOp.incrementSourceTimeout("github");
                noOp.recordComparisons(10);
                noOp.recordEdgeConfidence(0.9);
                noOp.incrementEntityCreated(EntityType.PERSON);
                noOp.incrementEntityMerged(EntityType.USERNAME);
                noOp.incrementWriteRejected();
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should time source queries by source and status")
        void recordSourceQuery() {
            metrics.recordSourceQuery("github", ObservationStatus.FOUND, Duration.ofMillis(150));
            metrics.recordSourceQuery("github", ObservationStatus.FOUND, Duration.ofMillis(250));
            metrics.recordSourceQuery("github", ObservationStatus.ERROR, Duration.ofMillis(30));

            Timer found = registry.find("osint.source.query.duration")
                    .tag("source", "github")
                    .tag("status", "FOUND")
                    .timer();

            assertNotNull(found);
            assertEquals(2, found.count());
            assertEquals(1, registry.find("osint.source.query.duration").tag("status", "ERROR").timer().count());
        }

        @Test
        @DisplayName("Should count retries and timeouts per source")
        void sourceCounters() {
            metrics.incrementSourceRetry("github");
            metrics.incrementSourceRetry("github");
            metrics.incrementSourceRetry("gitlab");
            metrics.incrementSourceTimeout("gitlab");

            assertEquals(2.0, registry.find("osint.source.retry").tag("source", "github").counter().count());
            assertEquals(1.0, registry.find("osint.source.retry").tag("source", "gitlab").counter().count());
            assertEquals(1.0, registry.find("osint.source.timeout").tag("source", "gitlab").counter().count());
        }

        @Test
        @DisplayName("Should summarise comparisons and edge confidence")
        void summaries() {
            metrics.recordComparisons(6);
            metrics.recordComparisons(4);
            metrics.recordEdgeConfidence(0.8);
            metrics.recordEdgeConfidence(0.6);

            DistributionSummary comparisons = registry.find("osint.correlation.comparisons").summary();
            DistributionSummary confidence = registry.find("osint.correlation.edge.confidence").summary();

            assertEquals(2, comparisons.count());
            assertEquals(10.0, comparisons.totalAmount(), 0.001);
            assertEquals(0.7, confidence.mean(), 0.001);
        }

        @Test
        @DisplayName("Should count entity writes by type")
        void entityCounters() {
            metrics.incrementEntityCreated(EntityType.PERSON);
            metrics.incrementEntityCreated(EntityType.PERSON);
            metrics.incrementEntityCreated(EntityType.EMAIL);
            metrics.incrementEntityMerged(EntityType.PERSON);

            Counter person = registry.find("osint.entity.created").tag("entityType", "PERSON").counter();
            assertNotNull(person);
            assertEquals(2.0, person.count());
            assertEquals(1.0, registry.find("osint.entity.created").tag("entityType", "EMAIL").counter().count());
            assertEquals(1.0, registry.find("osint.entity.merged").tag("entityType", "PERSON").counter().count());
        }

        @Test
        @DisplayName("Should count rejections and cache traffic")
        void simpleCounters() {
            metrics.incrementWriteRejected();
            metrics.recordCacheHit();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();

            assertEquals(1.0, registry.find("osint.graph.write.rejected").counter().count());
            assertEquals(2.0, registry.find("osint.cache.hit").counter().count());
            assertEquals(1.0, registry.find("osint.cache.miss").counter().count());
        }
    }
}
