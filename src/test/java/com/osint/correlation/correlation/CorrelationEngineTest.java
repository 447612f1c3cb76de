package com.osint.correlation.correlation;

import com.osint.correlation.aggregation.CancellationToken;
import com.osint.correlation.api.CorrelationOptions;
import com.osint.correlation.core.model.CorrelationEdge;
import com.osint.correlation.core.model.Observation;
import com.osint.correlation.correlation.algorithm.AlgorithmType;
import com.osint.correlation.correlation.algorithm.CorrelationAlgorithm;
import com.osint.correlation.metrics.MicrometerMetricsService;
import com.osint.correlation.tracing.NoOpTracingService;
import com.osint.correlation.tracing.PipelineStage;
import com.osint.correlation.tracing.Span;
import com.osint.correlation.tracing.TracingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("CorrelationEngine Tests")
class CorrelationEngineTest {

    private static List<Observation> sample() {
        return List.of(
                Observation.found("github", "john_doe", Map.of("location", "Berlin")),
                Observation.found("twitter", "John.Doe", Map.of("location", "Berlin")),
                Observation.found("reddit", "johndoe1987", Map.of()),
                Observation.found("hibp", "john.doe@acme.io", Map.of()),
                Observation.found("gravatar", "john_doe@acme.io", Map.of()),
                Observation.notFound("steam", "john_doe"),
                Observation.error("keybase", "john_doe", "timeout"),
                Observation.found("mastodon", "zed", Map.of()));
    }

    @Nested
    @DisplayName("Scoring")
    class ScoringTests {

        private final CorrelationEngine engine = new CorrelationEngine(CorrelationOptions.defaults());

        @Test
        @DisplayName("Cross-platform separator variants produce an edge")
        void crossPlatformEdge() {
            CorrelationReport report = engine.correlate(sample());

            assertTrue(report.edges().stream().anyMatch(edge ->
                    edge.sourceObservationId().equals("github:john_doe")
                            && edge.targetObservationId().equals("twitter:John.Doe")
                            && edge.confidence() >= 0.6));
        }

        @Test
        @DisplayName("Every edge confidence lies strictly above the threshold and within [0,1]")
        void edgesAboveThreshold() {
            for (CorrelationEdge edge : engine.correlate(sample()).edges()) {
                assertTrue(edge.confidence() > CorrelationOptions.defaults().getCorrelationThreshold());
                assertTrue(edge.confidence() <= 1.0);
            }
        }

        @Test
        @DisplayName("Observations that were not found are never scored")
        void onlyFoundObservations() {
            for (CorrelationEdge edge : engine.correlate(sample()).edges()) {
                assertFalse(edge.sourceObservationId().startsWith("steam"));
                assertFalse(edge.targetObservationId().startsWith("keybase"));
                assertFalse(edge.sourceObservationId().startsWith("keybase"));
            }
        }

        @Test
        @DisplayName("A pair with no applicable algorithm emits nothing")
        void noApplicableAlgorithm() {
            Observation a = Observation.found("hibp", "a@one.org", Map.of());
            Observation b = Observation.found("hibp", "b@two.org", Map.of());
            assertTrue(engine.scorePair(a, b).isEmpty());
        }

        @Test
        @DisplayName("A score exactly at the threshold is not emitted")
        void thresholdIsExclusive() {
            CorrelationEngine strict = new CorrelationEngine(CorrelationOptions.builder()
                    .enabledAlgorithms(EnumSet.of(AlgorithmType.EMAIL))
                    .correlationThreshold(0.65)
                    .build());
            Observation a = Observation.found("hibp", "john.doe@acme.io", Map.of());
            Observation b = Observation.found("hibp", "john_doe@acme.io", Map.of());

            assertTrue(strict.scorePair(a, b).isEmpty());
        }

        @Test
        @DisplayName("Duplicate observation ids are rejected")
        void duplicateIds() {
            Observation a = Observation.found("github", "jd", Map.of());
            assertThrows(IllegalArgumentException.class, () -> engine.correlate(List.of(a, a)));
        }
    }

    @Nested
    @DisplayName("Blocking")
    class BlockingTests {

        private final CorrelationEngine engine = new CorrelationEngine(CorrelationOptions.defaults());

        @Test
        @DisplayName("Observations without a shared blocking key are never compared")
        void noSharedKeys() {
            List<Observation> observations = List.of(
                    Observation.found("github", "alice", Map.of()),
                    Observation.found("github", "bob", Map.of()),
                    Observation.found("hibp", "carol@example.org", Map.of()));

            CorrelationReport report = engine.correlate(observations);

            assertEquals(0, report.candidatePairs());
            assertEquals(0, report.comparisons());
            assertTrue(report.edges().isEmpty());
        }

        @Test
        @DisplayName("A pair sharing several keys is compared once")
        void pairCountedOnce() {
            List<Observation> observations = List.of(
                    Observation.found("hibp", "john@acme.io", Map.of()),
                    Observation.found("gravatar", "john@acme.io", Map.of("username", "john")));

            assertEquals(1, engine.candidatePairs(observations).size());
        }
    }

    @Nested
    @DisplayName("Determinism and cancellation")
    class DeterminismTests {

        @Test
        @DisplayName("Same input gives the same edges regardless of order or parallelism")
        void deterministic() {
            CorrelationEngine sequential = new CorrelationEngine(CorrelationOptions.defaults());
            CorrelationEngine parallel = new CorrelationEngine(CorrelationOptions.builder()
                    .parallelScoring(true).build());

            List<Observation> shuffled = new ArrayList<>(sample());
            Collections.reverse(shuffled);

            List<CorrelationEdge> first = sequential.correlate(sample()).edges();
            assertEquals(first, sequential.correlate(shuffled).edges());
            assertEquals(first, parallel.correlate(shuffled).edges());
        }

        @Test
        @DisplayName("A cancelled token stops scoring and marks the report")
        void cancelled() {
            CancellationToken token = CancellationToken.create();
            token.cancel();

            CorrelationReport report = new CorrelationEngine(CorrelationOptions.defaults())
                    .correlate(sample(), token);

            assertTrue(report.cancelled());
            assertEquals(0, report.comparisons());
            assertTrue(report.edges().isEmpty());
        }
    }

    @Test
    @DisplayName("Comparisons and edge confidences are recorded as metrics")
    void recordsMetrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        CorrelationEngine engine = new CorrelationEngine(CorrelationOptions.defaults(),
                AlgorithmType.defaultRegistry(), new ObservationBlockingKeyStrategy(),
                new MicrometerMetricsService(registry), new NoOpTracingService());

        CorrelationReport report = engine.correlate(sample());

        assertEquals(report.comparisons(),
                (long) registry.find("osint.correlation.comparisons").summary().totalAmount());
        assertEquals(report.edges().size(),
                registry.find("osint.correlation.edge.confidence").summary().count());
    }

    @Test
    @DisplayName("A failing algorithm marks the correlate span as failed and propagates")
    void failingAlgorithmFailsSpan() {
        TracingService tracing = mock(TracingService.class);
        Span span = mock(Span.class);
        when(tracing.startSpan(eq(PipelineStage.CORRELATE), anyMap())).thenReturn(span);
        IllegalStateException failure = new IllegalStateException("scorer failed");
        CorrelationAlgorithm broken = mock(CorrelationAlgorithm.class);
        when(broken.score(any(), any())).thenThrow(failure);
        Map<AlgorithmType, CorrelationAlgorithm> registry = new EnumMap<>(AlgorithmType.defaultRegistry());
        registry.put(AlgorithmType.USERNAME, broken);
        CorrelationEngine engine = new CorrelationEngine(CorrelationOptions.defaults(), registry,
                new ObservationBlockingKeyStrategy(), null, tracing);

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> engine.correlate(sample()));

        assertSame(failure, thrown);
        verify(span).fail(failure);
        verify(span, never()).setStatus(Span.SpanStatus.OK);
        verify(span).close();
    }

    @Test
    @DisplayName("An enabled algorithm without an implementation is a configuration error")
    void missingImplementation() {
        assertThrows(IllegalArgumentException.class, () -> new CorrelationEngine(CorrelationOptions.defaults(),
                Map.of(), new ObservationBlockingKeyStrategy(), null, null));
    }
}
