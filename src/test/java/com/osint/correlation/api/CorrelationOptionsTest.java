package com.osint.correlation.api;

import com.osint.correlation.correlation.AlgorithmWeights;
import com.osint.correlation.correlation.algorithm.AlgorithmType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CorrelationOptions Tests")
class CorrelationOptionsTest {

    @Nested
    @DisplayName("Presets")
    class PresetTests {

        @Test
        @DisplayName("Defaults enable every algorithm with equal weights")
        void defaults() {
            CorrelationOptions options = CorrelationOptions.defaults();

            assertEquals(10, options.getMaxConcurrentRequests());
            assertEquals(Duration.ofSeconds(30), options.getPerSourceTimeout());
            assertEquals(3, options.getMaxRetryAttempts());
            assertEquals(0.6, options.getCorrelationThreshold());
            assertEquals(0.0, options.getMinClusterConfidence());
            assertEquals(4, options.getMaxTraversalDepth());
            assertEquals(EnumSet.allOf(AlgorithmType.class), options.getEnabledAlgorithms());
            assertTrue(options.getBatchTimeout().isEmpty());
            assertFalse(options.isParallelScoring());
        }

        @Test
        @DisplayName("Conservative raises the threshold and sets a merge floor")
        void conservative() {
            CorrelationOptions options = CorrelationOptions.conservative();

            assertEquals(0.8, options.getCorrelationThreshold());
            assertEquals(0.5, options.getMinClusterConfidence());
        }

        @Test
        @DisplayName("toBuilder copies every setting")
        void toBuilder() {
            CorrelationOptions original = CorrelationOptions.builder()
                    .maxConcurrentRequests(3)
                    .batchTimeout(Duration.ofSeconds(9))
                    .enabledAlgorithms(Set.of(AlgorithmType.USERNAME, AlgorithmType.EMAIL))
                    .algorithmWeights(AlgorithmWeights.of(Map.of("username", 2.0)))
                    .parallelScoring(true)
                    .build();

            CorrelationOptions copy = original.toBuilder().correlationThreshold(0.9).build();

            assertEquals(3, copy.getMaxConcurrentRequests());
            assertEquals(Duration.ofSeconds(9), copy.getBatchTimeout().orElseThrow());
            assertEquals(Set.of(AlgorithmType.USERNAME, AlgorithmType.EMAIL), copy.getEnabledAlgorithms());
            assertEquals(2.0, copy.getAlgorithmWeights().weightFor("username"));
            assertTrue(copy.isParallelScoring());
            assertEquals(0.9, copy.getCorrelationThreshold());
            assertEquals(0.6, original.getCorrelationThreshold());
        }

        @Test
        @DisplayName("Retry policy reflects the retry settings")
        void retryPolicy() {
            CorrelationOptions options = CorrelationOptions.builder().maxRetryAttempts(5).build();

            assertEquals(5, options.retryPolicy().maxRetries());
            assertEquals(6, options.retryPolicy().maxAttempts());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Out-of-range values are rejected")
        void rejectsInvalid() {
            assertThrows(IllegalArgumentException.class, () -> CorrelationOptions.builder().maxConcurrentRequests(0));
            assertThrows(IllegalArgumentException.class, () -> CorrelationOptions.builder().perSourceTimeout(Duration.ZERO));
            assertThrows(IllegalArgumentException.class, () -> CorrelationOptions.builder().maxRetryAttempts(-1));
            assertThrows(IllegalArgumentException.class, () -> CorrelationOptions.builder().correlationThreshold(1.5));
            assertThrows(IllegalArgumentException.class, () -> CorrelationOptions.builder().minClusterConfidence(Double.NaN));
            assertThrows(IllegalArgumentException.class, () -> CorrelationOptions.builder().maxTraversalDepth(0));
            assertThrows(IllegalArgumentException.class, () -> CorrelationOptions.builder().enabledAlgorithms(Set.of()));
            assertThrows(IllegalArgumentException.class, () -> CorrelationOptions.builder().algorithmWeights(null));
        }

        @Test
        @DisplayName("Max retry delay below the base delay is rejected")
        void retryDelays() {
            assertThrows(IllegalArgumentException.class, () -> CorrelationOptions.builder()
                    .retryBaseDelay(Duration.ofSeconds(2))
                    .retryMaxDelay(Duration.ofSeconds(1))
                    .build());
        }

        @Test
        @DisplayName("Enabled algorithms must carry some weight")
        void zeroWeightedAlgorithms() {
            assertThrows(IllegalArgumentException.class, () -> CorrelationOptions.builder()
                    .enabledAlgorithms(Set.of(AlgorithmType.TEMPORAL))
                    .algorithmWeights(AlgorithmWeights.of(Map.of("temporal", 0.0)))
                    .build());
        }
    }
}
