package com.osint.correlation.api;

import com.osint.correlation.correlation.algorithm.AlgorithmType;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CorrelationConfigLoader Tests")
class CorrelationConfigLoaderTest {

    private static Config configOf(Map<String, String> properties) {
        return new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(properties, "test", 500))
                .build();
    }

    @Test
    @DisplayName("Missing keys fall back to the defaults")
    void emptyConfig() {
        CorrelationOptions options = new CorrelationConfigLoader(configOf(Map.of())).load();

        assertEquals(CorrelationOptions.defaults().toString(), options.toString());
    }

    @Test
    @DisplayName("Every key is read into the options")
    void readsAllKeys() {
        Map<String, String> properties = new HashMap<>();
        properties.put("osint.correlation.max-concurrent-requests", "4");
        properties.put("osint.correlation.per-source-timeout-seconds", "12");
        properties.put("osint.correlation.max-retry-attempts", "1");
        properties.put("osint.correlation.retry-base-delay-millis", "50");
        properties.put("osint.correlation.retry-max-delay-millis", "400");
        properties.put("osint.correlation.batch-timeout-seconds", "90");
        properties.put("osint.correlation.correlation-threshold", "0.75");
        properties.put("osint.correlation.min-cluster-confidence", "0.4");
        properties.put("osint.correlation.max-traversal-depth", "3");
        properties.put("osint.correlation.parallel-scoring", "true");
        properties.put("osint.correlation.algorithms", "username, email");
        properties.put("osint.correlation.weights.username", "2.5");
        properties.put("osint.correlation.weights.attribute", "0.5");

        CorrelationOptions options = new CorrelationConfigLoader(configOf(properties)).load();

        assertEquals(4, options.getMaxConcurrentRequests());
        assertEquals(Duration.ofSeconds(12), options.getPerSourceTimeout());
        assertEquals(1, options.getMaxRetryAttempts());
        assertEquals(Duration.ofMillis(50), options.getRetryBaseDelay());
        assertEquals(Duration.ofMillis(400), options.getRetryMaxDelay());
        assertEquals(Duration.ofSeconds(90), options.getBatchTimeout().orElseThrow());
        assertEquals(0.75, options.getCorrelationThreshold());
        assertEquals(0.4, options.getMinClusterConfidence());
        assertEquals(3, options.getMaxTraversalDepth());
        assertTrue(options.isParallelScoring());
        assertEquals(EnumSet.of(AlgorithmType.USERNAME, AlgorithmType.EMAIL), options.getEnabledAlgorithms());
        assertEquals(2.5, options.getAlgorithmWeights().weightFor("username"));
        assertEquals(0.5, options.getAlgorithmWeights().weightFor("attribute"));
        assertEquals(1.0, options.getAlgorithmWeights().weightFor("email"));
    }

    @Test
    @DisplayName("Invalid values fail with IllegalArgumentException")
    void invalidValues() {
        CorrelationConfigLoader threshold = new CorrelationConfigLoader(
                configOf(Map.of("osint.correlation.correlation-threshold", "1.4")));
        CorrelationConfigLoader algorithm = new CorrelationConfigLoader(
                configOf(Map.of("osint.correlation.algorithms", "username,phonetic")));

        assertThrows(IllegalArgumentException.class, threshold::load);
        assertThrows(IllegalArgumentException.class, algorithm::load);
    }

    @Test
    @DisplayName("Algorithm lists tolerate blanks and case")
    void parseAlgorithms() {
        assertEquals(EnumSet.of(AlgorithmType.NETWORK, AlgorithmType.TEMPORAL),
                CorrelationConfigLoader.parseAlgorithms(" Network,,TEMPORAL "));
    }

    @Test
    @DisplayName("The default loader reads microprofile-config.properties")
    void defaultConfig() {
        CorrelationOptions options = new CorrelationConfigLoader().load();

        assertEquals(6, options.getMaxTraversalDepth());
        assertEquals(0.7, options.getCorrelationThreshold());
        assertEquals(2.0, options.getAlgorithmWeights().weightFor("username"));
    }
}
