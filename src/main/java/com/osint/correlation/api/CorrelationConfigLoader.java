package com.osint.correlation.api;

import com.osint.correlation.correlation.AlgorithmWeights;
import com.osint.correlation.correlation.algorithm.AlgorithmType;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds {@link CorrelationOptions} from MicroProfile Config.
 *
 * <p>Keys, all optional and falling back to {@link CorrelationOptions#defaults()}:</p>
 * <pre>
 * osint.correlation.max-concurrent-requests=10
 * osint.correlation.per-source-timeout-seconds=30
 * osint.correlation.max-retry-attempts=3
 * osint.correlation.retry-base-delay-millis=200
 * osint.correlation.retry-max-delay-millis=5000
 * osint.correlation.batch-timeout-seconds=120
 * osint.correlation.correlation-threshold=0.6
 * osint.correlation.min-cluster-confidence=0.0
 * osint.correlation.max-traversal-depth=4
 * osint.correlation.parallel-scoring=false
 * osint.correlation.algorithms=username,email,metadata,network,temporal
 * osint.correlation.weights.username=2.0
 * </pre>
 *
 * Invalid values fail with {@link IllegalArgumentException} from the options builder.
 */
public final class CorrelationConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(CorrelationConfigLoader.class);

    static final String PREFIX = "osint.correlation.";

    private final Config config;

    public CorrelationConfigLoader() {
        this(ConfigProvider.getConfig());
    }

    public CorrelationConfigLoader(Config config) {
        this.config = Objects.requireNonNull(config, "config is required");
    }

    public CorrelationOptions load() {
        CorrelationOptions.Builder builder = CorrelationOptions.builder();

        config.getOptionalValue(PREFIX + "max-concurrent-requests", Integer.class)
                .ifPresent(builder::maxConcurrentRequests);
        config.getOptionalValue(PREFIX + "per-source-timeout-seconds", Long.class)
                .ifPresent(seconds -> builder.perSourceTimeout(Duration.ofSeconds(seconds)));
        config.getOptionalValue(PREFIX + "max-retry-attempts", Integer.class)
                .ifPresent(builder::maxRetryAttempts);
        config.getOptionalValue(PREFIX + "retry-base-delay-millis", Long.class)
                .ifPresent(millis -> builder.retryBaseDelay(Duration.ofMillis(millis)));
        config.getOptionalValue(PREFIX + "retry-max-delay-millis", Long.class)
                .ifPresent(millis -> builder.retryMaxDelay(Duration.ofMillis(millis)));
        config.getOptionalValue(PREFIX + "batch-timeout-seconds", Long.class)
                .ifPresent(seconds -> builder.batchTimeout(Duration.ofSeconds(seconds)));
        config.getOptionalValue(PREFIX + "correlation-threshold", Double.class)
                .ifPresent(builder::correlationThreshold);
        config.getOptionalValue(PREFIX + "min-cluster-confidence", Double.class)
                .ifPresent(builder::minClusterConfidence);
        config.getOptionalValue(PREFIX + "max-traversal-depth", Integer.class)
                .ifPresent(builder::maxTraversalDepth);
        config.getOptionalValue(PREFIX + "parallel-scoring", Boolean.class)
                .ifPresent(builder::parallelScoring);
        config.getOptionalValue(PREFIX + "algorithms", String.class)
                .ifPresent(names -> builder.enabledAlgorithms(parseAlgorithms(names)));

        Map<String, Double> weights = readWeights();
        if (!weights.isEmpty()) {
            builder.algorithmWeights(AlgorithmWeights.of(weights));
        }

        CorrelationOptions options = builder.build();
        log.info("Loaded correlation options: {}", options);
        return options;
    }

    private Map<String, Double> readWeights() {
        List<String> names = new ArrayList<>();
        for (AlgorithmType type : AlgorithmType.values()) {
            names.add(type.getAlgorithmName());
        }
        names.add(AlgorithmWeights.ATTRIBUTE_LINK);

        Map<String, Double> weights = new LinkedHashMap<>();
        for (String name : names) {
            config.getOptionalValue(PREFIX + "weights." + name, Double.class)
                    .ifPresent(weight -> weights.put(name, weight));
        }
        return weights;
    }

    static Set<AlgorithmType> parseAlgorithms(String names) {
        Set<AlgorithmType> enabled = EnumSet.noneOf(AlgorithmType.class);
        for (String name : names.split(",")) {
            if (name.isBlank()) {
                continue;
            }
            enabled.add(AlgorithmType.fromName(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown correlation algorithm: " + name.trim())));
        }
        return enabled;
    }
}
