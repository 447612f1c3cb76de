package com.osint.correlation.correlation.algorithm;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Closed set of correlation algorithms, with the dispatch table that instantiates them by name.
 */
public enum AlgorithmType {
    USERNAME("username", UsernameCorrelation::new),
    EMAIL("email", EmailCorrelation::new),
    METADATA("metadata", MetadataCorrelation::new),
    NETWORK("network", NetworkCorrelation::new),
    TEMPORAL("temporal", TemporalCorrelation::new);

    private final String algorithmName;
    private final Supplier<CorrelationAlgorithm> factory;

    AlgorithmType(String algorithmName, Supplier<CorrelationAlgorithm> factory) {
        this.algorithmName = algorithmName;
        this.factory = factory;
    }

    /**
     * Name used as {@code correlationType} in results and as the weight key in configuration.
     */
    public String getAlgorithmName() {
        return algorithmName;
    }

    public CorrelationAlgorithm create() {
        return factory.get();
    }

    public static Optional<AlgorithmType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.algorithmName.equals(wanted))
                .findFirst();
    }

    /**
     * Default instances of every algorithm, in declaration order.
     */
    public static Map<AlgorithmType, CorrelationAlgorithm> defaultRegistry() {
        Map<AlgorithmType, CorrelationAlgorithm> registry = new EnumMap<>(AlgorithmType.class);
        for (AlgorithmType type : values()) {
            registry.put(type, type.create());
        }
        return Collections.unmodifiableMap(registry);
    }
}
