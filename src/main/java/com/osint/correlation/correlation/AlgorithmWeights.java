package com.osint.correlation.correlation;

import com.osint.correlation.correlation.algorithm.AlgorithmType;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-algorithm weights used by {@link ConfidenceCombiner}.
 *
 * <p>Weights are relative: the combiner renormalises them over the algorithms that
 * produced a result for a pair. Algorithms without an explicit weight get
 * {@link #DEFAULT_WEIGHT}, which yields equal weighting when nothing is configured.</p>
 */
public final class AlgorithmWeights {

    public static final double DEFAULT_WEIGHT = 1.0;

    /**
     * Correlation type used for evidence derived from shared attributes rather than an algorithm.
     */
    public static final String ATTRIBUTE_LINK = "attribute";

    private final Map<String, Double> weights;

    private AlgorithmWeights(Map<String, Double> weights) {
        this.weights = Collections.unmodifiableMap(new TreeMap<>(weights));
    }

    public static AlgorithmWeights equal() {
        return new AlgorithmWeights(Map.of());
    }

    /**
     * Creates weights from a name to weight mapping.
     *
     * @throws IllegalArgumentException for unknown names, negative or non-finite weights,
     *                                  or when every configured weight is zero
     */
    public static AlgorithmWeights of(Map<String, Double> weights) {
        Map<String, Double> normalized = new TreeMap<>();
        weights.forEach((name, weight) -> {
            String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
            if (!ATTRIBUTE_LINK.equals(key) && AlgorithmType.fromName(key).isEmpty()) {
                throw new IllegalArgumentException("Unknown correlation algorithm: " + name);
            }
            if (weight == null || weight.isNaN() || weight.isInfinite() || weight < 0.0) {
                throw new IllegalArgumentException(
                        "Weight for '" + key + "' must be a non-negative finite number, got " + weight);
            }
            normalized.put(key, weight);
        });
        boolean anyPositive = false;
        for (AlgorithmType type : AlgorithmType.values()) {
            if (normalized.getOrDefault(type.getAlgorithmName(), DEFAULT_WEIGHT) > 0.0) {
                anyPositive = true;
            }
        }
        if (!anyPositive) {
            throw new IllegalArgumentException("At least one algorithm weight must be positive");
        }
        return new AlgorithmWeights(normalized);
    }

    public double weightFor(String correlationType) {
        return weights.getOrDefault(correlationType, DEFAULT_WEIGHT);
    }

    public Map<String, Double> asMap() {
        return weights;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlgorithmWeights that)) return false;
        return weights.equals(that.weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return weights.isEmpty() ? "AlgorithmWeights{equal}" : "AlgorithmWeights" + weights;
    }
}
