package com.osint.correlation.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of one correlation algorithm for one pair of observations.
 *
 * @param correlationType algorithm name (e.g. {@code username})
 * @param confidence      score in [0,1]
 * @param sources         observation ids involved
 * @param data            explanatory payload (match type, similarity breakdown...)
 */
public record CorrelationResult(
        String correlationType,
        double confidence,
        List<String> sources,
        Map<String, Object> data
) {
    public CorrelationResult {
        Objects.requireNonNull(correlationType, "correlationType is required");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "confidence must be between 0.0 and 1.0, got " + confidence);
        }
        sources = sources != null ? List.copyOf(sources) : List.of();
        data = data != null ? Map.copyOf(data) : Map.of();
    }

    public static CorrelationResult of(String correlationType, double confidence,
                                       Observation a, Observation b, Map<String, Object> data) {
        return new CorrelationResult(correlationType, confidence, List.of(a.id(), b.id()), data);
    }
}
