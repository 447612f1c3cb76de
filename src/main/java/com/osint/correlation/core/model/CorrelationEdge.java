package com.osint.correlation.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A scored claim that two observations refer to the same identity.
 * Endpoints are stored in lexicographic order so that an edge has one canonical form.
 *
 * @param sourceObservationId the lexicographically smaller observation id
 * @param targetObservationId the lexicographically larger observation id
 * @param confidence          combined confidence in [0,1]
 * @param evidence            per-algorithm results the confidence was combined from
 */
public record CorrelationEdge(
        String sourceObservationId,
        String targetObservationId,
        double confidence,
        List<CorrelationResult> evidence
) {
    /**
     * Strongest edges first, ties broken by endpoint ids.
     */
    public static final Comparator<CorrelationEdge> STRONGEST_FIRST =
            Comparator.comparingDouble(CorrelationEdge::confidence).reversed()
                    .thenComparing(CorrelationEdge::sourceObservationId)
                    .thenComparing(CorrelationEdge::targetObservationId);

    public CorrelationEdge {
        Objects.requireNonNull(sourceObservationId, "sourceObservationId is required");
        Objects.requireNonNull(targetObservationId, "targetObservationId is required");
        if (sourceObservationId.equals(targetObservationId)) {
            throw new IllegalArgumentException("edge endpoints must differ: " + sourceObservationId);
        }
        if (sourceObservationId.compareTo(targetObservationId) > 0) {
            String swap = sourceObservationId;
            sourceObservationId = targetObservationId;
            targetObservationId = swap;
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "confidence must be between 0.0 and 1.0, got " + confidence);
        }
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }

    public static CorrelationEdge of(String a, String b, double confidence) {
        return new CorrelationEdge(a, b, confidence, List.of());
    }
}
