package com.osint.correlation.aggregation;

import com.osint.correlation.core.model.Observation;
import com.osint.correlation.core.model.ObservationStatus;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one aggregation batch. Always returned, even when every source failed.
 *
 * @param batchId      id used in logs (MDC {@code batchId})
 * @param observations every observation in source order, ids unique
 * @param outcomes     one entry per configured source, in configuration order
 * @param cancelled    true when the batch was cancelled or hit its deadline; results are partial
 */
public record AggregationResult(
        String batchId,
        List<Observation> observations,
        List<SourceOutcome> outcomes,
        boolean cancelled
) {
    public AggregationResult {
        observations = observations != null ? List.copyOf(observations) : List.of();
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
    }

    public Map<ObservationStatus, Long> countsByStatus() {
        Map<ObservationStatus, Long> counts = new EnumMap<>(ObservationStatus.class);
        for (ObservationStatus status : ObservationStatus.values()) {
            counts.put(status, 0L);
        }
        observations.forEach(o -> counts.merge(o.status(), 1L, Long::sum));
        return counts;
    }

    public long foundCount() {
        return countsByStatus().get(ObservationStatus.FOUND);
    }

    public long notFoundCount() {
        return countsByStatus().get(ObservationStatus.NOT_FOUND);
    }

    public long errorCount() {
        return countsByStatus().get(ObservationStatus.ERROR);
    }

    public List<Observation> observationsFrom(String sourceName) {
        return outcomes.stream()
                .filter(o -> o.sourceName().equals(sourceName))
                .flatMap(o -> o.observations().stream())
                .toList();
    }
}
