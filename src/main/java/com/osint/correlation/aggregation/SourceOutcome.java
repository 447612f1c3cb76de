package com.osint.correlation.aggregation;

import com.osint.correlation.core.model.Observation;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * How one source settled within a batch.
 *
 * @param sourceName   adapter name
 * @param observations observations attributed to the source, error observations included
 * @param attempts     adapter calls made (0 when served from cache or cancelled before starting)
 * @param elapsed      wall time from first attempt to settlement
 * @param errorReason  final failure reason, null on success
 * @param fromCache    true when every answer came from the observation cache
 */
public record SourceOutcome(
        String sourceName,
        List<Observation> observations,
        int attempts,
        Duration elapsed,
        String errorReason,
        boolean fromCache
) {
    public SourceOutcome {
        Objects.requireNonNull(sourceName, "sourceName is required");
        observations = observations != null ? List.copyOf(observations) : List.of();
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    public boolean succeeded() {
        return errorReason == null;
    }
}
