package com.osint.correlation.correlation.algorithm;

import com.osint.correlation.core.model.CorrelationResult;
import com.osint.correlation.core.model.Observation;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Activity proximity: {@code exp(-Δt / τ)} over the {@code last_active} timestamps.
 */
public class TemporalCorrelation implements CorrelationAlgorithm {

    public static final Duration DEFAULT_DECAY = Duration.ofHours(24);
    static final String TIMESTAMP_ATTRIBUTE = "last_active";

    private final Duration decay;

    public TemporalCorrelation() {
        this(DEFAULT_DECAY);
    }

    public TemporalCorrelation(Duration decay) {
        if (decay == null || decay.isZero() || decay.isNegative()) {
            throw new IllegalArgumentException("decay must be positive");
        }
        this.decay = decay;
    }

    @Override
    public Optional<CorrelationResult> score(Observation a, Observation b) {
        Instant activeA = a.attributeAsInstant(TIMESTAMP_ATTRIBUTE);
        Instant activeB = b.attributeAsInstant(TIMESTAMP_ATTRIBUTE);
        if (activeA == null || activeB == null) {
            return Optional.empty();
        }
        Duration delta = Duration.between(activeA, activeB).abs();
        double confidence = Math.exp(-(double) delta.toMillis() / decay.toMillis());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("deltaSeconds", delta.getSeconds());
        data.put("decaySeconds", decay.getSeconds());
        return Optional.of(CorrelationResult.of(getName(), confidence, a, b, data));
    }

    @Override
    public AlgorithmType getType() {
        return AlgorithmType.TEMPORAL;
    }
}
