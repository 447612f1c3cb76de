package com.osint.correlation.correlation.algorithm;

import com.osint.correlation.core.model.CorrelationResult;
import com.osint.correlation.core.model.Observation;

import java.util.Optional;

/**
 * Pairwise scorer deciding whether two observations refer to the same identity.
 * All scores are between 0.0 (no similarity) and 1.0 (same identity).
 *
 * <p>Implementations are stateless and deterministic: identical inputs always give identical
 * output, so the engine may call them from several threads at once. Scoring is symmetric:
 * {@code score(a, b)} and {@code score(b, a)} carry the same confidence.</p>
 */
public interface CorrelationAlgorithm {

    /**
     * Scores a candidate pair.
     *
     * @return the result, or empty when the algorithm has nothing to say about the pair
     * (missing data, similarity below its floor)
     */
    Optional<CorrelationResult> score(Observation a, Observation b);

    AlgorithmType getType();

    default String getName() {
        return getType().getAlgorithmName();
    }
}
