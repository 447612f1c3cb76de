package com.osint.correlation.correlation;

import com.osint.correlation.core.model.CorrelationResult;

import java.util.Collection;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Combines per-algorithm confidences into one score.
 *
 * <p>Rule: results are grouped by correlation type and each type keeps its highest
 * confidence; the combined score is the weighted mean of those per-type scores, weights
 * taken from {@link AlgorithmWeights} and renormalised over the types present, clamped to
 * [0,1]. The same rule computes edge confidence in the engine and relationship confidence in
 * the graph, so a relationship's confidence can always be re-derived from its evidence.</p>
 */
public class ConfidenceCombiner {

    private final AlgorithmWeights weights;

    public ConfidenceCombiner(AlgorithmWeights weights) {
        this.weights = weights;
    }

    /**
     * @return the combined confidence, or empty when no evidence carries a positive weight
     */
    public OptionalDouble combine(Collection<CorrelationResult> evidence) {
        if (evidence == null || evidence.isEmpty()) {
            return OptionalDouble.empty();
        }
        Map<String, Double> bestPerType = new TreeMap<>();
        for (CorrelationResult result : evidence) {
            bestPerType.merge(result.correlationType(), result.confidence(), Math::max);
        }

        double weightedSum = 0.0;
        double weightTotal = 0.0;
        for (Map.Entry<String, Double> entry : bestPerType.entrySet()) {
            double weight = weights.weightFor(entry.getKey());
            weightedSum += weight * entry.getValue();
            weightTotal += weight;
        }
        if (weightTotal <= 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(clamp(weightedSum / weightTotal));
    }

    public AlgorithmWeights getWeights() {
        return weights;
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
