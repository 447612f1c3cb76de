package com.osint.correlation.correlation.algorithm;

import com.osint.correlation.core.model.CorrelationResult;
import com.osint.correlation.core.model.Observation;
import com.osint.correlation.similarity.StringMetrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Token overlap (Jaccard) over the free-text profile attributes both observations carry.
 * The confidence is the mean over the shared keys.
 */
public class MetadataCorrelation implements CorrelationAlgorithm {

    static final List<String> FREE_TEXT_ATTRIBUTES =
            List.of("bio", "location", "company", "display_name", "website");

    @Override
    public Optional<CorrelationResult> score(Observation a, Observation b) {
        Map<String, Object> perAttribute = new LinkedHashMap<>();
        double total = 0.0;
        for (String key : FREE_TEXT_ATTRIBUTES) {
            String valueA = a.attributeAsString(key);
            String valueB = b.attributeAsString(key);
            if (valueA == null || valueB == null) {
                continue;
            }
            double similarity = StringMetrics.tokenJaccard(valueA, valueB);
            perAttribute.put(key, similarity);
            total += similarity;
        }
        if (perAttribute.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sharedAttributes", List.copyOf(perAttribute.keySet()));
        data.put("similarities", perAttribute);
        return Optional.of(CorrelationResult.of(getName(), total / perAttribute.size(), a, b, data));
    }

    @Override
    public AlgorithmType getType() {
        return AlgorithmType.METADATA;
    }
}
