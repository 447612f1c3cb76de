package com.osint.correlation.correlation.algorithm;

import com.osint.correlation.core.model.Observation;
import com.osint.correlation.core.model.CorrelationResult;
import com.osint.correlation.similarity.StringMetrics;
import com.osint.correlation.similarity.TextNormalizer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Overlap ratio of the contact lists ({@code connections}, {@code followers}, {@code following})
 * of two observations. Handles are compared in normalised form. Zero overlap is a real 0.0 result,
 * missing data on either side is absent.
 */
public class NetworkCorrelation implements CorrelationAlgorithm {

    static final List<String> CONNECTION_ATTRIBUTES = List.of("connections", "followers", "following");

    @Override
    public Optional<CorrelationResult> score(Observation a, Observation b) {
        Set<String> contactsA = contactsOf(a);
        Set<String> contactsB = contactsOf(b);
        if (contactsA.isEmpty() || contactsB.isEmpty()) {
            return Optional.empty();
        }

        Set<String> shared = new TreeSet<>(contactsA);
        shared.retainAll(contactsB);
        double overlap = StringMetrics.jaccard(contactsA, contactsB);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sharedConnections", List.copyOf(shared));
        data.put("sizeA", contactsA.size());
        data.put("sizeB", contactsB.size());
        return Optional.of(CorrelationResult.of(getName(), overlap, a, b, data));
    }

    @Override
    public AlgorithmType getType() {
        return AlgorithmType.NETWORK;
    }

    static Set<String> contactsOf(Observation observation) {
        Set<String> contacts = new TreeSet<>();
        for (String key : CONNECTION_ATTRIBUTES) {
            for (String handle : observation.attributeAsStrings(key)) {
                String normalized = TextNormalizer.normalizeHandle(handle);
                if (!normalized.isEmpty()) {
                    contacts.add(normalized);
                }
            }
        }
        return contacts;
    }
}
