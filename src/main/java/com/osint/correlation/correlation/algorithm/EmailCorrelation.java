package com.osint.correlation.correlation.algorithm;

import com.osint.correlation.core.model.CorrelationResult;
import com.osint.correlation.core.model.Observation;
import com.osint.correlation.similarity.TextNormalizer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Email address matching.
 *
 * <ul>
 *   <li>exact address: 1.0</li>
 *   <li>same domain, local parts equal once separators are removed ({@code john.doe} / {@code john_doe}): 0.65</li>
 *   <li>same domain only: 0.3</li>
 * </ul>
 * Anything else is absent.
 */
public class EmailCorrelation implements CorrelationAlgorithm {

    static final double EXACT = 1.0;
    static final double SEPARATOR_VARIANT = 0.65;
    static final double SAME_DOMAIN = 0.3;

    @Override
    public Optional<CorrelationResult> score(Observation a, Observation b) {
        String emailA = emailOf(a);
        String emailB = emailOf(b);
        if (emailA == null || emailB == null) {
            return Optional.empty();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("emailA", emailA);
        data.put("emailB", emailB);
        if (emailA.equals(emailB)) {
            data.put("matchType", "exact");
            return Optional.of(CorrelationResult.of(getName(), EXACT, a, b, data));
        }

        String domain = TextNormalizer.emailDomain(emailA);
        if (!domain.equals(TextNormalizer.emailDomain(emailB))) {
            return Optional.empty();
        }
        data.put("domain", domain);

        String localA = TextNormalizer.normalizeHandle(TextNormalizer.emailLocalPart(emailA));
        String localB = TextNormalizer.normalizeHandle(TextNormalizer.emailLocalPart(emailB));
        if (!localA.isEmpty() && localA.equals(localB)) {
            data.put("matchType", "separator_variant");
            return Optional.of(CorrelationResult.of(getName(), SEPARATOR_VARIANT, a, b, data));
        }
        data.put("matchType", "domain");
        return Optional.of(CorrelationResult.of(getName(), SAME_DOMAIN, a, b, data));
    }

    @Override
    public AlgorithmType getType() {
        return AlgorithmType.EMAIL;
    }

    /**
     * The {@code email} attribute when present, or the queried value when it is an address.
     */
    static String emailOf(Observation observation) {
        String email = TextNormalizer.normalizeEmail(observation.attributeAsString("email"));
        if (email != null) {
            return email;
        }
        return TextNormalizer.normalizeEmail(observation.queryValue());
    }
}
