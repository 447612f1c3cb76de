package com.osint.correlation.correlation.algorithm;

import com.osint.correlation.core.model.CorrelationResult;
import com.osint.correlation.core.model.Observation;
import com.osint.correlation.similarity.StringMetrics;
import com.osint.correlation.similarity.TextNormalizer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Username similarity across platforms.
 *
 * <p>Handles are case-folded and stripped of punctuation ({@code John.Doe -> johndoe}).
 * Equal normalised handles score 1.0; otherwise the similarity is the mean of Levenshtein and
 * Jaro-Winkler. Handles that only differ by a trailing number ({@code johndoe99}) score at least
 * {@link #NUMERIC_SUFFIX_SIMILARITY}. The similarity is scaled by 0.9 and an exact normalised match
 * seen on two different sources earns the remaining 0.1.</p>
 */
public class UsernameCorrelation implements CorrelationAlgorithm {

    public static final double DEFAULT_MIN_SIMILARITY = 0.3;
    static final double NUMERIC_SUFFIX_SIMILARITY = 0.85;
    static final double SIMILARITY_SHARE = 0.9;
    static final double CROSS_PLATFORM_BONUS = 0.1;
    private static final int MIN_STRIPPED_LENGTH = 3;

    private final double minSimilarity;

    public UsernameCorrelation() {
        this(DEFAULT_MIN_SIMILARITY);
    }

    public UsernameCorrelation(double minSimilarity) {
        if (minSimilarity < 0.0 || minSimilarity > 1.0) {
            throw new IllegalArgumentException("minSimilarity must be between 0.0 and 1.0");
        }
        this.minSimilarity = minSimilarity;
    }

    @Override
    public Optional<CorrelationResult> score(Observation a, Observation b) {
        String handleA = TextNormalizer.normalizeHandle(usernameOf(a));
        String handleB = TextNormalizer.normalizeHandle(usernameOf(b));
        if (handleA.isEmpty() || handleB.isEmpty()) {
            return Optional.empty();
        }

        String matchType;
        double similarity;
        if (handleA.equals(handleB)) {
            matchType = "exact";
            similarity = 1.0;
        } else {
            similarity = 0.5 * StringMetrics.levenshtein(handleA, handleB)
                    + 0.5 * StringMetrics.jaroWinkler(handleA, handleB);
            matchType = "fuzzy";
            if (isNumericSuffixVariant(handleA, handleB) && similarity < NUMERIC_SUFFIX_SIMILARITY) {
                similarity = NUMERIC_SUFFIX_SIMILARITY;
                matchType = "numeric_suffix";
            }
        }
        if (similarity < minSimilarity) {
            return Optional.empty();
        }

        boolean crossPlatform = "exact".equals(matchType) && !a.sourceId().equals(b.sourceId());
        double confidence = similarity * SIMILARITY_SHARE + (crossPlatform ? CROSS_PLATFORM_BONUS : 0.0);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("matchType", matchType);
        data.put("similarity", similarity);
        data.put("normalizedA", handleA);
        data.put("normalizedB", handleB);
        data.put("crossPlatform", crossPlatform);
        return Optional.of(CorrelationResult.of(getName(), Math.min(1.0, confidence), a, b, data));
    }

    @Override
    public AlgorithmType getType() {
        return AlgorithmType.USERNAME;
    }

    /**
     * The {@code username} attribute when present, the queried value otherwise.
     */
    static String usernameOf(Observation observation) {
        String username = observation.attributeAsString("username");
        if (username != null) {
            return username;
        }
        return observation.queryValue().contains("@") ? null : observation.queryValue();
    }

    private static boolean isNumericSuffixVariant(String a, String b) {
        String strippedA = TextNormalizer.stripTrailingDigits(a);
        String strippedB = TextNormalizer.stripTrailingDigits(b);
        return strippedA.length() >= MIN_STRIPPED_LENGTH && strippedA.equals(strippedB);
    }
}
