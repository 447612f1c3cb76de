package com.osint.correlation.similarity;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * String and set similarity measures. Every method returns a score in [0,1],
 * 1.0 meaning identical.
 */
public final class StringMetrics {

    private static final double WINKLER_SCALING = 0.1;
    private static final int WINKLER_MAX_PREFIX = 4;

    private StringMetrics() {
    }

    /**
     * Normalised edit similarity: {@code 1 - distance / max(len)}.
     */
    public static double levenshtein(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int distance = editDistance(a, b);
        return 1.0 - ((double) distance / Math.max(a.length(), b.length()));
    }

    /**
     * Levenshtein distance, two-row Wagner-Fischer over the shorter string.
     */
    public static int editDistance(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        int m = shorter.length();

        int[] previous = new int[m + 1];
        int[] current = new int[m + 1];
        for (int i = 0; i <= m; i++) {
            previous[i] = i;
        }
        for (int j = 1; j <= longer.length(); j++) {
            current[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i <= m; i++) {
                int substitution = previous[i - 1] + (shorter.charAt(i - 1) == c ? 0 : 1);
                current[i] = Math.min(substitution, Math.min(current[i - 1], previous[i]) + 1);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[m];
    }

    /**
     * Jaro-Winkler similarity with the standard 0.1 prefix scaling over at most 4 characters.
     */
    public static double jaroWinkler(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        double jaro = jaro(a, b);
        int limit = Math.min(WINKLER_MAX_PREFIX, Math.min(a.length(), b.length()));
        int prefix = 0;
        while (prefix < limit && a.charAt(prefix) == b.charAt(prefix)) {
            prefix++;
        }
        return jaro + prefix * WINKLER_SCALING * (1.0 - jaro);
    }

    private static double jaro(String a, String b) {
        int window = Math.max(0, Math.max(a.length(), b.length()) / 2 - 1);
        boolean[] matchedA = new boolean[a.length()];
        boolean[] matchedB = new boolean[b.length()];

        int matches = 0;
        for (int i = 0; i < a.length(); i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(i + window + 1, b.length());
            for (int j = from; j < to; j++) {
                if (!matchedB[j] && a.charAt(i) == b.charAt(j)) {
                    matchedA[i] = true;
                    matchedB[j] = true;
                    matches++;
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int halfTranspositions = 0;
        int k = 0;
        for (int i = 0; i < a.length(); i++) {
            if (!matchedA[i]) {
                continue;
            }
            while (!matchedB[k]) {
                k++;
            }
            if (a.charAt(i) != b.charAt(k)) {
                halfTranspositions++;
            }
            k++;
        }
        double m = matches;
        double t = halfTranspositions / 2.0;
        return (m / a.length() + m / b.length() + (m - t) / m) / 3.0;
    }

    /**
     * Jaccard index {@code |A ∩ B| / |A ∪ B|}. Two empty sets score 0.0: no shared evidence.
     */
    public static double jaccard(Collection<String> a, Collection<String> b) {
        Set<String> left = new HashSet<>(a);
        Set<String> right = new HashSet<>(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (String token : left) {
            if (right.contains(token)) {
                intersection++;
            }
        }
        int union = left.size() + right.size() - intersection;
        return (double) intersection / union;
    }

    /**
     * Jaccard index over the word tokens of two free-text values.
     */
    public static double tokenJaccard(String a, String b) {
        return jaccard(TextNormalizer.tokens(a), TextNormalizer.tokens(b));
    }
}
