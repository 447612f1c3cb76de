package com.osint.correlation.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StringMetrics Tests")
class StringMetricsTest {

    @Nested
    @DisplayName("Levenshtein")
    class LevenshteinTests {

        @Test
        @DisplayName("Identical strings should return 1.0")
        void identical() {
            assertEquals(1.0, StringMetrics.levenshtein("johndoe", "johndoe"));
        }

        @Test
        @DisplayName("Null or empty strings should return 0.0")
        void nullOrEmpty() {
            assertEquals(0.0, StringMetrics.levenshtein(null, "test"));
            assertEquals(0.0, StringMetrics.levenshtein("test", null));
            assertEquals(0.0, StringMetrics.levenshtein("", "test"));
        }

        @Test
        @DisplayName("Edit distance counts insertions, deletions and substitutions")
        void editDistance() {
            assertEquals(3, StringMetrics.editDistance("kitten", "sitting"));
            assertEquals(0, StringMetrics.editDistance("abc", "abc"));
            assertEquals(3, StringMetrics.editDistance("", "abc"));
        }

        @ParameterizedTest
        @DisplayName("Single typos keep a high similarity")
        @CsvSource({
                "johndoe,jondoe,0.8",
                "janedoe,janedoe1,0.8",
                "microsoft,microsft,0.77"
        })
        void typos(String a, String b, double minExpected) {
            double score = StringMetrics.levenshtein(a, b);
            assertTrue(score >= minExpected, "Expected score >= " + minExpected + ", got " + score);
        }
    }

    @Nested
    @DisplayName("Jaro-Winkler")
    class JaroWinklerTests {

        @Test
        @DisplayName("Identical strings should return 1.0")
        void identical() {
            assertEquals(1.0, StringMetrics.jaroWinkler("martha", "martha"));
        }

        @Test
        @DisplayName("Classic MARTHA/MARHTA pair")
        void classicPair() {
            assertEquals(0.961, StringMetrics.jaroWinkler("martha", "marhta"), 0.001);
        }

        @Test
        @DisplayName("Disjoint strings should return 0.0")
        void disjoint() {
            assertEquals(0.0, StringMetrics.jaroWinkler("abc", "xyz"));
        }

        @Test
        @DisplayName("Shared prefix should score above plain Jaro")
        void prefixBoost() {
            assertTrue(StringMetrics.jaroWinkler("johnsmith", "johnsmyth") > 0.9);
        }
    }

    @Nested
    @DisplayName("Jaccard")
    class JaccardTests {

        @Test
        @DisplayName("Overlap ratio of two sets")
        void overlap() {
            assertEquals(0.5, StringMetrics.jaccard(Set.of("a", "b", "c"), Set.of("b", "c", "d")), 1e-9);
        }

        @Test
        @DisplayName("An empty side yields 0.0")
        void emptySide() {
            assertEquals(0.0, StringMetrics.jaccard(List.of(), List.of("a")));
            assertEquals(0.0, StringMetrics.jaccard(List.of(), List.of()));
        }

        @Test
        @DisplayName("Token Jaccard ignores case and punctuation")
        void tokens() {
            assertEquals(1.0, StringMetrics.tokenJaccard("San Francisco, CA", "san francisco ca"), 1e-9);
        }
    }
}
