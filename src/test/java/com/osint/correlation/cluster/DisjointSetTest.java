package com.osint.correlation.cluster;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DisjointSet Tests")
class DisjointSetTest {

    @Test
    @DisplayName("Singletons start in their own set with confidence 1.0")
    void singletons() {
        DisjointSet sets = new DisjointSet(3);

        assertNotEquals(sets.find(0), sets.find(1));
        assertEquals(1.0, sets.confidenceOf(2));
    }

    @Test
    @DisplayName("A chain takes the confidence of its weakest link")
    void chainDecay() {
        DisjointSet sets = new DisjointSet(3);

        assertEquals(DisjointSet.UnionOutcome.MERGED, sets.union(0, 1, 0.9, 0.0));
        assertEquals(DisjointSet.UnionOutcome.MERGED, sets.union(1, 2, 0.3, 0.0));

        assertEquals(sets.find(0), sets.find(2));
        assertEquals(0.27, sets.confidenceOf(0), 1e-9);
        assertTrue(sets.confidenceOf(0) <= 0.3);
    }

    @Test
    @DisplayName("A union below the floor is refused and leaves the sets apart")
    void belowFloor() {
        DisjointSet sets = new DisjointSet(3);
        sets.union(0, 1, 0.9, 0.5);

        assertEquals(DisjointSet.UnionOutcome.BELOW_FLOOR, sets.union(1, 2, 0.5, 0.5));
        assertNotEquals(sets.find(1), sets.find(2));
        assertEquals(0.9, sets.confidenceOf(1), 1e-9);
    }

    @Test
    @DisplayName("Re-applying an edge inside a set changes nothing")
    void sameSet() {
        DisjointSet sets = new DisjointSet(2);
        sets.union(0, 1, 0.8, 0.0);

        assertEquals(DisjointSet.UnionOutcome.SAME_SET, sets.union(1, 0, 0.8, 0.0));
        assertEquals(0.8, sets.confidenceOf(0), 1e-9);
    }

    @Test
    @DisplayName("Seeding restores a set with its confidence")
    void seed() {
        DisjointSet sets = new DisjointSet(3);
        sets.seed(0, 2, 0.42);

        assertEquals(sets.find(0), sets.find(2));
        assertEquals(0.42, sets.confidenceOf(2), 1e-9);
    }
}
