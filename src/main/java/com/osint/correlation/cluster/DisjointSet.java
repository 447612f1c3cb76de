package com.osint.correlation.cluster;

/**
 * Arena-indexed union-find over {@code 0..n-1} with union by rank and path halving.
 * Each root carries the confidence of its set; unions decay it so that a weak link can never
 * inherit the confidence of strong links elsewhere in the chain.
 */
final class DisjointSet {

    enum UnionOutcome { MERGED, SAME_SET, BELOW_FLOOR }

    private final int[] parent;
    private final int[] rank;
    private final double[] confidence;

    DisjointSet(int size) {
        parent = new int[size];
        rank = new int[size];
        confidence = new double[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
            confidence[i] = 1.0;
        }
    }

    int size() {
        return parent.length;
    }

    int find(int element) {
        int current = element;
        while (parent[current] != current) {
            parent[current] = parent[parent[current]];
            current = parent[current];
        }
        return current;
    }

    double confidenceOf(int element) {
        return confidence[find(element)];
    }

    /**
     * Confidence the union of the sets of {@code a} and {@code b} would get through an edge:
     * {@code min(edge, confA * edge, confB * edge)}.
     */
    double mergedConfidence(int a, int b, double edgeConfidence) {
        double decayedA = confidence[find(a)] * edgeConfidence;
        double decayedB = confidence[find(b)] * edgeConfidence;
        return Math.min(edgeConfidence, Math.min(decayedA, decayedB));
    }

    /**
     * Joins the sets of {@code a} and {@code b} unless they already coincide or the decayed
     * confidence would fall below {@code floor}.
     */
    UnionOutcome union(int a, int b, double edgeConfidence, double floor) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return UnionOutcome.SAME_SET;
        }
        double merged = mergedConfidence(rootA, rootB, edgeConfidence);
        if (merged < floor) {
            return UnionOutcome.BELOW_FLOOR;
        }
        link(rootA, rootB, merged);
        return UnionOutcome.MERGED;
    }

    /**
     * Joins two sets without decay, assigning the given confidence. Used to restore clusters
     * from an earlier pass.
     */
    void seed(int a, int b, double setConfidence) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA != rootB) {
            link(rootA, rootB, setConfidence);
        } else {
            confidence[rootA] = setConfidence;
        }
    }

    private void link(int rootA, int rootB, double setConfidence) {
        if (rank[rootA] < rank[rootB]) {
            parent[rootA] = rootB;
            confidence[rootB] = setConfidence;
        } else {
            parent[rootB] = rootA;
            confidence[rootA] = setConfidence;
            if (rank[rootA] == rank[rootB]) {
                rank[rootA]++;
            }
        }
    }
}
