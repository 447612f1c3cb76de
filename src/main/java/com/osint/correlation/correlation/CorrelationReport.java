package com.osint.correlation.correlation;

import com.osint.correlation.core.model.CorrelationEdge;

import java.util.List;

/**
 * Output of one correlation pass.
 *
 * @param edges          emitted edges, sorted by endpoint ids
 * @param candidatePairs distinct pairs that shared a blocking key
 * @param comparisons    pairs actually scored (fewer than candidates when cancelled)
 * @param cancelled      true when the pass stopped early; edges then cover the scored pairs only
 */
public record CorrelationReport(
        List<CorrelationEdge> edges,
        long candidatePairs,
        long comparisons,
        boolean cancelled
) {
    public CorrelationReport {
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    public static CorrelationReport empty() {
        return new CorrelationReport(List.of(), 0, 0, false);
    }
}
