package com.osint.correlation.api;

import com.osint.correlation.aggregation.AggregationResult;
import com.osint.correlation.cluster.ClusteringResult;
import com.osint.correlation.correlation.CorrelationReport;
import com.osint.correlation.graph.BatchCommitResult;
import com.osint.correlation.graph.GraphSnapshot;

import java.util.Objects;

/**
 * Everything one pipeline pass produced, stage by stage.
 *
 * @param aggregation source answers, one outcome per adapter
 * @param correlation scored edges between found observations
 * @param clustering  clusters and the entities built from them
 * @param commit      what the graph accepted and rejected
 * @param snapshot    graph export taken right after the commit
 */
public record CorrelationRun(
        AggregationResult aggregation,
        CorrelationReport correlation,
        ClusteringResult clustering,
        BatchCommitResult commit,
        GraphSnapshot snapshot
) {
    public CorrelationRun {
        Objects.requireNonNull(aggregation, "aggregation is required");
        Objects.requireNonNull(correlation, "correlation is required");
        Objects.requireNonNull(clustering, "clustering is required");
        Objects.requireNonNull(commit, "commit is required");
        Objects.requireNonNull(snapshot, "snapshot is required");
    }

    public boolean cancelled() {
        return aggregation.cancelled() || correlation.cancelled();
    }

    public Summary summary() {
        return new Summary(
                aggregation.foundCount(),
                aggregation.notFoundCount(),
                aggregation.errorCount(),
                correlation.edges().size(),
                clustering.entities().size(),
                clustering.conflictCount(),
                commit.rejected().size());
    }

    /**
     * Counts reported at the end of a run.
     */
    public record Summary(
            long found,
            long notFound,
            long errors,
            int edges,
            int entities,
            int conflicts,
            int rejectedWrites
    ) {
        @Override
        public String toString() {
            return "found=" + found + " notFound=" + notFound + " errors=" + errors + " edges=" + edges
                    + " entities=" + entities + " conflicts=" + conflicts + " rejectedWrites=" + rejectedWrites;
        }
    }
}
