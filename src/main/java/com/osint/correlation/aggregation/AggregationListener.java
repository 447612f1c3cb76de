package com.osint.correlation.aggregation;

/**
 * Receives aggregation progress. Calls are serialised by the aggregator, so implementations
 * need no synchronisation of their own. Events are advisory: a throwing listener is logged
 * and ignored.
 */
public interface AggregationListener {

    AggregationListener NOOP = new AggregationListener() {};

    default void onSourceStarted(String sourceName) {
    }

    /**
     * Forwarded from the adapter's own progress callback.
     */
    default void onSourceProgress(String sourceName, int completed, int total) {
    }

    /**
     * A source settled: succeeded, failed, timed out or was cancelled.
     */
    default void onSourceCompleted(SourceOutcome outcome) {
    }

    /**
     * Emitted after each source settles.
     */
    default void onProgress(int sourcesCompleted, int sourcesTotal) {
    }

    default void onBatchCompleted(AggregationResult result) {
    }
}
