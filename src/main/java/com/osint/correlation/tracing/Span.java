package com.osint.correlation.tracing;

/**
 * A traced pipeline stage. Closing the span ends it.
 *
 * <pre>
 * try (Span span = tracingService.startSpan(PipelineStage.CLUSTER, Map.of("edges", 12L))) {
 *     span.setAttribute("clusters", clusters.size());
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Marks the stage as failed with {@code cause}. Call before the span is closed.
     */
    default void fail(Throwable cause) {
        recordException(cause);
        setStatus(SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
