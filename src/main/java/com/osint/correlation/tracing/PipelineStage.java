package com.osint.correlation.tracing;

import java.util.Locale;

/**
 * Traced stages of one correlation run, in pipeline order.
 */
public enum PipelineStage {
    AGGREGATE("osint.aggregate"),
    CORRELATE("osint.correlate"),
    CLUSTER("osint.cluster"),
    GRAPH_COMMIT("osint.graph.commit");

    /** Span attribute carrying {@link #getLabel()}, for backends that group by attribute. */
    public static final String STAGE_ATTRIBUTE = "osint.stage";

    private final String spanName;

    PipelineStage(String spanName) {
        this.spanName = spanName;
    }

    public String getSpanName() {
        return spanName;
    }

    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
