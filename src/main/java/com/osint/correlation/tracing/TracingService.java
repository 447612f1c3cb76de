package com.osint.correlation.tracing;

import java.util.Map;

/**
 * Tracing integration point. {@link NoOpTracingService} is the default so the pipeline
 * runs without any tracing backend configured.
 */
public interface TracingService {

    /**
     * Opens the span of one pipeline stage.
     *
     * @param inputSizes counts known when the stage starts, such as sources or observations
     */
    Span startSpan(PipelineStage stage, Map<String, Long> inputSizes);
}
