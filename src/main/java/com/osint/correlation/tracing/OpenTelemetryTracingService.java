package com.osint.correlation.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * OpenTelemetry-backed {@link TracingService}. Each {@link PipelineStage} becomes an internal span
 * named after the stage, tagged with {@value PipelineStage#STAGE_ATTRIBUTE} and the stage's input
 * sizes as long attributes.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String INSTRUMENTATION_SCOPE = "osint-correlation";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    /**
     * Uses the tracer of the {@code osint-correlation} instrumentation scope.
     */
    public OpenTelemetryTracingService(OpenTelemetry openTelemetry) {
        this(openTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Override
    public Span startSpan(PipelineStage stage, Map<String, Long> inputSizes) {
        SpanBuilder builder = tracer.spanBuilder(stage.getSpanName())
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(PipelineStage.STAGE_ATTRIBUTE, stage.getLabel());
        if (inputSizes != null) {
            inputSizes.forEach((key, size) -> builder.setAttribute(key, size.longValue()));
        }
        return new StageSpan(builder.startSpan());
    }

    private static class StageSpan implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;

        StageSpan(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void setAttribute(String key, long value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            otelSpan.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            otelSpan.recordException(t);
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}
