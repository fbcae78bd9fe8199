package com.sop.network.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * Reports build and resolution spans through OpenTelemetry.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>Every operation runs in-process, so spans are {@link SpanKind#INTERNAL}.
 * Reference spans started on resolver workers attach to whatever context is
 * current on that thread.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    public static final String INSTRUMENTATION_SCOPE = "com.sop.network";

    private final Tracer tracer;

    public OpenTelemetryTracingService(OpenTelemetry openTelemetry) {
        this(openTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(Operation operation, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operation.getSpanName()).setSpanKind(SpanKind.INTERNAL);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new OperationSpan(builder.startSpan());
    }

    private static final class OperationSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        private OperationSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void succeed() {
            delegate.setStatus(StatusCode.OK);
        }

        @Override
        public void fail(Throwable cause) {
            delegate.recordException(cause);
            String description = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            delegate.setStatus(StatusCode.ERROR, description);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
