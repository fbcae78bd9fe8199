package com.sop.network.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @ParameterizedTest
    @CsvSource({
            "BUILD, sop.build",
            "RESOLVE_ALL, sop.resolve_all",
            "RESOLVE_REFERENCE, sop.resolve_reference"
    })
    @DisplayName("Operations map to stable span names")
    void spanNames(Operation operation, String spanName) {
        assertEquals(spanName, operation.getSpanName());
    }

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startBuild("sop-1000")) {
                    span.setAttribute(SpanAttributes.NETWORK_NODES, 18L);
                    span.setAttribute(SpanAttributes.REFERENCE_OUTCOME, "resolved");
                    span.fail(new RuntimeException("test"));
                    span.succeed();
                }
            });
        }

        @Test
        @DisplayName("Should return same singleton span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startResolution("sop-1000"), noOp.startReference("PR.OP.CL.2862"));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer mockTracer;
        private SpanBuilder mockBuilder;
        private io.opentelemetry.api.trace.Span mockOtelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            mockTracer = mock(Tracer.class);
            mockBuilder = mock(SpanBuilder.class);
            mockOtelSpan = mock(io.opentelemetry.api.trace.Span.class);

            when(mockTracer.spanBuilder(anyString())).thenReturn(mockBuilder);
            when(mockBuilder.setSpanKind(any())).thenReturn(mockBuilder);
            when(mockBuilder.startSpan()).thenReturn(mockOtelSpan);

            service = new OpenTelemetryTracingService(mockTracer);
        }

        @Test
        @DisplayName("A reference span is internal and carries the reference code")
        void referenceSpan() {
            Span span = service.startReference("PR.OP.CL.2862");

            assertNotNull(span);
            verify(mockTracer).spanBuilder("sop.resolve_reference");
            verify(mockBuilder).setSpanKind(SpanKind.INTERNAL);
            verify(mockBuilder).setAttribute(SpanAttributes.REFERENCE_CODE, "PR.OP.CL.2862");
            verify(mockBuilder).startSpan();
        }

        @Test
        @DisplayName("Build and resolution spans carry the document key")
        void documentSpans() {
            service.startBuild("sop-1000");
            service.startSpan(Operation.RESOLVE_ALL, Map.of(SpanAttributes.DOCUMENT_KEY, "sop-1000"));

            verify(mockTracer).spanBuilder("sop.build");
            verify(mockTracer).spanBuilder("sop.resolve_all");
            verify(mockBuilder, times(2)).setAttribute(SpanAttributes.DOCUMENT_KEY, "sop-1000");
        }

        @Test
        @DisplayName("A failure records the cause and its message as the error status")
        void fail() {
            Span span = service.startBuild("sop-1000");
            span.setAttribute(SpanAttributes.NETWORK_NODES, 18L);
            RuntimeException ex = new RuntimeException("share unavailable");
            span.fail(ex);

            verify(mockOtelSpan).setAttribute(SpanAttributes.NETWORK_NODES, 18L);
            verify(mockOtelSpan).recordException(ex);
            verify(mockOtelSpan).setStatus(StatusCode.ERROR, "share unavailable");
        }

        @Test
        @DisplayName("A failure without a message is described by its type")
        void failWithoutMessage() {
            service.startReference("PR.OP.CL.2862").fail(new IllegalStateException());

            verify(mockOtelSpan).setStatus(StatusCode.ERROR, "IllegalStateException");
        }

        @Test
        @DisplayName("Should end span on close")
        void endOnClose() {
            try (Span span = service.startResolution("sop-1000")) {
                span.succeed();
            }

            verify(mockOtelSpan).setStatus(StatusCode.OK);
            verify(mockOtelSpan).end();
        }
    }
}
